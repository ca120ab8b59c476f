package com.subwayly.backend.model;

import lombok.Value;

@Value
public class Stop {
    String id;
    String name;
}
