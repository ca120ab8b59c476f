package com.subwayly.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SubwaylyApplication {

	public static void main(String[] args) {
		SpringApplication.run(SubwaylyApplication.class, args);
	}

}
