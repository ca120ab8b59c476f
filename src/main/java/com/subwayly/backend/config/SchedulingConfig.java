package com.subwayly.backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the scheduled network refresh everywhere except the test profile.
 */
@Configuration
@EnableScheduling
@Profile("!test")
public class SchedulingConfig {
}
