package com.meteocache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for MeteoCache - TTL-bounded storage and lookup of city weather forecasts.
 */
@SpringBootApplication
@EnableScheduling
public class MeteoCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeteoCacheApplication.class, args);
    }
}
