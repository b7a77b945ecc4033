package com.resona;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for Resona - alert speech synthesis with tiered audio caching.
 */
@SpringBootApplication
@EnableScheduling
public class ResonaApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResonaApplication.class, args);
    }
}
