package com.tidewatch.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Tidewatch application entry point.
 */
@SpringBootApplication
public class TidewatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TidewatchApplication.class, args);
    }
}
