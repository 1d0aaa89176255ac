package com.cronium.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * Cronium application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.cronium")
public class CroniumApplication {

    public static void main(String[] args) {
        SpringApplication.run(CroniumApplication.class, args);
    }
}
