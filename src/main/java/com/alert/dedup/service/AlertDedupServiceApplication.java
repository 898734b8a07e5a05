package com.alert.dedup.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Alert Dedup Service Application - Entry point for the Spring Boot application.
 *
 * This application reduces the volume of monitoring alerts an operator has to act on:
 * - Drops repeats of the same alert within a time window
 * - Suppresses known noise through an ordered rule set
 * - Never suppresses alerts mentioning critical keywords
 * - Orders what is left by severity and recency
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.alert.dedup.service.config")
public class AlertDedupServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlertDedupServiceApplication.class, args);
    }
}
