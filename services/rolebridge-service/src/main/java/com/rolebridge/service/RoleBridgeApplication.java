package com.rolebridge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * RoleBridge service: keeps PostgreSQL roles in step with application identities.
 *
 * <p>Identity events published through Spring's {@code ApplicationEventPublisher} are synchronized
 * after the publishing transaction commits. Deferred events are retried on a fixed delay, and
 * declared table permissions are applied after every Flyway migration.
 */
@SpringBootApplication
@EnableScheduling
public class RoleBridgeApplication {

    private static final Logger log = LoggerFactory.getLogger(RoleBridgeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RoleBridgeApplication.class, args);
        log.info("RoleBridge service started successfully");
    }
}
