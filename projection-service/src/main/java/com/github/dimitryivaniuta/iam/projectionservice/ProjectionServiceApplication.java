package com.github.dimitryivaniuta.iam.projectionservice;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Projection Service.
 * Keeps the IAM read tables up to date from the event store.
 */
@Slf4j
@SpringBootApplication
public class ProjectionServiceApplication {

    /**
     * Main method to launch the Projection Service application.
     *
     * @param args command-line arguments passed to the application
     */
    public static void main(final String[] args) {
        SpringApplication.run(ProjectionServiceApplication.class, args);
        log.info("Projection Service application started successfully.");
    }
}
