package com.github.dimitryivaniuta.iam.projection.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Registers the projection engine properties.
 */
@AutoConfiguration
@EnableConfigurationProperties({
        ProjectionProperties.class
})
public class ProjectionAutoConfiguration {
    // engine beans are wired by the service
}
