package com.github.dimitryivaniuta.iam.projectionservice.lifecycle;

import com.github.dimitryivaniuta.iam.projection.handler.ProjectionEngine;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the projections once the application is ready and stops them on shutdown.
 */
@Component
@RequiredArgsConstructor
public class ProjectionLifecycle {

    private final ProjectionEngine engine;

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        engine.start();
    }

    @PreDestroy
    public void stop() {
        engine.stop();
    }
}
