package com.warehouse.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Logs which release is serving, where, and with which request deadline.
 */
@Component
@Slf4j
public class ServiceInfoLogger {

    private final String serviceName;
    private final String release;
    private final String environment;
    private final Duration backendTimeout;

    public ServiceInfoLogger(
            @Value("${spring.application.name:warehouse-inventory-service}") String serviceName,
            @Value("${app.release:dev}") String release,
            @Value("${app.environment:local}") String environment,
            @Value("${app.inventory.backend-timeout:25s}") Duration backendTimeout) {
        this.serviceName = serviceName;
        this.release = release;
        this.environment = environment;
        this.backendTimeout = backendTimeout;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logServiceInfo() {
        log.info("{} ready: release={}, environment={}, backendTimeout={}",
                serviceName, release, environment, backendTimeout);
    }
}
