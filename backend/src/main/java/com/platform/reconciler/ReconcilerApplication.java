package com.platform.reconciler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * System Reconciler Application
 * 
 * Converges a host from its current declared configuration to a desired one:
 * - Change detection and classification (live / service reload / reboot)
 * - Live updates with snapshot and rollback
 * - Container and layer deployment (podman, docker, toolbox, distrobox)
 * - Aggregated health of containers, layers and host services
 */
@SpringBootApplication
@EnableAsync
@EnableScheduling
public class ReconcilerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReconcilerApplication.class, args);
    }
}
