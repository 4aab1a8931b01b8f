package com.warehouse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Warehouse inventory service.
 *
 * Tracks which articles make up each product and how many of every article
 * are on hand, and sells products by decrementing article stock atomically.
 */
@SpringBootApplication
public class WarehouseInventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(WarehouseInventoryApplication.class, args);
    }
}
