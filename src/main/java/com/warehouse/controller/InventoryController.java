package com.warehouse.controller;

import com.warehouse.exception.ConnectivityException;
import com.warehouse.model.ApiResponse;
import com.warehouse.model.Deadline;
import com.warehouse.model.Inventory;
import com.warehouse.model.ProductStock;
import com.warehouse.model.Products;
import com.warehouse.model.Stock;
import com.warehouse.service.InventoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

/**
 * HTTP entry points of the warehouse.
 *
 * GET  /warehouse/v1/health               → store liveness
 * GET  /warehouse/v1/inventory            → article stock
 * GET  /warehouse/v1/product              → products that can be sold
 * POST /warehouse/v1/product              → upload product compositions
 * POST /warehouse/v1/inventory            → upload article stock
 * POST /warehouse/v1/product/{productName} → sell one unit of a product
 *
 * Each request gets a {@link Deadline} of {@code app.inventory.backend-timeout}
 * from its arrival. Engine failures are rendered by {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/warehouse/v1")
@Slf4j
public class InventoryController {

    static final String NO_PRODUCT_IN_STOCK = "No product in stock";

    private final InventoryService inventoryService;
    private final Duration backendTimeout;

    public InventoryController(InventoryService inventoryService,
                               @Value("${app.inventory.backend-timeout:25s}") Duration backendTimeout) {
        this.inventoryService = inventoryService;
        this.backendTimeout = backendTimeout;
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse> health() {
        log.debug("health");
        try {
            inventoryService.ping();
        } catch (ConnectivityException e) {
            log.error("Health check failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.message("unhealthy endpoint"));
        }
        return ResponseEntity.ok(ApiResponse.message("healthy endpoint"));
    }

    @GetMapping("/inventory")
    public ResponseEntity<ApiResponse> getInventory() {
        log.debug("getInventory");
        List<Stock> stocks = inventoryService.getInventory(deadline());
        return ResponseEntity.ok(ApiResponse.inventory(stocks));
    }

    @GetMapping("/product")
    public ResponseEntity<ApiResponse> getProductStock() {
        log.debug("getProductStock");
        List<ProductStock> stocks = inventoryService.getProductStock(deadline());
        if (stocks.isEmpty()) {
            return ResponseEntity.ok(ApiResponse.message(NO_PRODUCT_IN_STOCK));
        }
        return ResponseEntity.ok(ApiResponse.productStocks(stocks));
    }

    @PostMapping("/product")
    public ResponseEntity<ApiResponse> uploadProducts(@RequestBody Products products) {
        log.debug("uploadProducts");
        int inserted = inventoryService.uploadProducts(deadline(), products);
        return ResponseEntity.ok(ApiResponse.message(String.format("%d product inserted", inserted)));
    }

    @PostMapping("/inventory")
    public ResponseEntity<ApiResponse> uploadInventory(@RequestBody Inventory inventory) {
        log.debug("uploadInventory");
        int inserted = inventoryService.uploadInventory(deadline(), inventory);
        return ResponseEntity.ok(ApiResponse.message(String.format("%d item inserted", inserted)));
    }

    @PostMapping("/product/{productName}")
    public ResponseEntity<ApiResponse> sellProduct(@PathVariable String productName) {
        log.debug("sellProduct");
        inventoryService.sellProduct(deadline(), productName);
        return ResponseEntity.ok(ApiResponse.message(
                String.format("Product %s is sold and inventory is updated accordingly", productName)));
    }

    private Deadline deadline() {
        return Deadline.after(backendTimeout);
    }
}
