package com.warehouse.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Inventory engine metrics.
 *
 * Key metrics (see /actuator/metrics):
 * - inventory.sale.success    → products sold
 * - inventory.sale.rejected   → sales refused, tagged by reason (not_found / out_of_stock / error)
 * - inventory.sale.time       → time spent in the sale transaction
 * - inventory.upload.products → products registered through uploads
 * - inventory.upload.articles → article rows written through uploads
 */
@Component
@Getter
public class InventoryMetrics {

    public static final String REASON_NOT_FOUND = "not_found";
    public static final String REASON_OUT_OF_STOCK = "out_of_stock";
    public static final String REASON_ERROR = "error";

    private final Timer saleTimer;

    private final Counter salesSucceededCounter;
    private final Counter salesNotFoundCounter;
    private final Counter salesOutOfStockCounter;
    private final Counter salesFailedCounter;
    private final Counter productsUploadedCounter;
    private final Counter articlesUploadedCounter;

    public InventoryMetrics(MeterRegistry registry) {
        this.saleTimer = Timer.builder("inventory.sale.time")
                .description("Time spent in the sell-product transaction")
                .register(registry);

        this.salesSucceededCounter = Counter.builder("inventory.sale.success")
                .description("Products sold")
                .register(registry);

        this.salesNotFoundCounter = rejected(registry, REASON_NOT_FOUND);
        this.salesOutOfStockCounter = rejected(registry, REASON_OUT_OF_STOCK);
        this.salesFailedCounter = rejected(registry, REASON_ERROR);

        this.productsUploadedCounter = Counter.builder("inventory.upload.products")
                .description("Products registered through uploads")
                .register(registry);

        this.articlesUploadedCounter = Counter.builder("inventory.upload.articles")
                .description("Article stock rows written through uploads")
                .register(registry);
    }

    private static Counter rejected(MeterRegistry registry, String reason) {
        return Counter.builder("inventory.sale.rejected")
                .description("Sales refused or failed")
                .tag("reason", reason)
                .register(registry);
    }

    public void recordSaleTime(long millis) {
        saleTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementSalesSucceeded() {
        salesSucceededCounter.increment();
    }

    public void incrementSalesRejected(String reason) {
        switch (reason) {
            case REASON_NOT_FOUND -> salesNotFoundCounter.increment();
            case REASON_OUT_OF_STOCK -> salesOutOfStockCounter.increment();
            default -> salesFailedCounter.increment();
        }
    }

    public void incrementProductsUploaded(int count) {
        productsUploadedCounter.increment(count);
    }

    public void incrementArticlesUploaded(int count) {
        articlesUploadedCounter.increment(count);
    }
}
