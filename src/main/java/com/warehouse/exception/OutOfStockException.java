package com.warehouse.exception;

public class OutOfStockException extends InventoryException {

    private final String productName;

    public OutOfStockException(String productName) {
        super(ErrorCode.OUT_OF_STOCK, null, null);
        this.productName = productName;
    }

    public String getProductName() {
        return productName;
    }
}
