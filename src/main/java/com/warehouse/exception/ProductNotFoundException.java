package com.warehouse.exception;

public class ProductNotFoundException extends InventoryException {

    private final String productName;

    public ProductNotFoundException(String productName) {
        super(ErrorCode.PRODUCT_NOT_FOUND, null, null);
        this.productName = productName;
    }

    public String getProductName() {
        return productName;
    }
}
