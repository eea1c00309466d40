package com.iimsoft.bom.domain;

/**
 * 外部（D365）数量清单的一行，用于对账
 */
public class TargetLine {
    private String item;
    private String productName;
    private double quantity;

    public TargetLine() {
    }

    public TargetLine(String item, String productName, double quantity) {
        this.item = item;
        this.productName = productName;
        this.quantity = quantity;
    }

    public String getItem() { return item; }
    public String getProductName() { return productName; }
    public double getQuantity() { return quantity; }

    public void setItem(String item) { this.item = item; }
    public void setProductName(String productName) { this.productName = productName; }
    public void setQuantity(double quantity) { this.quantity = quantity; }

    @Override
    public String toString() {
        return item + " '" + productName + "' x" + quantity;
    }
}
