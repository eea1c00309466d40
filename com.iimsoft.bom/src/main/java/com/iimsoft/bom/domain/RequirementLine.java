package com.iimsoft.bom.domain;

import java.util.Objects;

/**
 * 采购/生产清单（bestellijst）的一行
 */
public class RequirementLine {
    private String item;
    private String productName;
    private double totalQuantity;

    public RequirementLine() {
    }

    public RequirementLine(String item, String productName, double totalQuantity) {
        this.item = item;
        this.productName = productName;
        this.totalQuantity = totalQuantity;
    }

    public String getItem() { return item; }
    public String getProductName() { return productName; }
    public double getTotalQuantity() { return totalQuantity; }

    public void setItem(String item) { this.item = item; }
    public void setProductName(String productName) { this.productName = productName; }
    public void setTotalQuantity(double totalQuantity) { this.totalQuantity = totalQuantity; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequirementLine that = (RequirementLine) o;
        return Double.compare(totalQuantity, that.totalQuantity) == 0
                && Objects.equals(item, that.item)
                && Objects.equals(productName, that.productName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, productName, totalQuantity);
    }

    @Override
    public String toString() {
        return item + " '" + productName + "' x" + totalQuantity;
    }
}
