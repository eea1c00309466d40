package com.iimsoft.bom.domain;

import java.util.Objects;

/**
 * 推导路径中的一步：物料 + 该步对应的单位用量
 */
public final class PathStep {
    private final String item;
    private final double quantity;

    public PathStep(String item, double quantity) {
        this.item = Objects.requireNonNull(item, "item");
        this.quantity = quantity;
    }

    public String getItem() { return item; }
    public double getQuantity() { return quantity; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PathStep)) return false;
        PathStep that = (PathStep) o;
        return Double.compare(quantity, that.quantity) == 0 && item.equals(that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, quantity);
    }

    @Override
    public String toString() {
        return item + " (×" + quantity + ")";
    }
}
