package com.iimsoft.bom.domain;

import java.util.Objects;

/**
 * 某个末端物料的一条贡献：该路径带来的数量 + 完整推导路径
 */
public final class TraceEntry {
    private final double quantity;
    private final DerivationPath path;

    public TraceEntry(double quantity, DerivationPath path) {
        this.quantity = quantity;
        this.path = Objects.requireNonNull(path, "path");
    }

    public double getQuantity() { return quantity; }
    public DerivationPath getPath() { return path; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceEntry)) return false;
        TraceEntry that = (TraceEntry) o;
        return Double.compare(quantity, that.quantity) == 0 && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(quantity, path);
    }

    @Override
    public String toString() {
        return quantity + " via " + path.render();
    }
}
