package com.iimsoft.bom.domain;

import com.iimsoft.bom.util.RowClassifier;

import java.util.Objects;

/**
 * BOM 父子关系：parent -> item with quantityPerParent。
 * 分类（itemType）与长度件标记（lengthItem）在构造时计算一次，之后不可变。
 */
public final class BomArc {
    private final String parentItem;
    private final String item;
    private final double quantityPerParent;
    private final String template;
    private final String makeOrBuy;
    private final String lineType;
    private final String productName;
    private final Integer level; // 源系统记录的层级，可能缺失
    private final ItemType itemType;
    private final boolean lengthItem;

    public BomArc(String parentItem, String item, double quantityPerParent,
                  String template, String makeOrBuy, String lineType,
                  String productName, Integer level) {
        this.parentItem = nullToEmpty(parentItem);
        this.item = nullToEmpty(item);
        this.quantityPerParent = quantityPerParent;
        this.template = nullToEmpty(template);
        this.makeOrBuy = nullToEmpty(makeOrBuy);
        this.lineType = nullToEmpty(lineType);
        this.productName = nullToEmpty(productName);
        this.level = level;
        this.itemType = RowClassifier.classify(this.makeOrBuy, this.lineType);
        this.lengthItem = RowClassifier.isLengthItem(this.template);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s.trim();
    }

    public String getParentItem() { return parentItem; }
    public String getItem() { return item; }
    public double getQuantityPerParent() { return quantityPerParent; }
    public String getTemplate() { return template; }
    public String getMakeOrBuy() { return makeOrBuy; }
    public String getLineType() { return lineType; }
    public String getProductName() { return productName; }
    public Integer getLevel() { return level; }
    public ItemType getItemType() { return itemType; }
    public boolean isLengthItem() { return lengthItem; }

    public boolean isRoot() {
        return level != null && level == 0;
    }

    @Override
    public String toString() {
        return parentItem + " -> " + item + " x" + quantityPerParent + " [" + itemType + (lengthItem ? ", mm" : "") + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BomArc)) return false;
        BomArc bomArc = (BomArc) o;
        return Double.compare(quantityPerParent, bomArc.quantityPerParent) == 0
                && Objects.equals(parentItem, bomArc.parentItem)
                && Objects.equals(item, bomArc.item)
                && Objects.equals(template, bomArc.template)
                && Objects.equals(makeOrBuy, bomArc.makeOrBuy)
                && Objects.equals(lineType, bomArc.lineType)
                && Objects.equals(productName, bomArc.productName)
                && Objects.equals(level, bomArc.level);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentItem, item, quantityPerParent, template, makeOrBuy, lineType, productName, level);
    }
}
