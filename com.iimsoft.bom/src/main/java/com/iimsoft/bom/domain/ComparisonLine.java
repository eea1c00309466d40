package com.iimsoft.bom.domain;

/**
 * 对账结果行（outer join on item）。缺失一侧的字段为 null。
 */
public class ComparisonLine {
    private String item;
    private String bomProductName;
    private Double bomQuantity;
    private String targetProductName;
    private Double targetQuantity;
    private ComparisonStatus status;

    public ComparisonLine() {
    }

    public ComparisonLine(String item, String bomProductName, Double bomQuantity,
                          String targetProductName, Double targetQuantity, ComparisonStatus status) {
        this.item = item;
        this.bomProductName = bomProductName;
        this.bomQuantity = bomQuantity;
        this.targetProductName = targetProductName;
        this.targetQuantity = targetQuantity;
        this.status = status;
    }

    public String getItem() { return item; }
    public String getBomProductName() { return bomProductName; }
    public Double getBomQuantity() { return bomQuantity; }
    public String getTargetProductName() { return targetProductName; }
    public Double getTargetQuantity() { return targetQuantity; }
    public ComparisonStatus getStatus() { return status; }

    public void setItem(String item) { this.item = item; }
    public void setBomProductName(String bomProductName) { this.bomProductName = bomProductName; }
    public void setBomQuantity(Double bomQuantity) { this.bomQuantity = bomQuantity; }
    public void setTargetProductName(String targetProductName) { this.targetProductName = targetProductName; }
    public void setTargetQuantity(Double targetQuantity) { this.targetQuantity = targetQuantity; }
    public void setStatus(ComparisonStatus status) { this.status = status; }

    @Override
    public String toString() {
        return item + ": " + bomQuantity + " vs " + targetQuantity + " -> " + status;
    }
}
