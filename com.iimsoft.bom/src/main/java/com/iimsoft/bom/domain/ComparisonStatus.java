package com.iimsoft.bom.domain;

/**
 * 对账状态，判断顺序与枚举顺序一致
 */
public enum ComparisonStatus {
    ONLY_IN_TARGET("Alleen in D365"),
    ONLY_IN_BOM("Alleen in Teamcenter"),
    QUANTITY_DIFFERS("Hoeveelheid verschilt"),
    NAME_DIFFERS("Naam verschilt"),
    MATCH("Match");

    private final String label;

    ComparisonStatus(String label) {
        this.label = label;
    }

    /** 报表里显示的文字 */
    public String getLabel() {
        return label;
    }
}
