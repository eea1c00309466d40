package com.iimsoft.bom.domain;

import java.util.Objects;

/**
 * 长度件清单行：额外带上首次出现的 template
 */
public class LengthRequirementLine extends RequirementLine {
    private String template;

    public LengthRequirementLine() {
    }

    public LengthRequirementLine(String item, String productName, double totalQuantity, String template) {
        super(item, productName, totalQuantity);
        this.template = template;
    }

    public String getTemplate() { return template; }
    public void setTemplate(String template) { this.template = template; }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        return Objects.equals(template, ((LengthRequirementLine) o).template);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), template);
    }

    @Override
    public String toString() {
        return super.toString() + " [" + template + "]";
    }
}
