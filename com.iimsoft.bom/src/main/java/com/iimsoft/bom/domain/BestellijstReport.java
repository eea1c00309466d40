package com.iimsoft.bom.domain;

import java.util.List;

/**
 * 一次完整计算的产物：清单、长度件清单、展开结果，以及（可选的）对账结果
 */
public class BestellijstReport {
    private final ExplosionResult explosion;
    private final List<RequirementLine> bestellijst;
    private final List<LengthRequirementLine> lengthItems;
    private final List<ComparisonLine> comparison; // 没有提供目标清单时为 null

    public BestellijstReport(ExplosionResult explosion,
                             List<RequirementLine> bestellijst,
                             List<LengthRequirementLine> lengthItems,
                             List<ComparisonLine> comparison) {
        this.explosion = explosion;
        this.bestellijst = List.copyOf(bestellijst);
        this.lengthItems = List.copyOf(lengthItems);
        this.comparison = comparison == null ? null : List.copyOf(comparison);
    }

    public ExplosionResult getExplosion() { return explosion; }
    public List<RequirementLine> getBestellijst() { return bestellijst; }
    public List<LengthRequirementLine> getLengthItems() { return lengthItems; }
    public List<ComparisonLine> getComparison() { return comparison; }

    public boolean hasComparison() {
        return comparison != null;
    }
}
