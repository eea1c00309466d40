package com.iimsoft.bom.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.iimsoft.bom.domain.ComparisonLine;
import com.iimsoft.bom.domain.ComparisonStatus;
import com.iimsoft.bom.domain.RequirementLine;
import com.iimsoft.bom.domain.TargetLine;
import java.util.List;
import org.junit.jupiter.api.Test;

final class BomComparisonServiceTest {

    private final BomComparisonService service = new BomComparisonService(0.01);

    @Test
    void classifiesEveryRow() {
        List<RequirementLine> computed = List.of(
                new RequirementLine("A", "Alpha", 2d),
                new RequirementLine("B", "Beta", 3d),
                new RequirementLine("C", "Gamma", 4d),
                new RequirementLine("D", "Delta", 5d));
        List<TargetLine> target = List.of(
                new TargetLine("A", " Alpha ", 2.005),
                new TargetLine("B", "Beta", 3.5),
                new TargetLine("C", "Gamma 2", 4d),
                new TargetLine("E", "Epsilon", 1d));

        List<ComparisonLine> lines = service.compare(computed, target);

        assertEquals(5, lines.size());
        assertEquals(ComparisonStatus.MATCH, lines.get(0).getStatus());
        assertEquals(ComparisonStatus.QUANTITY_DIFFERS, lines.get(1).getStatus());
        assertEquals(ComparisonStatus.NAME_DIFFERS, lines.get(2).getStatus());
        assertEquals(ComparisonStatus.ONLY_IN_BOM, lines.get(3).getStatus());
        assertNull(lines.get(3).getTargetQuantity());
        assertEquals(ComparisonStatus.ONLY_IN_TARGET, lines.get(4).getStatus());
        assertEquals("E", lines.get(4).getItem());
        assertNull(lines.get(4).getBomQuantity());
    }

    @Test
    void quantityDifferenceWinsOverNameDifference() {
        List<ComparisonLine> lines = service.compare(
                List.of(new RequirementLine("A", "Alpha", 2d)),
                List.of(new TargetLine("A", "Other", 9d)));

        assertEquals(ComparisonStatus.QUANTITY_DIFFERS, lines.get(0).getStatus());
    }

    @Test
    void groupsTargetByItemAndName() {
        List<ComparisonLine> lines = service.compare(
                List.of(new RequirementLine("A", "Alpha", 5d)),
                List.of(new TargetLine("A", "Alpha", 2d), new TargetLine("A", "Alpha", 3d)));

        assertEquals(1, lines.size());
        assertEquals(5d, lines.get(0).getTargetQuantity());
        assertEquals(ComparisonStatus.MATCH, lines.get(0).getStatus());
    }

    @Test
    void rejectsNegativeTolerance() {
        assertThrows(IllegalArgumentException.class, () -> new BomComparisonService(-1));
    }
}
