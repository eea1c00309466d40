package com.iimsoft.bom.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class DerivationPathTest {

    @Test
    void appendLeavesBasePathUntouched() {
        DerivationPath base = DerivationPath.empty().append("R", 2);
        DerivationPath left = base.append("A", 3);
        DerivationPath right = base.append("B", 4);

        assertEquals(1, base.size());
        assertEquals("A", left.getSteps().get(1).getItem());
        assertEquals("B", right.getSteps().get(1).getItem());
        assertThrows(UnsupportedOperationException.class, () -> left.getSteps().add(new PathStep("X", 1)));
    }

    @Test
    void equalityFollowsSteps() {
        assertEquals(DerivationPath.of(new PathStep("R", 2), new PathStep("A", 2)),
                DerivationPath.empty().append("R", 2).append("A", 2));
        assertNotEquals(DerivationPath.of(new PathStep("R", 2)), DerivationPath.of(new PathStep("R", 3)));
    }

    @Test
    void rendersLastHopWithoutMultiplier() {
        assertEquals("R (×2.0) → A (×0.5) → C",
                DerivationPath.of(new PathStep("R", 2), new PathStep("A", 0.5), new PathStep("C", 0.5)).render());
        assertEquals("C", DerivationPath.of(new PathStep("C", 1)).render());
        assertTrue(DerivationPath.empty().render().isEmpty());
    }
}
