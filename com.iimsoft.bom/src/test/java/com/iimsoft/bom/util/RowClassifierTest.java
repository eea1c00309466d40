package com.iimsoft.bom.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.iimsoft.bom.domain.ItemType;
import org.junit.jupiter.api.Test;

final class RowClassifierTest {

    @Test
    void purchasedIsBuyRegardlessOfLineType() {
        assertEquals(ItemType.BUY, RowClassifier.classify("Purchased", "Phantom"));
        assertEquals(ItemType.BUY, RowClassifier.classify("  PURCH  ", ""));
    }

    @Test
    void purchTakesPrecedenceOverProduction() {
        assertEquals(ItemType.BUY, RowClassifier.classify("Production / purchased", "phantom"));
    }

    @Test
    void productionPhantomIsPhantom() {
        assertEquals(ItemType.PHANTOM, RowClassifier.classify("Production - Phantom", ""));
    }

    @Test
    void productionWithPhantomLineTypeIsPhantom() {
        assertEquals(ItemType.PHANTOM, RowClassifier.classify("Production", "PHANTOM"));
    }

    @Test
    void plainProductionIsMake() {
        assertEquals(ItemType.MAKE, RowClassifier.classify("production", "Item"));
    }

    @Test
    void phantomWithoutProductionIsUnknown() {
        assertEquals(ItemType.UNKNOWN, RowClassifier.classify("Phantom", "phantom"));
    }

    @Test
    void missingFieldsAreUnknown() {
        assertEquals(ItemType.UNKNOWN, RowClassifier.classify(null, null));
        assertEquals(ItemType.UNKNOWN, RowClassifier.classify("", ""));
    }

    @Test
    void detectsLengthItemsCaseInsensitive() {
        assertTrue(RowClassifier.isLengthItem("Tube 20x2 MM"));
        assertTrue(RowClassifier.isLengthItem("mm"));
        assertFalse(RowClassifier.isLengthItem("Standard part"));
        assertFalse(RowClassifier.isLengthItem(null));
    }
}
