package com.iimsoft.bom.testing;

import com.iimsoft.bom.domain.BomArc;

/**
 * 测试用 BOM 行构造
 */
public final class BomRows {

    public static final String PURCHASED = "Purchased";
    public static final String PRODUCTION = "Production";
    public static final String PHANTOM = "Production - Phantom";

    private BomRows() {
    }

    public static BomArc root(String item) {
        return new BomArc("", item, 1, "", PRODUCTION, "", item + " assembly", 0);
    }

    public static BomArc buy(String parent, String item, double qty) {
        return new BomArc(parent, item, qty, "", PURCHASED, "Item", "name " + item, 1);
    }

    public static BomArc make(String parent, String item, double qty) {
        return new BomArc(parent, item, qty, "", PRODUCTION, "Item", "name " + item, 1);
    }

    public static BomArc phantom(String parent, String item, double qty) {
        return new BomArc(parent, item, qty, "", PHANTOM, "", "name " + item, 1);
    }

    public static BomArc lengthBuy(String parent, String item, double qty) {
        return new BomArc(parent, item, qty, "Profile MM", PURCHASED, "Item", "name " + item, 1);
    }

    public static BomArc unknown(String parent, String item, double qty) {
        return new BomArc(parent, item, qty, "", "", "", "name " + item, 1);
    }
}
