package com.iimsoft.bom.util;

import com.iimsoft.bom.domain.ItemType;

import java.util.Locale;

/**
 * 行分类规则（大小写不敏感的子串匹配，先 trim）：
 * 1) make/buy 含 "purch" → BUY
 * 2) make/buy 含 "production" → make/buy 或 line type 含 "phantom" 时为 PHANTOM，否则 MAKE
 * 3) 其他 → UNKNOWN
 */
public final class RowClassifier {

    private RowClassifier() {
    }

    public static ItemType classify(String makeOrBuy, String lineType) {
        String mb = normalize(makeOrBuy);
        String lt = normalize(lineType);
        if (mb.contains("purch")) {
            return ItemType.BUY;
        }
        if (mb.contains("production")) {
            if (mb.contains("phantom") || lt.contains("phantom")) {
                return ItemType.PHANTOM;
            }
            return ItemType.MAKE;
        }
        return ItemType.UNKNOWN;
    }

    /** 模板含 "mm" 视为按长度订购的物料 */
    public static boolean isLengthItem(String template) {
        return normalize(template).contains("mm");
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
