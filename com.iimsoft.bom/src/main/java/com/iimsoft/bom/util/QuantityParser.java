package com.iimsoft.bom.util;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.util.Locale;

/**
 * 数量解析：点或逗号都可作小数点（Teamcenter 导出常见 "2,5"），不允许千分位和混用。
 * 必须整串解析完，"4d"、"0x1p4" 这类 Java 字面量不接受。
 */
public final class QuantityParser {

    private static final ThreadLocal<DecimalFormat> DOT_FORMAT =
            ThreadLocal.withInitial(() -> buildFormat('.'));
    private static final ThreadLocal<DecimalFormat> COMMA_FORMAT =
            ThreadLocal.withInitial(() -> buildFormat(','));

    private QuantityParser() {
    }

    /**
     * 解析非负数量。空串、非数字、NaN/Infinity、负数都抛 NumberFormatException。
     */
    public static double parse(String text) {
        if (text == null || text.isBlank()) {
            throw new NumberFormatException("Empty quantity");
        }
        double value = parseDecimal(text);
        if (value < 0) {
            throw new NumberFormatException("Negative quantity: " + text);
        }
        return value;
    }

    /**
     * 层级字段："0"、"1"、"0.0" 都可；空返回 null，其他无法解析的值抛 NumberFormatException。
     */
    public static Integer parseLevel(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        double d = parseDecimal(text);
        if (d != Math.rint(d)) {
            throw new NumberFormatException("Not an integer level: " + text);
        }
        return (int) d;
    }

    private static double parseDecimal(String text) {
        String trimmed = text.trim();
        boolean hasDot = trimmed.indexOf('.') >= 0;
        boolean hasComma = trimmed.indexOf(',') >= 0;
        if (hasDot && hasComma) {
            throw new NumberFormatException("Mixed decimal separators not allowed: " + text);
        }
        DecimalFormat format = hasComma ? COMMA_FORMAT.get() : DOT_FORMAT.get();
        ParsePosition position = new ParsePosition(0);
        Number parsed = format.parse(trimmed, position);
        if (parsed == null || position.getIndex() != trimmed.length()) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
        double value = parsed.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NumberFormatException("Not a finite number: " + text);
        }
        return value;
    }

    private static DecimalFormat buildFormat(char decimalSeparator) {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setDecimalSeparator(decimalSeparator);
        DecimalFormat format = new DecimalFormat();
        format.setDecimalFormatSymbols(symbols);
        format.setParseBigDecimal(true);
        format.setGroupingUsed(false);
        format.setMaximumFractionDigits(Integer.MAX_VALUE);
        format.setMaximumIntegerDigits(Integer.MAX_VALUE);
        return format;
    }
}
