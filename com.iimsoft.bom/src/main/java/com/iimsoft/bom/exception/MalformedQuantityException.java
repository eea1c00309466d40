package com.iimsoft.bom.exception;

/**
 * BOM 行的数量无法解析为非负实数。在导入阶段抛出，展开引擎不会遇到。
 */
public class MalformedQuantityException extends IllegalArgumentException {

    private final long lineNumber;
    private final String rawValue;

    public MalformedQuantityException(long lineNumber, String rawValue, Throwable cause) {
        super("Malformed quantity '" + rawValue + "' at line " + lineNumber, cause);
        this.lineNumber = lineNumber;
        this.rawValue = rawValue;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public String getRawValue() {
        return rawValue;
    }
}
