package com.iimsoft.bom.exception;

/**
 * 没有任何 level == 0 的行，整个计算无法进行
 */
public class MissingRootException extends IllegalStateException {

    public MissingRootException() {
        super("No root item found (no row with level == 0)");
    }
}
