package com.iimsoft.bom.exception;

/**
 * 展开超出配置的深度或路径数上限（通常说明虚拟件之间存在环）
 */
public class ExplosionLimitExceededException extends IllegalStateException {

    public ExplosionLimitExceededException(String message) {
        super(message);
    }
}
