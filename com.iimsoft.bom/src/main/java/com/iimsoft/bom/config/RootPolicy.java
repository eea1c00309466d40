package com.iimsoft.bom.config;

/**
 * 存在多行 level == 0 时如何确定根物料
 */
public enum RootPolicy {
    /** 拒绝歧义输入 */
    STRICT,
    /** 取源表中第一次出现的那行（记录 WARN） */
    FIRST_ENCOUNTERED,
    /** 取物料号字典序最小的那行 */
    LOWEST_ITEM
}
