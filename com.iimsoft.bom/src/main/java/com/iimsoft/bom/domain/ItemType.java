package com.iimsoft.bom.domain;

/**
 * 物料分类（由 make/buy 与 line type 两个自由文本字段推导）
 */
public enum ItemType {
    /**
     * 采购件：make/buy 含 "purch"，终止展开，计入汇总
     */
    BUY,

    /**
     * 自制件：make/buy 含 "production" 且不是虚拟件，终止展开，计入汇总
     */
    MAKE,

    /**
     * 虚拟件：只把累计倍数传递给子件，本身不计入任何汇总
     */
    PHANTOM,

    /**
     * 无法识别：既不展开也不汇总
     */
    UNKNOWN
}
