package com.iimsoft.bom.api.dto;

import com.iimsoft.bom.config.ExplosionConfig;

import java.util.List;

public class ExplodeRequest {

    /** BOM 行（一条父子关系一行），必须有且只有一行 level == 0 */
    public List<BomRowDto> rows;

    /** 可选：D365 目标清单，提供时输出对账结果 */
    public List<TargetLineDto> target;

    /** 可选：覆盖 -Dbom.explosion 的配置 */
    public ExplosionConfig config;

    /** 是否输出每个物料的推导路径 */
    public boolean includeTrace = true;

    public static class BomRowDto {
        public String parentItem;
        public String item;
        /** 字符串或数字，逗号可作小数点 */
        public String quantityPerParent;
        public String template;
        public String makeOrBuy;
        public String lineType;
        public String productName;
        public Integer level;
    }

    public static class TargetLineDto {
        public String item;
        public String productName;
        public double quantity;
    }
}
