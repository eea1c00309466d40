package com.iimsoft.bom.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.iimsoft.bom.domain.ComparisonLine;
import com.iimsoft.bom.domain.LengthRequirementLine;
import com.iimsoft.bom.domain.RequirementLine;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExplodeResponse {

    public String rootItem;

    /** 非长度件清单，按 item 排序 */
    public List<RequirementLine> bestellijst;

    /** 长度件清单 */
    public List<LengthRequirementLine> lengthItems;

    /** item -> 每条贡献路径 */
    public Map<String, List<TraceDto>> traces;

    /** 仅在请求带 target 时输出 */
    public List<ComparisonLine> comparison;

    public int distinctPaths;

    public static class TraceDto {
        public double quantity;
        /** 形如 "ROOT (×2.0) → A (×3.0) → C" */
        public String path;
        public List<StepDto> steps;
    }

    public static class StepDto {
        public String item;
        public double quantity;
    }
}
