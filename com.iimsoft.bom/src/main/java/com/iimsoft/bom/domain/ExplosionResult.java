package com.iimsoft.bom.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次 BOM 展开的结果。所有 map 按遍历顺序保存 key。
 */
public final class ExplosionResult {
    private final String rootItem;
    private final Map<String, Double> leafTotals;
    private final Map<String, Double> lengthTotals;
    private final Map<String, List<TraceEntry>> traceLog;
    private final Map<String, List<TraceEntry>> lengthTraceLog;
    private final int visitedPathCount;

    public ExplosionResult(String rootItem,
                           Map<String, Double> leafTotals,
                           Map<String, Double> lengthTotals,
                           Map<String, List<TraceEntry>> traceLog,
                           Map<String, List<TraceEntry>> lengthTraceLog,
                           int visitedPathCount) {
        this.rootItem = rootItem;
        this.leafTotals = Collections.unmodifiableMap(new LinkedHashMap<>(leafTotals));
        this.lengthTotals = Collections.unmodifiableMap(new LinkedHashMap<>(lengthTotals));
        this.traceLog = freeze(traceLog);
        this.lengthTraceLog = freeze(lengthTraceLog);
        this.visitedPathCount = visitedPathCount;
    }

    private static Map<String, List<TraceEntry>> freeze(Map<String, List<TraceEntry>> log) {
        Map<String, List<TraceEntry>> copy = new LinkedHashMap<>();
        log.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    public String getRootItem() { return rootItem; }

    /** 非长度末端物料：item -> 累计数量 */
    public Map<String, Double> getLeafTotals() { return leafTotals; }

    /** 长度件（模板含 mm）：item -> 累计数量，不计入 leafTotals */
    public Map<String, Double> getLengthTotals() { return lengthTotals; }

    /** 所有末端贡献（包括长度件）：item -> 路径列表 */
    public Map<String, List<TraceEntry>> getTraceLog() { return traceLog; }

    public Map<String, List<TraceEntry>> getLengthTraceLog() { return lengthTraceLog; }

    public int getVisitedPathCount() { return visitedPathCount; }

    public boolean isEmpty() {
        return leafTotals.isEmpty() && lengthTotals.isEmpty();
    }

    @Override
    public String toString() {
        return "ExplosionResult{root=" + rootItem + ", leafs=" + leafTotals.size()
                + ", lengthItems=" + lengthTotals.size() + ", paths=" + visitedPathCount + "}";
    }
}
