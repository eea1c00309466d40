package com.iimsoft.bom.service;

import com.iimsoft.bom.domain.ComparisonLine;
import com.iimsoft.bom.domain.ComparisonStatus;
import com.iimsoft.bom.domain.RequirementLine;
import com.iimsoft.bom.domain.TargetLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 计算清单（Teamcenter）与目标清单（D365）按 item 做 outer join 对账。
 */
public class BomComparisonService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BomComparisonService.class);

    private final double tolerance;

    public BomComparisonService(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must not be negative: " + tolerance);
        }
        this.tolerance = tolerance;
    }

    public List<ComparisonLine> compare(Collection<RequirementLine> computed, Collection<TargetLine> target) {
        Map<String, List<RequirementLine>> computedByItem = new LinkedHashMap<>();
        for (RequirementLine line : computed) {
            computedByItem.computeIfAbsent(line.getItem(), k -> new ArrayList<>()).add(line);
        }
        Map<String, List<TargetLine>> targetByItem = new LinkedHashMap<>();
        for (TargetLine line : groupTarget(target)) {
            targetByItem.computeIfAbsent(line.getItem(), k -> new ArrayList<>()).add(line);
        }

        TreeSet<String> items = new TreeSet<>(computedByItem.keySet());
        items.addAll(targetByItem.keySet());

        List<ComparisonLine> out = new ArrayList<>();
        for (String item : items) {
            List<RequirementLine> left = computedByItem.getOrDefault(item, List.of());
            List<TargetLine> right = targetByItem.getOrDefault(item, List.of());
            if (left.isEmpty()) {
                for (TargetLine t : right) {
                    out.add(new ComparisonLine(item, null, null, t.getProductName(), t.getQuantity(), ComparisonStatus.ONLY_IN_TARGET));
                }
            } else if (right.isEmpty()) {
                for (RequirementLine c : left) {
                    out.add(new ComparisonLine(item, c.getProductName(), c.getTotalQuantity(), null, null, ComparisonStatus.ONLY_IN_BOM));
                }
            } else {
                // 一个 item 两侧都有多行时两两配对
                for (RequirementLine c : left) {
                    for (TargetLine t : right) {
                        out.add(new ComparisonLine(item, c.getProductName(), c.getTotalQuantity(),
                                t.getProductName(), t.getQuantity(), status(c, t)));
                    }
                }
            }
        }
        out.sort(Comparator.comparing(ComparisonLine::getItem));

        if (LOGGER.isInfoEnabled()) {
            Map<ComparisonStatus, Integer> counts = new EnumMap<>(ComparisonStatus.class);
            out.forEach(l -> counts.merge(l.getStatus(), 1, Integer::sum));
            LOGGER.info("Comparison finished: {}", counts);
        }
        return out;
    }

    ComparisonStatus status(RequirementLine computed, TargetLine target) {
        if (Math.abs(computed.getTotalQuantity() - target.getQuantity()) > tolerance) {
            return ComparisonStatus.QUANTITY_DIFFERS;
        }
        if (!trim(computed.getProductName()).equals(trim(target.getProductName()))) {
            return ComparisonStatus.NAME_DIFFERS;
        }
        return ComparisonStatus.MATCH;
    }

    /**
     * 目标清单按 (item, productName) 汇总数量
     */
    static List<TargetLine> groupTarget(Collection<TargetLine> target) {
        Map<String, TargetLine> grouped = new LinkedHashMap<>();
        for (TargetLine t : target) {
            String key = t.getItem() + '\u0000' + trim(t.getProductName());
            TargetLine acc = grouped.get(key);
            if (acc == null) {
                grouped.put(key, new TargetLine(t.getItem(), t.getProductName(), t.getQuantity()));
            } else {
                acc.setQuantity(acc.getQuantity() + t.getQuantity());
            }
        }
        return new ArrayList<>(grouped.values());
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
