package com.iimsoft.bom.service;

import com.iimsoft.bom.domain.BomArc;
import com.iimsoft.bom.domain.LengthRequirementLine;
import com.iimsoft.bom.domain.RequirementLine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 把展开得到的 item -> 数量 与物料描述合并成清单。
 * 同一物料在不同行里记录了不同名称时，每个 (item, name) 各出一行，名称不做合并。
 */
public class RequirementAggregator {

    private static final Comparator<RequirementLine> BY_ITEM_THEN_NAME =
            Comparator.comparing(RequirementLine::getItem)
                    .thenComparing(RequirementLine::getProductName);

    public List<RequirementLine> aggregate(Map<String, Double> leafTotals, Collection<BomArc> rows) {
        Map<String, Set<String>> namesByItem = namesByItem(rows);

        Map<Key, Double> summed = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : leafTotals.entrySet()) {
            for (String name : namesOf(namesByItem, e.getKey())) {
                summed.merge(new Key(e.getKey(), name), e.getValue(), Double::sum);
            }
        }

        List<RequirementLine> lines = new ArrayList<>();
        summed.forEach((k, qty) -> lines.add(new RequirementLine(k.item, k.name, qty)));
        lines.sort(BY_ITEM_THEN_NAME);
        return lines;
    }

    /**
     * 长度件单独出表，并带上该物料首次出现的 template。
     */
    public List<LengthRequirementLine> aggregateLengthItems(Map<String, Double> lengthTotals, Collection<BomArc> rows) {
        Map<String, Set<String>> namesByItem = namesByItem(rows);
        Map<String, String> templateByItem = new LinkedHashMap<>();
        for (BomArc row : rows) {
            templateByItem.putIfAbsent(row.getItem(), row.getTemplate());
        }

        Map<Key, Double> summed = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : lengthTotals.entrySet()) {
            for (String name : namesOf(namesByItem, e.getKey())) {
                summed.merge(new Key(e.getKey(), name), e.getValue(), Double::sum);
            }
        }

        List<LengthRequirementLine> lines = new ArrayList<>();
        summed.forEach((k, qty) -> lines.add(
                new LengthRequirementLine(k.item, k.name, qty, templateByItem.getOrDefault(k.item, ""))));
        lines.sort(BY_ITEM_THEN_NAME);
        return lines;
    }

    // item -> 按出现顺序去重的名称
    private static Map<String, Set<String>> namesByItem(Collection<BomArc> rows) {
        Map<String, Set<String>> names = new LinkedHashMap<>();
        for (BomArc row : rows) {
            names.computeIfAbsent(row.getItem(), k -> new LinkedHashSet<>()).add(row.getProductName());
        }
        return names;
    }

    private static Set<String> namesOf(Map<String, Set<String>> namesByItem, String item) {
        Set<String> names = namesByItem.get(item);
        return names == null || names.isEmpty() ? Set.of("") : names;
    }

    private static final class Key {
        private final String item;
        private final String name;

        Key(String item, String name) {
            this.item = item;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key key = (Key) o;
            return item.equals(key.item) && name.equals(key.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(item, name);
        }
    }
}
