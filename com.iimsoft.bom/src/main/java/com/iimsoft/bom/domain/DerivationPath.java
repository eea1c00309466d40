package com.iimsoft.bom.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 从根物料到某节点的不可变路径。每次 {@link #append} 都返回新实例，兄弟分支之间互不可见。
 * 也用作展开时的去重 key。
 */
public final class DerivationPath {

    private static final DerivationPath EMPTY = new DerivationPath(Collections.emptyList());

    private final List<PathStep> steps;

    private DerivationPath(List<PathStep> steps) {
        this.steps = steps;
    }

    public static DerivationPath empty() {
        return EMPTY;
    }

    public static DerivationPath of(PathStep... steps) {
        DerivationPath path = EMPTY;
        for (PathStep step : steps) {
            path = path.append(step);
        }
        return path;
    }

    public DerivationPath append(String item, double quantity) {
        return append(new PathStep(item, quantity));
    }

    public DerivationPath append(PathStep step) {
        List<PathStep> copy = new ArrayList<>(steps.size() + 1);
        copy.addAll(steps);
        copy.add(step);
        return new DerivationPath(Collections.unmodifiableList(copy));
    }

    @JsonValue
    public List<PathStep> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    /**
     * 形如 {@code ROOT (×2.0) → A (×3.0) → C}：最后一跳不带倍数，它的数量已体现在总数里。
     */
    public String render() {
        if (steps.isEmpty()) {
            return "";
        }
        int last = steps.size() - 1;
        String head = steps.subList(0, last).stream()
                .map(PathStep::toString)
                .collect(Collectors.joining(" → "));
        String tail = steps.get(last).getItem();
        return head.isEmpty() ? tail : head + " → " + tail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DerivationPath)) return false;
        return steps.equals(((DerivationPath) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return steps.toString();
    }
}
