package com.iimsoft.bom.service;

import com.iimsoft.bom.config.ExplosionConfig;
import com.iimsoft.bom.domain.BomArc;
import com.iimsoft.bom.domain.DerivationPath;
import com.iimsoft.bom.domain.ExplosionResult;
import com.iimsoft.bom.domain.TraceEntry;
import com.iimsoft.bom.exception.ExplosionLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * BOM 展开（深度优先，倍数沿路径累乘）：
 * - BUY / MAKE：终止该分支，把 multiplier * qty 记到该物料上（长度件单独汇总）
 * - PHANTOM：不计数，带着累计倍数继续展开子件
 * - UNKNOWN：丢弃
 *
 * 同一条完整路径（含当前边）只访问一次；同一物料经不同路径到达时仍会分别累加。
 * 每次 explode 使用独立的 {@link ExplosionContext}，实例本身无状态，可并发调用。
 */
public class BomExplosionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BomExplosionService.class);

    // 构造时取快照，之后修改 config 不影响本实例
    private final int maxDepth;
    private final int maxDistinctPaths;

    public BomExplosionService(ExplosionConfig config) {
        ExplosionConfig checked = Objects.requireNonNull(config, "config").validated();
        this.maxDepth = checked.getMaxDepth();
        this.maxDistinctPaths = checked.getMaxDistinctPaths();
    }

    public ExplosionResult explode(String rootItem, Collection<BomArc> rows) {
        Objects.requireNonNull(rootItem, "rootItem");
        Objects.requireNonNull(rows, "rows");

        ExplosionContext ctx = new ExplosionContext(rows, maxDistinctPaths);
        traverse(ctx, rootItem, 1d, DerivationPath.empty(), 0);

        ExplosionResult result = new ExplosionResult(rootItem,
                ctx.leafTotals, ctx.lengthTotals, ctx.traceLog, ctx.lengthTraceLog, ctx.visited.size());
        LOGGER.debug("Exploded {}: {}", rootItem, result);
        return result;
    }

    private void traverse(ExplosionContext ctx, String item, double multiplier, DerivationPath path, int depth) {
        List<BomArc> children = ctx.childrenOf(item);
        if (children.isEmpty()) {
            return;
        }
        if (depth >= maxDepth) {
            throw new ExplosionLimitExceededException("Phantom nesting deeper than " + maxDepth
                    + " levels at " + path.append(item, 0d).render() + " (cyclic BOM?)");
        }

        for (BomArc row : children) {
            String child = row.getItem();
            double qty = row.getQuantityPerParent();
            double totalQty = multiplier * qty;
            DerivationPath newPath = path.append(item, qty);
            DerivationPath pathKey = newPath.append(child, qty);

            if (!ctx.visit(pathKey)) {
                LOGGER.trace("Skipping already visited path {}", pathKey);
                continue;
            }

            switch (row.getItemType()) {
                case BUY:
                case MAKE:
                    TraceEntry entry = new TraceEntry(totalQty, pathKey);
                    ctx.traceLog.computeIfAbsent(child, k -> new ArrayList<>()).add(entry);
                    if (row.isLengthItem()) {
                        ctx.lengthTraceLog.computeIfAbsent(child, k -> new ArrayList<>()).add(entry);
                        ctx.lengthTotals.merge(child, totalQty, Double::sum);
                    } else {
                        ctx.leafTotals.merge(child, totalQty, Double::sum);
                    }
                    break;
                case PHANTOM:
                    traverse(ctx, child, totalQty, newPath, depth + 1);
                    break;
                case UNKNOWN:
                default:
                    break;
            }
        }
    }

    /**
     * 单次展开独占的可变状态
     */
    private static final class ExplosionContext {
        private final Map<String, List<BomArc>> rowsByParent = new LinkedHashMap<>();
        private final Set<DerivationPath> visited = new HashSet<>();
        private final Map<String, Double> leafTotals = new LinkedHashMap<>();
        private final Map<String, Double> lengthTotals = new LinkedHashMap<>();
        private final Map<String, List<TraceEntry>> traceLog = new LinkedHashMap<>();
        private final Map<String, List<TraceEntry>> lengthTraceLog = new LinkedHashMap<>();
        private final int maxDistinctPaths;

        ExplosionContext(Collection<BomArc> rows, int maxDistinctPaths) {
            // 保持源表顺序
            for (BomArc row : rows) {
                rowsByParent.computeIfAbsent(row.getParentItem(), k -> new ArrayList<>()).add(row);
            }
            this.maxDistinctPaths = maxDistinctPaths;
        }

        List<BomArc> childrenOf(String item) {
            return rowsByParent.getOrDefault(item, List.of());
        }

        boolean visit(DerivationPath pathKey) {
            if (visited.contains(pathKey)) {
                return false;
            }
            if (visited.size() >= maxDistinctPaths) {
                throw new ExplosionLimitExceededException("More than " + maxDistinctPaths + " distinct BOM paths");
            }
            visited.add(pathKey);
            return true;
        }
    }
}
