package com.iimsoft.bom.service;

import com.iimsoft.bom.config.ExplosionConfig;
import com.iimsoft.bom.config.RootPolicy;
import com.iimsoft.bom.domain.BestellijstReport;
import com.iimsoft.bom.domain.BomArc;
import com.iimsoft.bom.domain.ComparisonLine;
import com.iimsoft.bom.domain.ExplosionResult;
import com.iimsoft.bom.domain.LengthRequirementLine;
import com.iimsoft.bom.domain.RequirementLine;
import com.iimsoft.bom.domain.TargetLine;
import com.iimsoft.bom.exception.AmbiguousRootException;
import com.iimsoft.bom.exception.MissingRootException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 从已分类的 BOM 行生成 bestellijst：
 * 1) 找根物料（level == 0）
 * 2) 展开
 * 3) 汇总（普通件 / 长度件分表）
 * 4) 如果提供了目标清单则对账
 */
public class BestellijstService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BestellijstService.class);

    private final RootPolicy rootPolicy;
    private final BomExplosionService explosionService;
    private final RequirementAggregator aggregator;
    private final BomComparisonService comparisonService;

    public BestellijstService() {
        this(ExplosionConfig.load());
    }

    public BestellijstService(ExplosionConfig config) {
        Objects.requireNonNull(config, "config").validated();
        this.rootPolicy = config.getRootPolicy();
        this.explosionService = new BomExplosionService(config);
        this.aggregator = new RequirementAggregator();
        this.comparisonService = new BomComparisonService(config.getQuantityTolerance());
    }

    public BestellijstReport generate(List<BomArc> rows) {
        return generate(rows, null);
    }

    /**
     * @param target 外部目标清单，为 null 时不对账
     */
    public BestellijstReport generate(List<BomArc> rows, List<TargetLine> target) {
        Objects.requireNonNull(rows, "rows");
        String root = resolveRoot(rows);
        LOGGER.info("Exploding BOM {} ({} rows)", root, rows.size());

        ExplosionResult explosion = explosionService.explode(root, rows);
        List<RequirementLine> bestellijst = aggregator.aggregate(explosion.getLeafTotals(), rows);
        List<LengthRequirementLine> lengthItems = aggregator.aggregateLengthItems(explosion.getLengthTotals(), rows);
        LOGGER.info("Bestellijst for {}: {} lines, {} length items, {} distinct paths",
                root, bestellijst.size(), lengthItems.size(), explosion.getVisitedPathCount());

        List<ComparisonLine> comparison = target == null ? null : comparisonService.compare(bestellijst, target);
        return new BestellijstReport(explosion, bestellijst, lengthItems, comparison);
    }

    /**
     * 在任何展开之前确定根物料；找不到时抛 {@link MissingRootException}。
     */
    public String resolveRoot(List<BomArc> rows) {
        List<String> candidates = rows.stream()
                .filter(BomArc::isRoot)
                .map(BomArc::getItem)
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw new MissingRootException();
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        switch (rootPolicy) {
            case FIRST_ENCOUNTERED:
                LOGGER.warn("{} root rows found {}, using first encountered {}", candidates.size(), candidates, candidates.get(0));
                return candidates.get(0);
            case LOWEST_ITEM:
                String lowest = candidates.stream().min(Comparator.naturalOrder()).orElseThrow();
                LOGGER.warn("{} root rows found {}, using lowest item {}", candidates.size(), candidates, lowest);
                return lowest;
            case STRICT:
            default:
                throw new AmbiguousRootException(candidates);
        }
    }
}
