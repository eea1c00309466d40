package com.iimsoft.bom.service;

import com.iimsoft.bom.api.dto.ExplodeRequest;
import com.iimsoft.bom.api.dto.ExplodeResponse;
import com.iimsoft.bom.config.ExplosionConfig;
import com.iimsoft.bom.domain.BestellijstReport;
import com.iimsoft.bom.domain.BomArc;
import com.iimsoft.bom.domain.PathStep;
import com.iimsoft.bom.domain.TargetLine;
import com.iimsoft.bom.domain.TraceEntry;
import com.iimsoft.bom.exception.MalformedQuantityException;
import com.iimsoft.bom.util.QuantityParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * JSON 请求入口：ExplodeRequest → 领域对象 → BestellijstService → ExplodeResponse
 */
public class BestellijstApiService {

    public ExplodeResponse explode(ExplodeRequest request) {
        Objects.requireNonNull(request, "request");
        validateRequest(request);

        ExplosionConfig config = request.config == null ? ExplosionConfig.load() : request.config;
        BestellijstService service = new BestellijstService(config);

        List<BomArc> rows = buildRows(request.rows);
        List<TargetLine> target = buildTarget(request.target);
        BestellijstReport report = service.generate(rows, target);
        return buildResponse(report, request.includeTrace);
    }

    private static void validateRequest(ExplodeRequest request) {
        if (request.rows == null || request.rows.isEmpty()) {
            throw new IllegalArgumentException("request.rows must not be empty");
        }
        for (int i = 0; i < request.rows.size(); i++) {
            if (request.rows.get(i) == null) {
                throw new IllegalArgumentException("request.rows[" + i + "] is null");
            }
        }
    }

    private static List<BomArc> buildRows(List<ExplodeRequest.BomRowDto> dtos) {
        List<BomArc> rows = new ArrayList<>(dtos.size());
        for (int i = 0; i < dtos.size(); i++) {
            ExplodeRequest.BomRowDto r = dtos.get(i);
            double qty;
            boolean root = r.level != null && r.level == 0;
            if (root && (r.quantityPerParent == null || r.quantityPerParent.isBlank())) {
                qty = 1d;
            } else {
                try {
                    qty = QuantityParser.parse(r.quantityPerParent);
                } catch (NumberFormatException e) {
                    // 行号从 1 开始
                    throw new MalformedQuantityException(i + 1, r.quantityPerParent, e);
                }
            }
            rows.add(new BomArc(r.parentItem, r.item, qty, r.template, r.makeOrBuy, r.lineType, r.productName, r.level));
        }
        return rows;
    }

    private static List<TargetLine> buildTarget(List<ExplodeRequest.TargetLineDto> dtos) {
        if (dtos == null) {
            return null;
        }
        List<TargetLine> target = new ArrayList<>(dtos.size());
        for (ExplodeRequest.TargetLineDto t : dtos) {
            if (t == null || t.item == null || t.item.isBlank()) continue;
            target.add(new TargetLine(t.item.trim(), t.productName == null ? "" : t.productName, t.quantity));
        }
        return target;
    }

    public static ExplodeResponse buildResponse(BestellijstReport report, boolean includeTrace) {
        ExplodeResponse resp = new ExplodeResponse();
        resp.rootItem = report.getExplosion().getRootItem();
        resp.bestellijst = report.getBestellijst();
        resp.lengthItems = report.getLengthItems();
        resp.comparison = report.getComparison();
        resp.distinctPaths = report.getExplosion().getVisitedPathCount();

        if (includeTrace) {
            // 按 item 排序输出
            Map<String, List<ExplodeResponse.TraceDto>> traces = new LinkedHashMap<>();
            for (Map.Entry<String, List<TraceEntry>> e : new TreeMap<>(report.getExplosion().getTraceLog()).entrySet()) {
                List<ExplodeResponse.TraceDto> list = new ArrayList<>();
                for (TraceEntry entry : e.getValue()) {
                    ExplodeResponse.TraceDto t = new ExplodeResponse.TraceDto();
                    t.quantity = entry.getQuantity();
                    t.path = entry.getPath().render();
                    t.steps = new ArrayList<>();
                    for (PathStep step : entry.getPath().getSteps()) {
                        ExplodeResponse.StepDto s = new ExplodeResponse.StepDto();
                        s.item = step.getItem();
                        s.quantity = step.getQuantity();
                        t.steps.add(s);
                    }
                    list.add(t);
                }
                traces.put(e.getKey(), list);
            }
            resp.traces = traces;
        }
        return resp;
    }
}
