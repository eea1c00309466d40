package com.iimsoft.bom.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.bom.domain.BestellijstReport;
import com.iimsoft.bom.domain.BomArc;
import com.iimsoft.bom.domain.TargetLine;
import com.iimsoft.bom.service.BestellijstApiService;
import com.iimsoft.bom.service.BestellijstService;
import com.iimsoft.bom.service.ExportService;
import com.iimsoft.bom.util.D365ListReader;
import com.iimsoft.bom.util.TeamcenterBomReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * 文件入口：Teamcenter BOM（CSV）→ bestellijst，可选与 D365 清单（xlsx）对账。
 *
 * 用法：
 * - mvn exec:java -Dexec.args="bom.csv"
 * - mvn exec:java -Dexec.args="bom.csv d365.xlsx BOM_Comparison_Result.xlsx"
 * - mvn exec:java -Dexec.args="bom.csv - - bestellijst.csv"
 *
 * 结果以 JSON 打印到 stdout；第三个参数给出时把对账结果写入 Excel，第四个参数给出时把 bestellijst 写成 CSV。
 * 可选参数写 "-" 表示跳过。
 */
public class BestellijstApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(BestellijstApp.class);

    public static void main(String[] args) throws Exception {
        if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
            System.err.println("Missing argument: Teamcenter BOM CSV file.\n" +
                    "Usage: BestellijstApp <teamcenter.csv> [d365.xlsx|-] [comparison.xlsx|-] [bestellijst.csv]");
            System.exit(2);
            return;
        }
        if (optionalPath(args, 2) != null && optionalPath(args, 1) == null) {
            System.err.println("A comparison output file requires a D365 file.");
            System.exit(2);
            return;
        }

        try {
            String json = run(args);
            System.out.println(json);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            LOGGER.error("Bestellijst generation failed", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static String run(String[] args) throws IOException {
        List<BomArc> rows = new TeamcenterBomReader().read(Path.of(args[0].trim()));
        Path d365 = optionalPath(args, 1);
        Path comparisonOut = optionalPath(args, 2);
        Path bestellijstOut = optionalPath(args, 3);
        if (comparisonOut != null && d365 == null) {
            throw new IllegalArgumentException("A comparison output file requires a D365 file");
        }
        List<TargetLine> target = d365 == null ? null : new D365ListReader().read(d365);

        BestellijstReport report = new BestellijstService().generate(rows, target);

        ExportService exportService = new ExportService();
        if (comparisonOut != null && report.hasComparison()) {
            exportService.exportComparisonToExcel(report.getComparison(), comparisonOut);
        }
        if (bestellijstOut != null) {
            exportService.exportBestellijstToCsv(report.getBestellijst(), bestellijstOut);
        }

        ObjectMapper mapper = new ObjectMapper();
        return mapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(BestellijstApiService.buildResponse(report, true));
    }

    private static Path optionalPath(String[] args, int index) {
        if (args.length <= index || args[index] == null) {
            return null;
        }
        String value = args[index].trim();
        return value.isEmpty() || "-".equals(value) ? null : Path.of(value);
    }
}
