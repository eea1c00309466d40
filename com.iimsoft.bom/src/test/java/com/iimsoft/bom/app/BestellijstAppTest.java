package com.iimsoft.bom.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class BestellijstAppTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void printsBestellijstForTeamcenterExport() throws IOException {
        Path csv = copyResource("teamcenter-bom.csv");

        JsonNode json = mapper.readTree(BestellijstApp.run(new String[] {csv.toString()}));

        assertEquals("4711", json.get("rootItem").asText());
        JsonNode lines = json.get("bestellijst");
        // 100-AXLE, 200-BOLT, 500-FLOOR, 700-PAINT
        assertEquals(4, lines.size());
        assertEquals("200-BOLT", lines.get(1).get("item").asText());
        assertEquals(40d, lines.get(1).get("totalQuantity").asDouble(), 1e-9);
        assertEquals(0.5, lines.get(3).get("totalQuantity").asDouble(), 1e-9);
        assertEquals("300-BEAM", json.get("lengthItems").get(0).get("item").asText());
        assertEquals("Beam MM", json.get("lengthItems").get(0).get("template").asText());
        assertFalse(json.has("comparison"));
        assertEquals(2, json.get("traces").get("200-BOLT").size());
    }

    @Test
    void writesComparisonWorkbook() throws IOException {
        Path csv = copyResource("teamcenter-bom.csv");
        Path d365 = tempDir.resolve("d365.xlsx");
        try (Workbook wb = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(d365)) {
            Sheet sheet = wb.createSheet();
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Item number");
            header.createCell(1).setCellValue("Product name");
            header.createCell(2).setCellValue("Quantity");
            Row bolt = sheet.createRow(1);
            bolt.createCell(0).setCellValue("200-BOLT");
            bolt.createCell(1).setCellValue("Bolt M12x40");
            bolt.createCell(2).setCellValue(40);
            wb.write(out);
        }
        Path result = tempDir.resolve("result/BOM_Comparison_Result.xlsx");

        JsonNode json = mapper.readTree(BestellijstApp.run(new String[] {csv.toString(), d365.toString(), result.toString()}));

        assertTrue(Files.exists(result));
        JsonNode comparison = json.get("comparison");
        assertEquals(4, comparison.size());
        assertEquals("ONLY_IN_BOM", comparison.get(0).get("status").asText());
        assertEquals("MATCH", comparison.get(1).get("status").asText());
    }

    @Test
    void writesBestellijstCsvWhenRequested() throws IOException {
        Path csv = copyResource("teamcenter-bom.csv");
        Path out = tempDir.resolve("out/bestellijst.csv");

        BestellijstApp.run(new String[] {csv.toString(), "-", "-", out.toString()});

        List<String> written = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals("item,productname,total_quantity", written.get(0));
        assertEquals(5, written.size());
        assertTrue(written.get(2).startsWith("200-BOLT,"));
        assertTrue(written.get(2).endsWith(",40.0"));
    }

    @Test
    void comparisonOutputWithoutD365IsRejected() throws IOException {
        Path csv = copyResource("teamcenter-bom.csv");
        Path result = tempDir.resolve("BOM_Comparison_Result.xlsx");

        assertThrows(IllegalArgumentException.class,
                () -> BestellijstApp.run(new String[] {csv.toString(), "-", result.toString()}));
        assertFalse(Files.exists(result));
    }

    private Path copyResource(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getResourceAsStream("/" + name)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }
}
