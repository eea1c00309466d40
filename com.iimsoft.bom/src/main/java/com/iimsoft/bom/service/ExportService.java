package com.iimsoft.bom.service;

import com.iimsoft.bom.domain.ComparisonLine;
import com.iimsoft.bom.domain.RequirementLine;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 导出：清单 → CSV，对账结果 → Excel（sheet "Vergelijking"）
 */
public class ExportService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExportService.class);

    public static final String COMPARISON_SHEET = "Vergelijking";

    static final String[] BESTELLIJST_HEADER = {"item", "productname", "total_quantity"};
    static final String[] COMPARISON_HEADER = {"item", "productname_teamcenter", "total_quantity_teamcenter",
            "productname_d365", "total_quantity_d365", "status"};

    public void exportBestellijstToCsv(List<RequirementLine> lines, Path csvPath) throws IOException {
        Path file = prepareTarget(csvPath);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(BESTELLIJST_HEADER).build())) {
            for (RequirementLine line : lines) {
                printer.printRecord(line.getItem(), line.getProductName(), line.getTotalQuantity());
            }
        }
        LOGGER.info("Wrote {} bestellijst lines to {}", lines.size(), file);
    }

    public void exportComparisonToExcel(List<ComparisonLine> lines, Path xlsxPath) throws IOException {
        Path file = prepareTarget(xlsxPath);
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream out = Files.newOutputStream(file)) {
            writeComparisonSheet(workbook, lines);
            workbook.write(out);
        }
        LOGGER.info("Wrote {} comparison lines to {}", lines.size(), file);
    }

    void writeComparisonSheet(Workbook workbook, List<ComparisonLine> lines) {
        Sheet sheet = workbook.createSheet(COMPARISON_SHEET);
        CellStyle headerStyle = headerStyle(workbook);

        Row header = sheet.createRow(0);
        for (int i = 0; i < COMPARISON_HEADER.length; i++) {
            header.createCell(i).setCellValue(COMPARISON_HEADER[i]);
            header.getCell(i).setCellStyle(headerStyle);
        }

        int rowIdx = 1;
        for (ComparisonLine line : lines) {
            Row row = sheet.createRow(rowIdx++);
            row.createCell(0).setCellValue(line.getItem());
            if (line.getBomProductName() != null) row.createCell(1).setCellValue(line.getBomProductName());
            if (line.getBomQuantity() != null) row.createCell(2).setCellValue(line.getBomQuantity());
            if (line.getTargetProductName() != null) row.createCell(3).setCellValue(line.getTargetProductName());
            if (line.getTargetQuantity() != null) row.createCell(4).setCellValue(line.getTargetQuantity());
            row.createCell(5).setCellValue(line.getStatus().getLabel());
        }
        // 固定列宽：autoSizeColumn 依赖 AWT 字体，无头环境下不可用
        for (int i = 0; i < COMPARISON_HEADER.length; i++) {
            sheet.setColumnWidth(i, (i == 1 || i == 3 ? 40 : 20) * 256);
        }
    }

    private static CellStyle headerStyle(Workbook workbook) {
        CellStyle style = workbook.createCellStyle();
        Font font = workbook.createFont();
        font.setBold(true);
        style.setFont(font);
        return style;
    }

    // 相对路径按工作目录解析，父目录不存在则创建
    private static Path prepareTarget(Path path) throws IOException {
        Path file = path.isAbsolute() ? path : Path.of(System.getProperty("user.dir")).resolve(path);
        if (Files.isDirectory(file)) {
            throw new IOException("Target path is a directory: " + file.toAbsolutePath());
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return file;
    }
}
