package com.iimsoft.bom.util;

import com.iimsoft.bom.domain.TargetLine;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 读取 D365 导出的数量清单（xlsx 第一个 sheet）。
 * 表头 trim + 小写后需包含 "item number"、"product name"、"quantity"。
 * 数量无法解析时按 0 处理并记录 WARN。
 */
public class D365ListReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(D365ListReader.class);

    public static final String COL_ITEM = "item number";
    public static final String COL_PRODUCT_NAME = "product name";
    public static final String COL_QUANTITY = "quantity";

    private final DataFormatter dataFormatter = new DataFormatter();

    public List<TargetLine> read(Path path) throws IOException {
        if (!Files.exists(path) || Files.isDirectory(path)) {
            throw new IOException("D365 file does not exist or is a directory: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            List<TargetLine> lines = read(in);
            LOGGER.info("Read {} D365 lines from {}", lines.size(), path.getFileName());
            return lines;
        }
    }

    public List<TargetLine> read(InputStream in) throws IOException {
        try (Workbook workbook = new XSSFWorkbook(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return List.of();
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                return List.of();
            }
            Map<String, Integer> columns = new HashMap<>();
            for (Cell cell : header) {
                String name = dataFormatter.formatCellValue(cell).trim().toLowerCase(Locale.ROOT);
                columns.putIfAbsent(name, cell.getColumnIndex());
            }
            int itemCol = requireColumn(columns, COL_ITEM);
            int nameCol = requireColumn(columns, COL_PRODUCT_NAME);
            int qtyCol = requireColumn(columns, COL_QUANTITY);

            List<TargetLine> lines = new ArrayList<>();
            for (int i = header.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) continue;
                String item = text(row.getCell(itemCol));
                if (item.isEmpty()) continue;
                String name = text(row.getCell(nameCol));
                double qty = quantity(row.getCell(qtyCol), i + 1);
                lines.add(new TargetLine(item, name, qty));
            }
            return lines;
        }
    }

    private static int requireColumn(Map<String, Integer> columns, String column) {
        Integer idx = columns.get(column);
        if (idx == null) {
            throw new IllegalArgumentException("D365 file is missing column '" + column + "', found " + columns.keySet());
        }
        return idx;
    }

    private String text(Cell cell) {
        return cell == null ? "" : dataFormatter.formatCellValue(cell).trim();
    }

    private double quantity(Cell cell, int rowNumber) {
        if (cell == null) {
            return 0d;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC) {
            return cell.getNumericCellValue();
        }
        String raw = text(cell);
        if (raw.isEmpty()) {
            return 0d;
        }
        try {
            return Double.parseDouble(raw.replace(',', '.'));
        } catch (NumberFormatException e) {
            LOGGER.warn("Non-numeric D365 quantity '{}' at row {}, using 0", raw, rowNumber);
            return 0d;
        }
    }
}
