package com.iimsoft.bom.util;

import com.iimsoft.bom.domain.BomArc;
import com.iimsoft.bom.exception.MalformedQuantityException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 读取 Teamcenter 导出的 BOM 文件：
 * - 分隔符是字面量 "(#)"，编码 ISO-8859-1
 * - 表头先 trim、转小写、去掉所有非单词字符（"Qty Per" → "qtyper"）
 * - 数量里的逗号视为小数点
 */
public class TeamcenterBomReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TeamcenterBomReader.class);

    public static final String DELIMITER = "(#)";
    public static final Charset ENCODING = StandardCharsets.ISO_8859_1;

    public static final String COL_PARENT = "parentpart";
    public static final String COL_QTY = "qtyper";
    public static final String COL_ITEM = "item";
    public static final String COL_TEMPLATE = "template";
    public static final String COL_MAKE_BUY = "makebuy";
    public static final String COL_LINE_TYPE = "linetype";
    public static final String COL_PRODUCT_NAME = "productname";
    public static final String COL_LEVEL = "level";

    private static final List<String> REQUIRED_COLUMNS = List.of(COL_PARENT, COL_QTY, COL_ITEM, COL_LEVEL);

    private final CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
            .setDelimiter(DELIMITER)
            .setQuote(null) // 物料名里常有英寸符号 "
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    public List<BomArc> read(Path path) throws IOException {
        if (!Files.exists(path) || Files.isDirectory(path)) {
            throw new IOException("BOM file does not exist or is a directory: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, ENCODING)) {
            List<BomArc> rows = read(reader);
            LOGGER.info("Read {} BOM rows from {}", rows.size(), path.getFileName());
            return rows;
        }
    }

    public List<BomArc> read(Reader reader) throws IOException {
        try (CSVParser parser = csvFormat.parse(reader)) {
            Map<String, Integer> columns = indexColumns(parser.getHeaderNames());
            for (String required : REQUIRED_COLUMNS) {
                if (!columns.containsKey(required)) {
                    throw new IllegalArgumentException("BOM file is missing column '" + required + "', found " + columns.keySet());
                }
            }

            List<BomArc> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                // 表头占第 1 行
                long lineNumber = record.getRecordNumber() + 1;
                String item = value(record, columns, COL_ITEM);
                String parent = value(record, columns, COL_PARENT);
                if (item.isEmpty() && parent.isEmpty()) {
                    LOGGER.debug("Skipping line {} without parent and item", lineNumber);
                    continue;
                }
                Integer level = parseLevel(value(record, columns, COL_LEVEL), lineNumber);
                double qty = parseQuantity(value(record, columns, COL_QTY), level, lineNumber);
                rows.add(new BomArc(
                        parent,
                        item,
                        qty,
                        value(record, columns, COL_TEMPLATE),
                        value(record, columns, COL_MAKE_BUY),
                        value(record, columns, COL_LINE_TYPE),
                        value(record, columns, COL_PRODUCT_NAME),
                        level));
            }
            return rows;
        }
    }

    /**
     * "Parent Part " → "parentpart"
     */
    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return header.trim().toLowerCase(Locale.ROOT).replaceAll("[^\\w]", "");
    }

    private static Map<String, Integer> indexColumns(List<String> headerNames) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < headerNames.size(); i++) {
            // 重名列取第一列
            columns.putIfAbsent(normalizeHeader(headerNames.get(i)), i);
        }
        return columns;
    }

    private static String value(CSVRecord record, Map<String, Integer> columns, String column) {
        Integer idx = columns.get(column);
        if (idx == null || !record.isSet(idx)) {
            return "";
        }
        String v = record.get(idx);
        return v == null ? "" : v.trim();
    }

    private static double parseQuantity(String raw, Integer level, long lineNumber) {
        // 根行的数量不参与计算，Teamcenter 常常留空
        if (raw.isEmpty() && level != null && level == 0) {
            return 1d;
        }
        try {
            return QuantityParser.parse(raw);
        } catch (NumberFormatException e) {
            throw new MalformedQuantityException(lineNumber, raw, e);
        }
    }

    private static Integer parseLevel(String raw, long lineNumber) {
        try {
            return QuantityParser.parseLevel(raw);
        } catch (NumberFormatException e) {
            LOGGER.warn("Ignoring unparseable level '{}' at line {}", raw, lineNumber);
            return null;
        }
    }
}
