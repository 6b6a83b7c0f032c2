package com.peopleanalytics.importjob.parser;

import com.peopleanalytics.exception.FatalImportException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads CSV and XLSX uploads into header-keyed rows. Headers are normalized to lower case with
 * spaces replaced by underscores; blank rows are dropped but keep their row number.
 */
@Slf4j
@Component
public class ImportFileParser {

    private static final char BOM = '\uFEFF';

    public ImportTable parse(byte[] content, String fileName) {
        if (content == null || content.length == 0) {
            throw new FatalImportException("File is empty");
        }

        String extension = extensionOf(fileName);
        List<List<String>> records = switch (extension) {
            case "csv" -> readCsv(content);
            case "xlsx" -> readXlsx(content);
            default -> throw new FatalImportException("Unsupported file format: "
                    + (extension.isEmpty() ? "no extension" : "." + extension) + ". Use .csv or .xlsx");
        };

        ImportTable table = toTable(records);
        log.debug("Parsed {}: {} columns, {} data rows", fileName, table.headers().size(), table.rows().size());
        return table;
    }

    public static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String value = header.trim();
        if (!value.isEmpty() && value.charAt(0) == BOM) {
            value = value.substring(1).trim();
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }

    private ImportTable toTable(List<List<String>> records) {
        if (records.isEmpty() || isBlank(records.get(0))) {
            throw new FatalImportException("File is empty");
        }

        List<String> headers = new ArrayList<>();
        for (String header : records.get(0)) {
            headers.add(normalizeHeader(header));
        }

        List<ImportRow> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            if (isBlank(record)) {
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                String header = headers.get(c);
                if (header.isEmpty() || values.containsKey(header)) {
                    continue;
                }
                values.put(header, c < record.size() ? record.get(c) : null);
            }
            rows.add(new ImportRow(i, values));
        }

        if (rows.isEmpty()) {
            throw new FatalImportException("File contains no data rows");
        }
        return new ImportTable(headers, rows);
    }

    private static String decodeUtf8(byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new FatalImportException("File is not valid UTF-8", e);
        }
    }

    /**
     * RFC 4180 style reader: fields may be wrapped in double quotes, a doubled quote inside a
     * quoted field is a literal quote, and quoted fields may span lines.
     */
    List<List<String>> readCsv(byte[] content) {
        String text = decodeUtf8(content);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        int length = text.length();

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                record.add(field.toString());
                field.setLength(0);
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                record.add(field.toString());
                field.setLength(0);
                records.add(record);
                record = new ArrayList<>();
            } else {
                field.append(c);
            }
        }

        if (inQuotes) {
            throw new FatalImportException("Malformed CSV: unterminated quoted field");
        }
        if (field.length() > 0 || !record.isEmpty()) {
            record.add(field.toString());
            records.add(record);
        }
        return records;
    }

    List<List<String>> readXlsx(byte[] content) {
        try (InputStream is = new ByteArrayInputStream(content);
             Workbook workbook = new XSSFWorkbook(is)) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new FatalImportException("File is empty");
            }
            Sheet sheet = workbook.getSheetAt(0);
            List<List<String>> records = new ArrayList<>();
            int lastRow = sheet.getLastRowNum();
            if (lastRow < 0) {
                return records;
            }

            Row headerRow = sheet.getRow(0);
            int width = headerRow == null ? 0 : Math.max(headerRow.getLastCellNum(), 0);
            for (int r = 0; r <= lastRow; r++) {
                Row row = sheet.getRow(r);
                List<String> record = new ArrayList<>(width);
                for (int c = 0; c < width; c++) {
                    record.add(row == null ? null : cellText(row.getCell(c)));
                }
                records.add(record);
            }
            return records;
        } catch (FatalImportException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.warn("Unreadable XLSX upload: {}", e.getMessage());
            throw new FatalImportException("Unreadable XLSX file", e);
        }
    }

    private String cellText(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue().toLocalDate().toString();
                }
                yield BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            }
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> null;
        };
    }

    private static boolean isBlank(List<String> record) {
        for (String value : record) {
            if (value != null && !value.trim().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).trim().toLowerCase(Locale.ROOT);
    }
}
