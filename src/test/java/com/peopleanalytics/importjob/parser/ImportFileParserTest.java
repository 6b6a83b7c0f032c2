package com.peopleanalytics.importjob.parser;

import com.peopleanalytics.exception.FatalImportException;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportFileParserTest {

    private ImportFileParser parser;

    @BeforeEach
    void setUp() {
        parser = new ImportFileParser();
    }

    @Test
    void shouldNormalizeHeadersAndKeepRowNumbersAcrossBlankLines() {
        // Arrange
        String csv = "\uFEFFName, Email ,Hire Date\r\n"
                + "Jane Smith,jane@example.com,2023-03-01\r\n"
                + "\r\n"
                + "John Doe,john@example.com,2024-01-15\r\n";

        // Act
        ImportTable table = parser.parse(bytes(csv), "employees.csv");

        // Assert
        assertEquals(List.of("name", "email", "hire_date"), table.headers());
        assertEquals(2, table.rows().size());
        assertEquals(1, table.rows().get(0).rowNumber());
        assertEquals(3, table.rows().get(1).rowNumber());
        assertEquals("john@example.com", table.rows().get(1).get("email"));
        assertEquals("2024-01-15", table.rows().get(1).get("hire_date"));
    }

    @Test
    void shouldHandleQuotedFieldsWithCommasAndEscapedQuotes() {
        // Arrange
        String csv = "employee_email,date,hours,description\n"
                + "jane@example.com,2024-01-10,2.5,\"Call with client, \"\"urgent\"\" review\"\n";

        // Act
        ImportTable table = parser.parse(bytes(csv), "entries.CSV");

        // Assert
        ImportRow row = table.rows().get(0);
        assertEquals("Call with client, \"urgent\" review", row.get("description"));
        assertEquals("2.5", row.get("hours"));
    }

    @Test
    void shouldReturnNullForMissingTrailingColumns() {
        // Arrange
        String csv = "name,email,hire_date,department\nJane Smith,jane@example.com\n";

        // Act
        ImportRow row = parser.parse(bytes(csv), "employees.csv").rows().get(0);

        // Assert
        assertNull(row.get("hire_date"));
        assertNull(row.get("department"));
    }

    @Test
    void shouldRejectEmptyFile() {
        // Act & Assert
        FatalImportException e = assertThrows(FatalImportException.class,
                () -> parser.parse(new byte[0], "employees.csv"));
        assertEquals("File is empty", e.getMessage());
    }

    @Test
    void shouldRejectHeaderOnlyFile() {
        // Act & Assert
        FatalImportException e = assertThrows(FatalImportException.class,
                () -> parser.parse(bytes("name,email,hire_date\n\n"), "employees.csv"));
        assertEquals("File contains no data rows", e.getMessage());
    }

    @Test
    void shouldRejectUnsupportedExtension() {
        // Act & Assert
        FatalImportException e = assertThrows(FatalImportException.class,
                () -> parser.parse(bytes("name\nJane"), "employees.txt"));
        assertTrue(e.getMessage().startsWith("Unsupported file format"));
    }

    @Test
    void shouldRejectUnterminatedQuote() {
        // Act & Assert
        assertThrows(FatalImportException.class,
                () -> parser.parse(bytes("name,email\n\"Jane Smith,jane@example.com\n"), "employees.csv"));
    }

    @Test
    void shouldRejectCsvThatIsNotUtf8() {
        // Arrange
        byte[] latin1 = "name,email,hire_date\nJosé García,jose@example.com,2023-01-01\n"
                .getBytes(StandardCharsets.ISO_8859_1);

        // Act & Assert
        FatalImportException e = assertThrows(FatalImportException.class,
                () -> parser.parse(latin1, "employees.csv"));
        assertEquals("File is not valid UTF-8", e.getMessage());
    }

    @Test
    void shouldRejectCorruptXlsx() {
        // Act & Assert
        FatalImportException e = assertThrows(FatalImportException.class,
                () -> parser.parse(bytes("definitely not a zip"), "employees.xlsx"));
        assertEquals("Unreadable XLSX file", e.getMessage());
    }

    @Test
    void shouldReadFirstSheetOfXlsx() throws IOException {
        // Arrange
        byte[] content;
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Entries");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Employee Email");
            header.createCell(1).setCellValue("Date");
            header.createCell(2).setCellValue("Hours");
            header.createCell(3).setCellValue("Description");
            header.createCell(4).setCellValue("Billable");

            CellStyle dateStyle = workbook.createCellStyle();
            dateStyle.setDataFormat(workbook.getCreationHelper().createDataFormat().getFormat("yyyy-mm-dd"));

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue("jane@example.com");
            first.createCell(1).setCellValue(LocalDate.of(2024, 1, 10));
            first.getCell(1).setCellStyle(dateStyle);
            first.createCell(2).setCellValue(7.5);
            first.createCell(3).setCellValue("Drafted the share purchase agreement");
            first.createCell(4).setCellValue(false);

            // row 2 left empty
            Row third = sheet.createRow(3);
            third.createCell(0).setCellValue("john@example.com");
            third.createCell(1).setCellValue("2024-01-11");
            third.createCell(2).setCellValue(8);
            third.createCell(3).setCellValue("Reviewed board minutes for filing");

            workbook.write(out);
            content = out.toByteArray();
        }

        // Act
        ImportTable table = parser.parse(content, "entries.xlsx");

        // Assert
        assertEquals(List.of("employee_email", "date", "hours", "description", "billable"), table.headers());
        assertEquals(2, table.rows().size());

        ImportRow first = table.rows().get(0);
        assertEquals(1, first.rowNumber());
        assertEquals("2024-01-10", first.get("date"));
        assertEquals("7.5", first.get("hours"));
        assertEquals("false", first.get("billable"));

        ImportRow second = table.rows().get(1);
        assertEquals(3, second.rowNumber());
        assertEquals("8", second.get("hours"));
        assertNull(second.get("billable"));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
