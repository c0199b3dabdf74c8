package com.tallybook.ledger.source;

import org.apache.poi.ss.usermodel.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the first sheet of an .xlsx/.xls workbook. The first non-empty row is the header.
 */
@Component
public class ExcelTabularReader implements TabularReader {

    @Override
    public Set<String> extensions() {
        return Set.of("xlsx", "xls");
    }

    @Override
    public TabularData read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook has no sheets: " + file.getFileName());
            }
            Sheet sheet = workbook.getSheetAt(0);

            Row headerRow = null;
            for (int r = sheet.getFirstRowNum(); r <= sheet.getLastRowNum() && headerRow == null; r++) {
                Row candidate = sheet.getRow(r);
                if (candidate != null && candidate.getLastCellNum() > 0) headerRow = candidate;
            }
            if (headerRow == null) {
                return new TabularData(List.of(), List.of());
            }

            List<String> headers = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                String h = getCellValueAsString(headerRow.getCell(c));
                headers.add(h == null ? "" : h.trim());
            }

            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) continue;
                Map<String, String> values = new LinkedHashMap<>();
                for (int c = 0; c < headers.size(); c++) {
                    values.put(headers.get(c), getCellValueAsString(row.getCell(c)));
                }
                rows.add(values);
            }
            return new TabularData(headers, rows);
        }
    }

    private String getCellValueAsString(Cell cell) {
        if (cell == null) return null;
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getDateCellValue().toInstant().atZone(ZoneId.systemDefault()).toLocalDate().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return null;
        }
    }
}
