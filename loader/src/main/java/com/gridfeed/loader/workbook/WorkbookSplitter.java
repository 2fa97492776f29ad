package com.gridfeed.loader.workbook;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts every sheet of an {@code .xlsx} workbook into a UTF-8 CSV file named after the sheet.
 *
 * <p>The first row of a sheet is its header. Rows are padded to the widest row; rows with no
 * content are left out. Formula cells are written as their cached result.
 */
public class WorkbookSplitter {
    private static final Logger logger = LoggerFactory.getLogger(WorkbookSplitter.class);
    public static final String FALLBACK_NAME = "sheet";

    public List<Path> split(Path workbookPath, Path csvDir) throws IOException {
        logger.info("Reading workbook {}", workbookPath);
        Files.createDirectories(csvDir);

        List<Path> written = new ArrayList<>();
        Set<String> used = new HashSet<>();
        try (InputStream in = Files.newInputStream(workbookPath);
             Workbook workbook = new XSSFWorkbook(in)) {

            for (int sheetIdx = 0; sheetIdx < workbook.getNumberOfSheets(); sheetIdx++) {
                Sheet sheet = workbook.getSheetAt(sheetIdx);
                String fileName = sheetFileName(sheet.getSheetName());
                if (!used.add(fileName)) {
                    logger.warn("Sheet '{}' maps to {} as well; the earlier sheet is overwritten",
                            sheet.getSheetName(), fileName);
                }

                Path csvPath = csvDir.resolve(fileName);
                int rows = writeSheet(sheet, csvPath);
                logger.info("Converted sheet '{}' to {} ({} rows)", sheet.getSheetName(), csvPath.getFileName(), rows);
                written.add(csvPath);
            }
        }
        return written;
    }

    /**
     * Keeps letters, digits, space, '_' and '-', drops trailing whitespace, and falls back to
     * {@value #FALLBACK_NAME} when nothing is left.
     */
    public static String sheetFileName(String sheetName) {
        StringBuilder kept = new StringBuilder();
        for (char c : sheetName.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '_' || c == '-') {
                kept.append(c);
            }
        }
        String name = kept.toString().stripTrailing();
        return (name.isEmpty() ? FALLBACK_NAME : name) + ".csv";
    }

    private int writeSheet(Sheet sheet, Path csvPath) throws IOException {
        int width = 0;
        for (Row row : sheet) {
            width = Math.max(width, row.getLastCellNum());
        }

        int rows = 0;
        try (Writer writer = Files.newBufferedWriter(csvPath, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
            for (Row row : sheet) {
                List<String> cells = new ArrayList<>(width);
                boolean blank = true;
                for (int col = 0; col < width; col++) {
                    String value = cellText(row.getCell(col));
                    blank &= value.isEmpty();
                    cells.add(value);
                }
                if (blank) {
                    continue;
                }
                printer.printRecord(cells);
                rows++;
            }
        }
        // header included
        return Math.max(rows - 1, 0);
    }

    static String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        switch (type) {
            case STRING:
                return cell.getStringCellValue().trim();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                }
                return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }
}
