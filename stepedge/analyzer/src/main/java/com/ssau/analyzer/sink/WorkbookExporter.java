package com.ssau.analyzer.sink;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.OptionalInt;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import lombok.extern.slf4j.Slf4j;

import com.ssau.analyzer.exception.ExportException;
import com.ssau.analyzer.model.AnalyzerConfig;
import com.ssau.analyzer.model.ImageAnalysis;
import com.ssau.analyzer.model.TimedAnalysis;

/**
 * Writes aggregated results to an {@code .xlsx} workbook with a parameter
 * header block above the data table.
 */
@Slf4j
public class WorkbookExporter {

    public static final String SHEET_NAME = "ImageData";
    public static final String UNKNOWN_FOLDER = "Unknown";
    static final int TABLE_HEADER_ROW = 7;

    private static final String[] FIXED_COLUMNS = {
        "Step", "ImageNo", "Speed", "Bucket", "ModifiedTime", "Cumulative_s", "Incremental_s"
    };

    private final DateTimeFormatter timeFormatter;

    public WorkbookExporter(ZoneId zone) {
        this.timeFormatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(zone);
    }

    public Path export(List<TimedAnalysis> results, String folder, AnalyzerConfig config, Path outputDir)
            throws ExportException {
        Path target = outputDir.resolve(OutputNames.baseName(folder) + ".xlsx");
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            writeHeaderBlock(sheet, folder, config);
            writeTableHeader(sheet.createRow(TABLE_HEADER_ROW), config.getMaxEdges());

            int rowIndex = TABLE_HEADER_ROW + 1;
            for (TimedAnalysis result : results) {
                writeResultRow(sheet.createRow(rowIndex++), result);
            }

            Files.createDirectories(outputDir);
            try (OutputStream out = Files.newOutputStream(target)) {
                workbook.write(out);
            }
        } catch (IOException | RuntimeException e) {
            throw new ExportException("Failed to write workbook " + target, e);
        }
        log.info("Exported {} rows to {}", results.size(), target.toAbsolutePath());
        return target;
    }

    private void writeHeaderBlock(Sheet sheet, String folder, AnalyzerConfig config) {
        labelled(sheet.createRow(0), "Folder Path:").createCell(1)
            .setCellValue(folder != null ? folder : UNKNOWN_FOLDER);
        labelled(sheet.createRow(1), "Processing Parameters:");
        labelled(sheet.createRow(2), "Smooth Profile:").createCell(1)
            .setCellValue(config.isSmoothProfile() ? "Yes" : "No");
        labelled(sheet.createRow(3), "Window Size:").createCell(1).setCellValue(config.getWindowSize());
        labelled(sheet.createRow(4), "Min Edge Spacing:").createCell(1).setCellValue(config.getMinSpacing());
        labelled(sheet.createRow(5), "Max Edges:").createCell(1).setCellValue(config.getMaxEdges());
    }

    private static Row labelled(Row row, String label) {
        row.createCell(0).setCellValue(label);
        return row;
    }

    private static void writeTableHeader(Row row, int maxEdges) {
        int col = 0;
        for (String name : FIXED_COLUMNS) {
            row.createCell(col++).setCellValue(name);
        }
        for (int i = 1; i <= maxEdges; i++) {
            row.createCell(col++).setCellValue("Edge" + i);
        }
    }

    private void writeResultRow(Row row, TimedAnalysis result) {
        ImageAnalysis analysis = result.getAnalysis();
        row.createCell(0).setCellValue(analysis.getStep());
        row.createCell(1).setCellValue(analysis.getImageNo());
        row.createCell(2).setCellValue(analysis.getSpeed());
        row.createCell(3).setCellValue(analysis.getBucket());
        row.createCell(4).setCellValue(timeFormatter.format(analysis.getCapturedAt()));
        row.createCell(5).setCellValue(result.getCumulativeSeconds());
        row.createCell(6).setCellValue(result.getIncrementalSeconds());

        int col = FIXED_COLUMNS.length;
        for (int slot = 0; slot < analysis.getEdges().size(); slot++) {
            OptionalInt edge = analysis.getEdges().get(slot);
            if (edge.isPresent()) {
                row.createCell(col + slot).setCellValue(edge.getAsInt());
            } else {
                row.createCell(col + slot).setBlank();
            }
        }
    }
}
