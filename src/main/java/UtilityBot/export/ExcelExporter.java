package UtilityBot.export;

import UtilityBot.batch.ProcessingResult;
import UtilityBot.model.ExtractedInvoiceData;
import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.util.List;

/**
 * Schreibt die Zählerdaten eines Stapels als XLSX, eine Zeile pro Datei.
 *
 * Writes the meter data of a batch as XLSX, one row per file.
 * Failed files keep their row with "FEHLER: ..." in the address column.
 */
@Component
public class ExcelExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExcelExporter.class);

    public static final String SHEET_NAME = "Zählerdaten";

    enum Column {
        FILE("Datei"),
        ADDRESS("Adresse"),
        METER_POINT_ID("Zählpunktnummer"),
        CONSUMPTION("Verbrauch aktuell (kWh)"),
        SOURCE("Quelle"),
        TRUST_SCORE("Trust-Score");

        final String header;

        Column(String header) {
            this.header = header;
        }
    }

    public void export(List<ProcessingResult> results, File targetFile) throws IOException {
        try (Workbook workbook = new XSSFWorkbook();
             OutputStream out = new FileOutputStream(targetFile)) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            Styles styles = Styles.create(workbook);

            writeHeader(sheet, styles);
            int rowIndex = 1;
            for (ProcessingResult result : results) {
                writeResult(sheet.createRow(rowIndex++), result, styles);
            }

            // Breite nach Inhalt, plus etwas Luft, Excel-Maximum 255 Zeichen
            for (Column column : Column.values()) {
                sheet.autoSizeColumn(column.ordinal());
                sheet.setColumnWidth(column.ordinal(),
                        Math.min(sheet.getColumnWidth(column.ordinal()) + 1000, 255 * 256));
            }
            sheet.createFreezePane(0, 1);

            workbook.write(out);
        }
        LOGGER.info("Excel-Export geschrieben: {} ({} Zeilen)", targetFile.getAbsolutePath(), results.size());
    }

    private void writeHeader(Sheet sheet, Styles styles) {
        Row header = sheet.createRow(0);
        for (Column column : Column.values()) {
            text(header, column, column.header, styles.header());
        }
    }

    private void writeResult(Row row, ProcessingResult result, Styles styles) {
        writeFileCell(row, result, styles);

        if (!result.isSuccess()) {
            text(row, Column.ADDRESS, "FEHLER: " + result.errorMessage(), styles.text());
            for (Column column : List.of(Column.METER_POINT_ID, Column.CONSUMPTION, Column.SOURCE, Column.TRUST_SCORE)) {
                text(row, column, "", styles.text());
            }
            return;
        }

        ExtractedInvoiceData data = result.data();
        text(row, Column.ADDRESS, data.address(), styles.text());
        text(row, Column.METER_POINT_ID, data.meterPointId(), styles.text());

        // Verbrauch als Zahl, damit in Excel weitergerechnet werden kann
        if (data.hasCurrentConsumption()) {
            Cell cell = row.createCell(Column.CONSUMPTION.ordinal());
            cell.setCellValue(new BigDecimal(data.currentConsumptionKwh()).doubleValue());
            cell.setCellStyle(styles.number());
        } else {
            text(row, Column.CONSUMPTION, "", styles.text());
        }

        text(row, Column.SOURCE, result.source() != null ? result.source().displayName() : "", styles.text());

        Cell score = row.createCell(Column.TRUST_SCORE.ordinal());
        score.setCellValue(result.trustScore());
        score.setCellStyle(styles.text());
    }

    private void writeFileCell(Row row, ProcessingResult result, Styles styles) {
        Cell cell = text(row, Column.FILE, result.fileName(), styles.text());
        if (result.filePath() == null) {
            return;
        }
        Hyperlink link = row.getSheet().getWorkbook().getCreationHelper().createHyperlink(HyperlinkType.FILE);
        // als URI, sonst lehnt POI Pfade mit Leerzeichen oder Backslashes ab
        link.setAddress(new File(result.filePath()).toURI().toString());
        cell.setHyperlink(link);
        cell.setCellStyle(styles.link());
    }

    private static Cell text(Row row, Column column, String value, CellStyle style) {
        Cell cell = row.createCell(column.ordinal());
        cell.setCellValue(value != null ? value : "");
        cell.setCellStyle(style);
        return cell;
    }

    /**
     * Zellformate, einmal pro Arbeitsmappe erzeugt (XLSX erlaubt nur begrenzt viele Styles).
     */
    private record Styles(CellStyle header, CellStyle text, CellStyle number, CellStyle link) {

        static Styles create(Workbook workbook) {
            CellStyle text = bordered(workbook);

            CellStyle header = bordered(workbook);
            Font bold = workbook.createFont();
            bold.setBold(true);
            bold.setFontHeightInPoints((short) 12);
            header.setFont(bold);
            header.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
            header.setFillPattern(FillPatternType.SOLID_FOREGROUND);

            CellStyle number = bordered(workbook);
            number.setDataFormat(workbook.createDataFormat().getFormat("#,##0.0"));

            CellStyle link = bordered(workbook);
            Font linkFont = workbook.createFont();
            linkFont.setUnderline(Font.U_SINGLE);
            linkFont.setColor(IndexedColors.BLUE.getIndex());
            link.setFont(linkFont);

            return new Styles(header, text, number, link);
        }

        private static CellStyle bordered(Workbook workbook) {
            CellStyle style = workbook.createCellStyle();
            style.setBorderTop(BorderStyle.THIN);
            style.setBorderRight(BorderStyle.THIN);
            style.setBorderBottom(BorderStyle.THIN);
            style.setBorderLeft(BorderStyle.THIN);
            return style;
        }
    }
}
