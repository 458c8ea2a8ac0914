package loadgen.io;

import loadgen.config.GenerationConstants;
import loadgen.model.TimeSeries;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Выгрузка ряда в xlsx: лист SERIES, колонки timestamp / power.
 * Потоковая книга: год минутных данных в память целиком не держим.
 */
public final class TimeSeriesExcelWriter {

    public static final String SHEET_NAME = "SERIES";

    /** Сколько строк SXSSF держит в памяти. */
    private static final int ROW_WINDOW = 500;

    private TimeSeriesExcelWriter() {}

    public static void writeXlsx(Path path, String applianceName, TimeSeries series) throws IOException {

        SXSSFWorkbook wb = new SXSSFWorkbook(ROW_WINDOW);
        try {
            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle timeStyle = wb.createCellStyle();
            timeStyle.setDataFormat(df.getFormat("yyyy-mm-dd hh:mm:ss"));

            CellStyle powerStyle = wb.createCellStyle();
            powerStyle.setAlignment(HorizontalAlignment.CENTER);
            powerStyle.setDataFormat(df.getFormat("0.0"));

            Sheet sh = wb.createSheet(SHEET_NAME);
            int r = 0;

            // паспорт: прибор и сетка
            Row passport = sh.createRow(r++);
            passport.createCell(0).setCellValue(String.format(java.util.Locale.ROOT,
                    "appliance=%s; start=%s; step=%ds; points=%d; energy=%.1f Wh",
                    applianceName,
                    GenerationConstants.TIMESTAMP_FORMAT.format(series.getStart()),
                    series.getStepSec(),
                    series.size(),
                    series.energyWh()));

            Row hdr = sh.createRow(r++);
            writeHeader(hdr, 0, "timestamp", headerStyle);
            writeHeader(hdr, 1, "power", headerStyle);

            for (int i = 0; i < series.size(); i++) {
                Row row = sh.createRow(r++);

                Cell t = row.createCell(0);
                t.setCellValue(series.timestampAt(i));
                t.setCellStyle(timeStyle);

                Cell p = row.createCell(1);
                p.setCellValue(series.powerAt(i));
                p.setCellStyle(powerStyle);
            }

            sh.setColumnWidth(0, 20 * 256);
            sh.setColumnWidth(1, 12 * 256);

            try (OutputStream out = Files.newOutputStream(path)) {
                wb.write(out);
            }
        } finally {
            wb.dispose();
            wb.close();
        }
    }

    private static void writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
    }
}
