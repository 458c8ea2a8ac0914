package loadgen.io;

import loadgen.config.GenerationConstants;
import loadgen.model.TimeSeries;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Выгрузка ряда в CSV.
 * По умолчанию - формат плеера GridLAB-D без заголовка: "yyyy-MM-dd HH:mm:ss,123.4".
 */
public final class TimeSeriesCsvWriter {

    public static final String HEADER = "timestamp,power";

    private TimeSeriesCsvWriter() {}

    public static void write(Path path, TimeSeries series) throws IOException {
        write(path, series, false);
    }

    public static void write(Path path, TimeSeries series, boolean withHeader) throws IOException {
        try (BufferedWriter w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            if (withHeader) {
                w.write(HEADER);
                w.newLine();
            }
            for (int i = 0; i < series.size(); i++) {
                w.write(GenerationConstants.TIMESTAMP_FORMAT.format(series.timestampAt(i)));
                w.write(',');
                w.write(f(series.powerAt(i)));
                w.newLine();
            }
        }
    }

    private static String f(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
