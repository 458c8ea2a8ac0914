package loadgen.io;

import loadgen.config.GenerationConstants;
import loadgen.model.SeriesPoint;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Чтение ряда, записанного TimeSeriesCsvWriter (с заголовком или без).
 */
public final class TimeSeriesCsvReader {

    private TimeSeriesCsvReader() {}

    public static List<SeriesPoint> read(Path path) throws IOException {
        List<SeriesPoint> out = new ArrayList<>();
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty()) continue;
                if (lineNo == 1 && line.equals(TimeSeriesCsvWriter.HEADER)) continue;

                int comma = line.lastIndexOf(',');
                if (comma < 0) {
                    throw new IOException("Line " + lineNo + ": expected 'timestamp,power' (" + path + ")");
                }
                try {
                    LocalDateTime ts = LocalDateTime.parse(line.substring(0, comma).trim(),
                            GenerationConstants.TIMESTAMP_FORMAT);
                    double power = Double.parseDouble(line.substring(comma + 1).trim());
                    out.add(new SeriesPoint(ts, power));
                } catch (DateTimeParseException | NumberFormatException e) {
                    throw new IOException("Line " + lineNo + ": " + e.getMessage() + " (" + path + ")", e);
                }
            }
        }
        return out;
    }
}
