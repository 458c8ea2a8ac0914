package loadgen.io;

import loadgen.model.ActivationCurve;
import loadgen.model.SeriesPoint;
import loadgen.model.TimeSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class TimeSeriesCsvWriterTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 5, 6, 0);

    @TempDir
    Path tmp;

    @Test
    public void testPlayerFormatWithoutHeader() throws Exception {
        Path file = tmp.resolve("kettle_consumption.csv");

        TimeSeriesCsvWriter.write(file, sample());

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(5);
        assertThat(lines.get(0)).isEqualTo("2024-03-05 06:00:00,0.0");
        assertThat(lines.get(1)).isEqualTo("2024-03-05 06:01:00,1234.6");
        assertThat(lines.get(2)).isEqualTo("2024-03-05 06:02:00,17.0");
    }

    @Test
    public void testHeader() throws Exception {
        Path file = tmp.resolve("with_header.csv");

        TimeSeriesCsvWriter.write(file, sample(), true);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines.get(0)).isEqualTo(TimeSeriesCsvWriter.HEADER);
        assertThat(lines).hasSize(6);
    }

    @Test
    public void testReadBack() throws Exception {
        TimeSeries series = sample();
        Path file = tmp.resolve("series.csv");
        TimeSeriesCsvWriter.write(file, series, true);

        List<SeriesPoint> points = TimeSeriesCsvReader.read(file);

        List<SeriesPoint> expected = series.points();
        assertThat(points).hasSameSizeAs(expected);
        for (int i = 0; i < points.size(); i++) {
            assertThat(points.get(i).timestamp()).isEqualTo(expected.get(i).timestamp());
            assertThat(points.get(i).powerW()).isCloseTo(expected.get(i).powerW(), within(0.05 + 1e-9));
        }
    }

    @Test
    public void testBrokenLine() throws Exception {
        Path file = Files.writeString(tmp.resolve("broken.csv"), "2024-03-05 06:00:00,12.5\nnot a row\n");

        assertThatThrownBy(() -> TimeSeriesCsvReader.read(file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Line 2");
    }

    private static TimeSeries sample() {
        TimeSeries s = new TimeSeries(T0, T0.plusMinutes(4), 60);
        s.overlayMax(1, new ActivationCurve(new double[]{1234.56, 17.0, 3.04}, 60));
        return s;
    }
}
