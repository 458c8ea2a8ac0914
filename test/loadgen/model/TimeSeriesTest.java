package loadgen.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TimeSeriesTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 1, 0, 0);

    @Test
    public void testGridIncludesEnd() {
        TimeSeries s = new TimeSeries(T0, T0.plusMinutes(10), 60);

        assertThat(s.size()).isEqualTo(11);
        assertThat(s.timestampAt(10)).isEqualTo(T0.plusMinutes(10));
        assertThat(s.toArray()).containsOnly(0.0);
    }

    @Test
    public void testUnalignedEnd() {
        TimeSeries s = new TimeSeries(T0, T0.plusSeconds(630), 60);

        assertThat(s.size()).isEqualTo(11);
        assertThat(s.getEnd()).isEqualTo(T0.plusMinutes(10));
    }

    @Test
    public void testOverlayTakesMaximumAndTruncates() {
        TimeSeries s = new TimeSeries(T0, T0.plusMinutes(4), 60);
        ActivationCurve curve = new ActivationCurve(new double[]{100, 300, 200}, 60);

        s.overlayMax(0, curve);
        s.overlayMax(1, curve);
        s.overlayMax(3, curve);

        assertThat(s.toArray()).containsExactly(100, 300, 300, 200, 300);
    }

    @Test
    public void testEnergy() {
        TimeSeries s = new TimeSeries(T0, T0.plusMinutes(59), 60);
        s.overlayMax(0, new ActivationCurve(filled(60, 1000.0), 60));

        assertThat(s.energyWh()).isEqualTo(1000.0);
    }

    @Test
    public void testInvalidWindow() {
        assertThatThrownBy(() -> new TimeSeries(T0, T0.minusMinutes(1), 60))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeSeries(T0, T0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[] filled(int n, double v) {
        double[] a = new double[n];
        java.util.Arrays.fill(a, v);
        return a;
    }
}
