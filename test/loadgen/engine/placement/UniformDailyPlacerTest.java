package loadgen.engine.placement;

import loadgen.model.ActivationCurve;
import loadgen.model.TimeSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class UniformDailyPlacerTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 1, 2, 23, 59);
    private static final int POINTS_PER_DAY = 1440;

    @Test
    public void testActivationsPerDay() {
        PlacementResult r = new UniformDailyPlacer(3)
                .place(constant(10, 100), minuteSeries(), ActivationPlacer.randomFor(7L));

        List<Integer> starts = r.activationStarts();
        assertThat(starts).hasSize(6).isSorted().doesNotHaveDuplicates();
        assertThat(starts.stream().filter(s -> s < POINTS_PER_DAY)).hasSize(3);
        for (int s : starts) {
            // начало в пределах своего дня, активация в день помещается
            assertThat(s % POINTS_PER_DAY).isLessThan(POINTS_PER_DAY - 10);
            assertThat(r.series().powerAt(s)).isEqualTo(100.0);
        }
    }

    @Test
    public void testSameSeedSameSeries() {
        PlacementResult a = new UniformDailyPlacer(4)
                .place(constant(30, 500), minuteSeries(), ActivationPlacer.randomFor(42L));
        PlacementResult b = new UniformDailyPlacer(4)
                .place(constant(30, 500), minuteSeries(), ActivationPlacer.randomFor(42L));

        assertThat(a.activationStarts()).isEqualTo(b.activationStarts());
        assertThat(a.series().toArray()).containsExactly(b.series().toArray());
    }

    @Test
    public void testCountCappedByFreeStarts() {
        // в дне остаётся 10 возможных начал, запрошено 50
        PlacementResult r = new UniformDailyPlacer(50)
                .place(constant(POINTS_PER_DAY - 10, 100), minuteSeries(), ActivationPlacer.randomFor(1L));

        assertThat(r.activationCount()).isEqualTo(20);
        assertThat(new HashSet<>(r.activationStarts())).hasSize(20);
    }

    @Test
    public void testOverlapsMergeByMaximum() {
        ActivationCurve curve = constant(POINTS_PER_DAY - 10, 100);

        PlacementResult r = new UniformDailyPlacer(50).place(curve, minuteSeries(), ActivationPlacer.randomFor(1L));

        assertThat(Arrays.stream(r.series().toArray()).max().getAsDouble()).isEqualTo(curve.maxPower());
    }

    @Test
    public void testDayTooShortIsSkipped() {
        PlacementResult r = new UniformDailyPlacer(2)
                .place(constant(POINTS_PER_DAY, 100), minuteSeries(), ActivationPlacer.randomFor(1L));

        assertThat(r.activationStarts()).isEmpty();
        assertThat(r.series().toArray()).containsOnly(0.0);
    }

    @Test
    public void testPartialLastDay() {
        // второй день - всего 20 минут
        TimeSeries series = new TimeSeries(START, LocalDateTime.of(2024, 1, 2, 0, 19), 60);

        PlacementResult r = new UniformDailyPlacer(5)
                .place(constant(15, 100), series, ActivationPlacer.randomFor(3L));

        // 20 - 15 = 5 начал во втором дне
        assertThat(r.activationStarts().stream().filter(s -> s >= POINTS_PER_DAY)).hasSize(5);
        assertThat(r.activationCount()).isEqualTo(10);
    }

    @Test
    public void testNegativeCount() {
        assertThatThrownBy(() -> new UniformDailyPlacer(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static TimeSeries minuteSeries() {
        return new TimeSeries(START, END, 60);
    }

    static ActivationCurve constant(int length, double power) {
        double[] p = new double[length];
        Arrays.fill(p, power);
        return new ActivationCurve(p, 60);
    }
}
