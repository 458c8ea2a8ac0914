package loadgen.engine.placement;

import loadgen.model.ActivationCurve;
import loadgen.model.TimeSeries;
import org.apache.commons.math3.random.RandomDataGenerator;
import org.apache.commons.math3.random.RandomGenerator;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Равномерное случайное размещение: для каждого календарного дня выбираются
 * min(activationsPerDay, maxStart) различных начальных позиций из [0; maxStart),
 * где maxStart = (точек в дне) - (длина активации).
 * День, в который активация не помещается, пропускается.
 */
public final class UniformDailyPlacer implements ActivationPlacer {

    private final int activationsPerDay;

    public UniformDailyPlacer(int activationsPerDay) {
        if (activationsPerDay < 0) {
            throw new IllegalArgumentException("activationsPerDay must be >= 0");
        }
        this.activationsPerDay = activationsPerDay;
    }

    @Override
    public PlacementResult place(ActivationCurve curve, TimeSeries series, RandomGenerator rng) {
        RandomDataGenerator sampler = new RandomDataGenerator(rng);
        int activationSteps = curve.length();
        int n = series.size();

        List<Integer> starts = new ArrayList<>();
        int i = 0;
        while (i < n) {
            // отрезок [first; i) - точки одного календарного дня
            int first = i;
            LocalDate day = series.dateAt(first);
            while (i < n && series.dateAt(i).equals(day)) i++;

            int maxStart = (i - first) - activationSteps;
            if (maxStart <= 0) continue;

            int count = Math.min(activationsPerDay, maxStart);
            if (count <= 0) continue;

            for (int offset : sampler.nextPermutation(maxStart, count)) {
                int at = first + offset;
                series.overlayMax(at, curve);
                starts.add(at);
            }
        }

        Collections.sort(starts);
        return new PlacementResult(series, starts);
    }

    public int getActivationsPerDay() {
        return activationsPerDay;
    }
}
