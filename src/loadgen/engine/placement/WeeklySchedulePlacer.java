package loadgen.engine.placement;

import loadgen.config.GenerationConstants;
import loadgen.config.ScheduleConfig;
import loadgen.model.ActivationCurve;
import loadgen.model.TimeSeries;
import org.apache.commons.math3.distribution.EnumeratedIntegerDistribution;
import org.apache.commons.math3.random.RandomGenerator;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Вероятностное недельное размещение по часовому расписанию.
 * <p>
 * Для каждой недели (пн-вс, включая неполные крайние):
 * - квота = round(activationsPerWeek * дней_в_окне / 7);
 * - вероятность позиции - из расписания будней/выходных по часу отсчёта;
 * - взвешенная выборка без пересечений, не более 2 * (число позиций) попыток;
 * - недобор добирается детерминированно по убыванию вероятности.
 * Неделя без допустимых позиций пропускается.
 */
public final class WeeklySchedulePlacer implements ActivationPlacer {

    private final ScheduleConfig schedule;

    public WeeklySchedulePlacer(ScheduleConfig schedule) {
        this.schedule = schedule;
    }

    @Override
    public PlacementResult place(ActivationCurve curve, TimeSeries series, RandomGenerator rng) {
        int activationSteps = curve.length();
        int n = series.size();
        LocalDate firstDate = series.getStart().toLocalDate();
        LocalDate lastDate = series.getEnd().toLocalDate();

        List<Integer> starts = new ArrayList<>();
        int i = 0;
        while (i < n) {
            // отрезок [first; i) - точки одной недели
            int first = i;
            LocalDate weekStart = mondayOf(series.dateAt(first));
            while (i < n && mondayOf(series.dateAt(i)).equals(weekStart)) i++;

            int target = weekQuota(weekStart, firstDate, lastDate);
            NavigableSet<Integer> selected = selectWeek(series, first, i, activationSteps, target, rng);

            for (int at : selected) {
                series.overlayMax(at, curve);
                starts.add(at);
            }
        }
        return new PlacementResult(series, starts);
    }

    /**
     * Квота недели пропорционально числу её дней внутри [firstDate; lastDate].
     */
    int weekQuota(LocalDate weekStart, LocalDate firstDate, LocalDate lastDate) {
        LocalDate from = weekStart.isBefore(firstDate) ? firstDate : weekStart;
        LocalDate weekEnd = weekStart.plusDays(GenerationConstants.DAYS_PER_WEEK - 1);
        LocalDate to = weekEnd.isAfter(lastDate) ? lastDate : weekEnd;
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        return (int) Math.round(schedule.getActivationsPerWeek() * days
                / (double) GenerationConstants.DAYS_PER_WEEK);
    }

    private NavigableSet<Integer> selectWeek(TimeSeries series,
                                             int first,
                                             int last,
                                             int activationSteps,
                                             int target,
                                             RandomGenerator rng) {
        NavigableSet<Integer> selected = new TreeSet<>();

        // допустимые позиции: активация целиком помещается до конца ряда
        List<Integer> positions = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int idx = first; idx < last; idx++) {
            if (idx + activationSteps > series.size()) break;
            LocalDateTime ts = series.timestampAt(idx);
            positions.add(idx);
            weights.add(schedule.forDay(isWeekend(ts.getDayOfWeek())).get(ts.getHour()));
        }
        if (positions.isEmpty() || target <= 0) {
            return selected;
        }

        double[] probs = normalize(weights);

        // в выборку попадают только позиции с ненулевой вероятностью
        int positive = 0;
        for (double p : probs) if (p > 0.0) positive++;
        int[] singletons = new int[positive];
        double[] singletonProbs = new double[positive];
        for (int k = 0, m = 0; k < probs.length; k++) {
            if (probs[k] > 0.0) {
                singletons[m] = positions.get(k);
                singletonProbs[m] = probs[k];
                m++;
            }
        }
        EnumeratedIntegerDistribution draw = new EnumeratedIntegerDistribution(rng, singletons, singletonProbs);

        int maxAttempts = positions.size() * 2;
        int attempts = 0;
        while (selected.size() < target && attempts < maxAttempts) {
            attempts++;
            int candidate = draw.sample();
            if (!overlaps(selected, candidate, activationSteps)) {
                selected.add(candidate);
            }
        }

        if (selected.size() < target) {
            List<Integer> order = new ArrayList<>(positions.size());
            for (int k = 0; k < positions.size(); k++) order.add(k);
            // устойчивая сортировка: при равной вероятности - более ранняя позиция
            order.sort(Comparator.comparingDouble((Integer k) -> probs[k]).reversed());

            for (int k : order) {
                if (selected.size() >= target) break;
                int candidate = positions.get(k);
                if (!overlaps(selected, candidate, activationSteps)) {
                    selected.add(candidate);
                }
            }
        }
        return selected;
    }

    /** Пересечение: ближе activationSteps отсчётов к уже принятой позиции. */
    static boolean overlaps(NavigableSet<Integer> selected, int candidate, int activationSteps) {
        Integer below = selected.floor(candidate);
        if (below != null && candidate - below < activationSteps) return true;
        Integer above = selected.ceiling(candidate);
        return above != null && above - candidate < activationSteps;
    }

    private static double[] normalize(List<Double> weights) {
        double[] p = new double[weights.size()];
        double sum = 0.0;
        for (double w : weights) sum += w;
        for (int k = 0; k < p.length; k++) {
            p[k] = (sum > 0.0) ? weights.get(k) / sum : 1.0 / p.length;
        }
        return p;
    }

    static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    private static LocalDate mondayOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public ScheduleConfig getSchedule() {
        return schedule;
    }
}
