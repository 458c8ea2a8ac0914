package loadgen.config;

import java.util.Arrays;
import java.util.Map;

/**
 * Вероятности включения прибора по часам суток (24 значения).
 * Диапазоны вида "6-9" полуоткрытые: [6, 9).
 * При пересечении диапазонов для часа берётся максимум.
 */
public final class HourProbabilities {

    private final double[] byHour;

    private HourProbabilities(double[] byHour) {
        this.byHour = byHour;
    }

    public static HourProbabilities none() {
        return new HourProbabilities(new double[GenerationConstants.HOURS_PER_DAY]);
    }

    /**
     * @param ranges "H1-H2" -> вероятность 0..1
     * @throws IllegalArgumentException неверный формат диапазона или вероятности
     */
    public static HourProbabilities fromRanges(Map<String, Double> ranges) {
        double[] probs = new double[GenerationConstants.HOURS_PER_DAY];
        for (Map.Entry<String, Double> e : ranges.entrySet()) {
            int[] range = parseHourRange(e.getKey());
            double p = e.getValue() == null ? Double.NaN : e.getValue();
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new IllegalArgumentException(
                        "Probability for " + e.getKey() + " must be in [0,1], got " + e.getValue());
            }
            for (int hour = range[0]; hour < range[1]; hour++) {
                if (hour >= 0 && hour < GenerationConstants.HOURS_PER_DAY) {
                    probs[hour] = Math.max(probs[hour], p);
                }
            }
        }
        return new HourProbabilities(probs);
    }

    /**
     * Разбор строки "6-9" в пару {6, 9}.
     */
    public static int[] parseHourRange(String hourRange) {
        String[] parts = hourRange == null ? new String[0] : hourRange.split("-", -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException(
                    "Invalid hour range format: " + hourRange + ". Expected format: '6-9'");
        }
        int start;
        int end;
        try {
            start = Integer.parseInt(parts[0].trim());
            end = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid hour range bounds: " + hourRange, e);
        }
        if (start < 0 || end > GenerationConstants.HOURS_PER_DAY || start > end) {
            throw new IllegalArgumentException("Hour range out of [0,24]: " + hourRange);
        }
        return new int[]{start, end};
    }

    public double get(int hour) {
        return byHour[hour];
    }

    public double[] toArray() {
        return Arrays.copyOf(byHour, byHour.length);
    }

    @Override
    public String toString() {
        return Arrays.toString(byHour);
    }
}
