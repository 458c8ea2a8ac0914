package loadgen.model;

import java.util.Arrays;

/**
 * Записанный цикл работы прибора (шаблон).
 * Последовательность мощности снята с фиксированным внутренним шагом.
 */
public final class TemplatePattern {

    private final String id;

    /** Мощность по отсчётам, Вт */
    private final double[] powerSequence;

    /** Пиковая мощность цикла, Вт */
    private final double maxPower;

    /** Полная длительность цикла, с */
    private final double totalDurationSeconds;

    public TemplatePattern(String id,
                           double[] powerSequence,
                           double maxPower,
                           double totalDurationSeconds) {
        if (powerSequence == null || powerSequence.length == 0) {
            throw new IllegalArgumentException("Template " + id + " has an empty power_sequence");
        }
        this.id = id;
        this.powerSequence = Arrays.copyOf(powerSequence, powerSequence.length);
        this.maxPower = maxPower;
        this.totalDurationSeconds = totalDurationSeconds;
    }

    public String getId() {
        return id;
    }

    public double[] getPowerSequence() {
        return Arrays.copyOf(powerSequence, powerSequence.length);
    }

    public int length() {
        return powerSequence.length;
    }

    public double getMaxPower() {
        return maxPower;
    }

    public double getTotalDurationSeconds() {
        return totalDurationSeconds;
    }

    public double getTotalDurationMin() {
        return totalDurationSeconds / 60.0;
    }

    @Override
    public String toString() {
        return "TemplatePattern{" + id + ", n=" + powerSequence.length
                + ", max=" + maxPower + ", dur=" + totalDurationSeconds + "s}";
    }
}
