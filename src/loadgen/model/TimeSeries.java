package loadgen.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Временной ряд мощности на равномерной сетке [start, end] с шагом stepSec.
 * Изначально нулевой; активации накладываются по правилу поточечного максимума.
 * <p>
 * ВАЖНО: буфер изменяемый и принадлежит одному размещению, между вызовами не разделяется.
 */
public final class TimeSeries {

    private final LocalDateTime start;
    private final int stepSec;
    private final double[] powerW;

    public TimeSeries(LocalDateTime start, LocalDateTime end, int stepSec) {
        if (stepSec <= 0) {
            throw new IllegalArgumentException("stepSec must be > 0");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end " + end + " is before start " + start);
        }
        long seconds = Duration.between(start, end).getSeconds();
        long size = seconds / stepSec + 1;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Window is too large: " + size + " points");
        }
        this.start = start;
        this.stepSec = stepSec;
        this.powerW = new double[(int) size];
    }

    public int size() {
        return powerW.length;
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return timestampAt(powerW.length - 1);
    }

    public int getStepSec() {
        return stepSec;
    }

    public LocalDateTime timestampAt(int i) {
        return start.plusSeconds((long) i * stepSec);
    }

    public LocalDate dateAt(int i) {
        return timestampAt(i).toLocalDate();
    }

    public double powerAt(int i) {
        return powerW[i];
    }

    /**
     * Наложение кривой с позиции from: power[i] = max(power[i], curve[i - from]).
     * Хвост, выходящий за конец сетки, отбрасывается.
     */
    public void overlayMax(int from, ActivationCurve curve) {
        int n = curve.length();
        for (int k = 0; k < n; k++) {
            int i = from + k;
            if (i >= powerW.length) break;
            powerW[i] = Math.max(powerW[i], curve.get(k));
        }
    }

    public double[] toArray() {
        return Arrays.copyOf(powerW, powerW.length);
    }

    public List<SeriesPoint> points() {
        List<SeriesPoint> out = new ArrayList<>(powerW.length);
        for (int i = 0; i < powerW.length; i++) {
            out.add(new SeriesPoint(timestampAt(i), powerW[i]));
        }
        return out;
    }

    /** Энергия за окно, Вт*ч. */
    public double energyWh() {
        double sum = 0.0;
        for (double v : powerW) sum += v;
        return sum * stepSec / 3600.0;
    }
}
