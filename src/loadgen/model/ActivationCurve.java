package loadgen.model;

import java.util.Arrays;

/**
 * Одна синтезированная активация прибора на выходном шаге.
 * Все значения неотрицательны.
 */
public final class ActivationCurve {

    private final double[] powerW;
    private final int timestepSec;

    public ActivationCurve(double[] powerW, int timestepSec) {
        this.powerW = Arrays.copyOf(powerW, powerW.length);
        this.timestepSec = timestepSec;
    }

    public int length() {
        return powerW.length;
    }

    public double get(int i) {
        return powerW[i];
    }

    public int getTimestepSec() {
        return timestepSec;
    }

    public double maxPower() {
        double max = 0.0;
        for (double v : powerW) max = Math.max(max, v);
        return max;
    }

    public double[] toArray() {
        return Arrays.copyOf(powerW, powerW.length);
    }
}
