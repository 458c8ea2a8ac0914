package loadgen.engine.synthesis;

/**
 * Нормировка и масштабирование кривых мощности.
 */
public final class CurveMath {

    /** Значение нормированной кривой, если все отсчёты шаблона одинаковы. */
    public static final double DEGENERATE_LEVEL = 0.5;

    private CurveMath() {}

    /**
     * Min-max нормировка в [0;1].
     * Постоянная последовательность даёт константу 0.5 (деления на ноль нет).
     */
    public static double[] normalize(double[] seq) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : seq) {
            if (v < min) min = v;
            if (v > max) max = v;
        }

        double[] out = new double[seq.length];
        if (max == min) {
            java.util.Arrays.fill(out, DEGENERATE_LEVEL);
            return out;
        }
        double range = max - min;
        for (int i = 0; i < seq.length; i++) {
            out[i] = (seq[i] - min) / range;
        }
        return out;
    }

    /**
     * Аффинное отображение: normalized * (nominal - baseline) + baseline.
     */
    public static double[] scale(double[] normalized, double nominal, double baseline) {
        double[] out = new double[normalized.length];
        double span = nominal - baseline;
        for (int i = 0; i < normalized.length; i++) {
            out[i] = normalized[i] * span + baseline;
        }
        return out;
    }

    /** Отрицательная мощность отсекается в ноль (на месте). */
    public static double[] clampNonNegative(double[] curve) {
        for (int i = 0; i < curve.length; i++) {
            if (curve[i] < 0.0) curve[i] = 0.0;
        }
        return curve;
    }
}
