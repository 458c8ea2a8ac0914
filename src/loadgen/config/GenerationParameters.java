package loadgen.config;

/**
 * Параметры синтеза одной активации прибора.
 * Immutable; для изменения используется {@link GenerationParametersBuilder}.
 */
public final class GenerationParameters {

    /** Номинальная (пиковая) мощность, Вт */
    private final double nominalPowerW;

    /** Длительность одного цикла, мин */
    private final double durationMin;

    /** Нижний уровень мощности, Вт */
    private final double baselineW;

    /** Внутренний шаг синтеза, с */
    private final int nativeTimestepSec;

    /** Шаг выходной кривой, с */
    private final int outputTimestepSec;

    private final GenerationMethod method;

    public GenerationParameters(double nominalPowerW,
                                double durationMin,
                                double baselineW,
                                int nativeTimestepSec,
                                int outputTimestepSec,
                                GenerationMethod method) {
        this.nominalPowerW = nominalPowerW;
        this.durationMin = durationMin;
        this.baselineW = baselineW;
        this.nativeTimestepSec = nativeTimestepSec;
        this.outputTimestepSec = outputTimestepSec;
        this.method = method;
    }

    public double getNominalPowerW() {
        return nominalPowerW;
    }

    public double getDurationMin() {
        return durationMin;
    }

    public double getBaselineW() {
        return baselineW;
    }

    public int getNativeTimestepSec() {
        return nativeTimestepSec;
    }

    public int getOutputTimestepSec() {
        return outputTimestepSec;
    }

    public GenerationMethod getMethod() {
        return method;
    }

    /** Количество точек цикла на внутреннем шаге. */
    public int nativeSteps() {
        return (int) (durationMin * GenerationConstants.SECONDS_PER_MINUTE / nativeTimestepSec);
    }

    /** Количество точек цикла на выходном шаге. */
    public int outputSteps() {
        return (int) (durationMin * GenerationConstants.SECONDS_PER_MINUTE / outputTimestepSec);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT,
                "method=%s; P=%.1f W; T=%.1f min; base=%.1f W; dt=%d/%d s",
                method, nominalPowerW, durationMin, baselineW, nativeTimestepSec, outputTimestepSec);
    }
}
