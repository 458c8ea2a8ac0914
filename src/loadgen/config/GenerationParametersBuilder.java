package loadgen.config;

/**
 * Builder для GenerationParameters.
 */
public class GenerationParametersBuilder {

    private double nominalPowerW = GenerationConstants.DEFAULT_NOMINAL_POWER_W;
    private double durationMin = GenerationConstants.DEFAULT_DURATION_MIN;
    private double baselineW = GenerationConstants.DEFAULT_BASELINE_W;
    private int nativeTimestepSec = GenerationConstants.DEFAULT_NATIVE_TIMESTEP_SEC;
    private int outputTimestepSec = GenerationConstants.DEFAULT_OUTPUT_TIMESTEP_SEC;
    private GenerationMethod method = new GenerationMethod.DirectScaling(0);

    public GenerationParametersBuilder() {
    }

    /**
     * Создать builder на основе уже существующих параметров.
     */
    public static GenerationParametersBuilder from(GenerationParameters base) {
        GenerationParametersBuilder b = new GenerationParametersBuilder();
        b.nominalPowerW = base.getNominalPowerW();
        b.durationMin = base.getDurationMin();
        b.baselineW = base.getBaselineW();
        b.nativeTimestepSec = base.getNativeTimestepSec();
        b.outputTimestepSec = base.getOutputTimestepSec();
        b.method = base.getMethod();
        return b;
    }

    /**
     * Параметры синтеза из конфигурации прибора.
     */
    public static GenerationParametersBuilder from(ApplianceConfig cfg) {
        return new GenerationParametersBuilder()
                .setNominalPowerW(cfg.getNominalPowerW())
                .setDurationMin(cfg.getDurationMin())
                .setBaselineW(cfg.getBaselineW())
                .setNativeTimestepSec(cfg.getNativeTimestepSec())
                .setOutputTimestepSec(cfg.getOutputTimestepSec())
                .setMethod(GenerationMethod.parse(cfg.getGenerationMethod(), cfg.getRefIndex()));
    }

    public GenerationParameters build() {
        if (!(nominalPowerW > 0.0)) {
            throw new IllegalArgumentException("nominalPowerW must be > 0, got " + nominalPowerW);
        }
        if (!(durationMin > 0.0)) {
            throw new IllegalArgumentException("durationMin must be > 0, got " + durationMin);
        }
        if (nativeTimestepSec <= 0 || outputTimestepSec <= 0) {
            throw new IllegalArgumentException("timesteps must be > 0");
        }
        if (method == null) {
            throw new IllegalArgumentException("method is not set");
        }
        return new GenerationParameters(
                nominalPowerW,
                durationMin,
                baselineW,
                nativeTimestepSec,
                outputTimestepSec,
                method
        );
    }

    public GenerationParametersBuilder setNominalPowerW(double nominalPowerW) {
        this.nominalPowerW = nominalPowerW;
        return this;
    }

    public GenerationParametersBuilder setDurationMin(double durationMin) {
        this.durationMin = durationMin;
        return this;
    }

    public GenerationParametersBuilder setBaselineW(double baselineW) {
        this.baselineW = baselineW;
        return this;
    }

    public GenerationParametersBuilder setNativeTimestepSec(int nativeTimestepSec) {
        this.nativeTimestepSec = nativeTimestepSec;
        return this;
    }

    public GenerationParametersBuilder setOutputTimestepSec(int outputTimestepSec) {
        this.outputTimestepSec = outputTimestepSec;
        return this;
    }

    public GenerationParametersBuilder setMethod(GenerationMethod method) {
        this.method = method;
        return this;
    }
}
