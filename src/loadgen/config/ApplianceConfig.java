package loadgen.config;

/**
 * Конфигурация одного прибора в пакетном запуске.
 * Если задано расписание, activationsPerDay не используется.
 */
public final class ApplianceConfig {

    /** Каталог шаблонов относительно базового каталога. */
    private final String patternDir;

    private final double nominalPowerW;
    private final double durationMin;
    private final double baselineW;
    private final int activationsPerDay;
    private final String generationMethod;
    private final int nativeTimestepSec;
    private final int outputTimestepSec;
    private final int refIndex;

    /** null - случайный генератор без фиксированного зерна */
    private final Long seed;

    /** null - равномерное ежедневное размещение */
    private final ScheduleConfig schedule;

    public ApplianceConfig(String patternDir,
                           double nominalPowerW,
                           double durationMin,
                           double baselineW,
                           int activationsPerDay,
                           String generationMethod,
                           int nativeTimestepSec,
                           int outputTimestepSec,
                           int refIndex,
                           Long seed,
                           ScheduleConfig schedule) {
        this.patternDir = patternDir;
        this.nominalPowerW = nominalPowerW;
        this.durationMin = durationMin;
        this.baselineW = baselineW;
        this.activationsPerDay = activationsPerDay;
        this.generationMethod = generationMethod;
        this.nativeTimestepSec = nativeTimestepSec;
        this.outputTimestepSec = outputTimestepSec;
        this.refIndex = refIndex;
        this.seed = seed;
        this.schedule = schedule;
    }

    /**
     * Конфигурация со значениями по умолчанию для прибора с именем name.
     */
    public static ApplianceConfig defaults(String name) {
        return new ApplianceConfig(
                name + "_patterns",
                GenerationConstants.DEFAULT_NOMINAL_POWER_W,
                GenerationConstants.DEFAULT_DURATION_MIN,
                GenerationConstants.DEFAULT_BASELINE_W,
                GenerationConstants.DEFAULT_ACTIVATIONS_PER_DAY,
                GenerationConstants.DEFAULT_GENERATION_METHOD,
                GenerationConstants.DEFAULT_NATIVE_TIMESTEP_SEC,
                GenerationConstants.DEFAULT_OUTPUT_TIMESTEP_SEC,
                0,
                GenerationConstants.DEFAULT_SEED,
                null
        );
    }

    public String getPatternDir() {
        return patternDir;
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

    public int getActivationsPerDay() {
        return activationsPerDay;
    }

    public String getGenerationMethod() {
        return generationMethod;
    }

    public int getNativeTimestepSec() {
        return nativeTimestepSec;
    }

    public int getOutputTimestepSec() {
        return outputTimestepSec;
    }

    public int getRefIndex() {
        return refIndex;
    }

    public Long getSeed() {
        return seed;
    }

    public ScheduleConfig getSchedule() {
        return schedule;
    }

    public boolean hasSchedule() {
        return schedule != null;
    }
}
