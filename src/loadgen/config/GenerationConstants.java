// File: loadgen/config/GenerationConstants.java
package loadgen.config;

import java.time.format.DateTimeFormatter;

/**
 * Глобальные константы генерации профилей.
 * Значения по умолчанию для приборов и параметры алгоритмов должны находиться здесь.
 */
public final class GenerationConstants {

    // =========================================================================
    // ===========================    ШАГИ ВРЕМЕНИ  ============================
    // =========================================================================

    /** Шаг записи шаблонов (внутренний шаг синтеза), с */
    public static final int DEFAULT_NATIVE_TIMESTEP_SEC = 7;

    /** Шаг выходного ряда, с */
    public static final int DEFAULT_OUTPUT_TIMESTEP_SEC = 60;

    public static final int SECONDS_PER_MINUTE = 60;
    public static final int HOURS_PER_DAY = 24;
    public static final int DAYS_PER_WEEK = 7;

    // =========================================================================
    // ===========================    ПРИБОР  ==================================
    // =========================================================================

    public static final double DEFAULT_NOMINAL_POWER_W = 2000.0;
    public static final double DEFAULT_DURATION_MIN = 90.0;
    public static final double DEFAULT_BASELINE_W = 0.0;
    public static final int DEFAULT_ACTIVATIONS_PER_DAY = 1;
    public static final int DEFAULT_ACTIVATIONS_PER_WEEK = 7;
    public static final String DEFAULT_GENERATION_METHOD = "scaling";
    public static final long DEFAULT_SEED = 42L;

    // =========================================================================
    // ===========================    ШАБЛОНЫ / DTW  ===========================
    // =========================================================================

    /** Имя файла шаблонов, которое ищется в первую очередь */
    public static final String DEFAULT_PATTERN_FILE = "Appliance3_time_warping_patterns.json";

    /** Суффикс любого файла шаблонов */
    public static final String PATTERN_FILE_SUFFIX = "time_warping_patterns.json";

    /** Корневой ключ массива шаблонов в JSON */
    public static final String PATTERNS_ROOT_KEY = "time_warping_patterns";

    /** Радиус поиска FastDTW */
    public static final int FASTDTW_RADIUS = 1;

    // =========================================================================
    // ===========================    ЭКСПОРТ  =================================
    // =========================================================================

    public static final String TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN);

    private GenerationConstants() {}
}
