package loadgen.config;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Пакетный запуск: общее календарное окно и набор приборов.
 */
public final class BatchConfig {

    private final LocalDateTime start;
    private final LocalDateTime end;
    private final Path patternsBaseDir;
    private final Path outputDir;

    /** Писать ли строку заголовка в CSV (false - формат плеера GridLAB-D). */
    private final boolean csvHeader;

    /** Дополнительно выгружать ряд в xlsx. */
    private final boolean exportExcel;

    private final Map<String, ApplianceConfig> appliances;

    public BatchConfig(LocalDateTime start,
                       LocalDateTime end,
                       Path patternsBaseDir,
                       Path outputDir,
                       boolean csvHeader,
                       boolean exportExcel,
                       Map<String, ApplianceConfig> appliances) {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid window: " + start + " .. " + end);
        }
        this.start = start;
        this.end = end;
        this.patternsBaseDir = patternsBaseDir;
        this.outputDir = outputDir;
        this.csvHeader = csvHeader;
        this.exportExcel = exportExcel;
        this.appliances = new LinkedHashMap<>(appliances);
    }

    public LocalDateTime getStart() {
        return start;
    }

    public LocalDateTime getEnd() {
        return end;
    }

    public Path getPatternsBaseDir() {
        return patternsBaseDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public boolean isCsvHeader() {
        return csvHeader;
    }

    public boolean isExportExcel() {
        return exportExcel;
    }

    public Map<String, ApplianceConfig> getAppliances() {
        return Collections.unmodifiableMap(appliances);
    }
}
