package loadgen.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import loadgen.config.ApplianceConfig;
import loadgen.config.BatchConfig;
import loadgen.config.GenerationConstants;
import loadgen.config.HourProbabilities;
import loadgen.config.ScheduleConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Чтение пакетной конфигурации (JSON, ключи snake_case).
 * Числа допускаются и строками ("2000"). Отсутствующие поля прибора берутся по умолчанию.
 * Относительные пути считаются от каталога файла конфигурации.
 */
public class ApplianceConfigLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    public BatchConfig load(Path configFile) throws IOException {
        JsonNode root = mapper.readTree(configFile.toFile());
        Path baseDir = configFile.toAbsolutePath().getParent();

        LocalDateTime start = timestamp(root, "start");
        LocalDateTime end = timestamp(root, "end");

        Path patternsDir = baseDir.resolve(root.path("patterns_base_dir").asText("patterns"));
        Path outputDir = baseDir.resolve(root.path("output_dir").asText("output"));

        Map<String, ApplianceConfig> appliances = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("appliances").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            appliances.put(e.getKey(), parseAppliance(e.getKey(), e.getValue()));
        }

        return new BatchConfig(
                start,
                end,
                patternsDir,
                outputDir,
                root.path("csv_header").asBoolean(false),
                root.path("export_excel").asBoolean(false),
                appliances
        );
    }

    public ApplianceConfig parseAppliance(String name, JsonNode node) {
        ApplianceConfig d = ApplianceConfig.defaults(name);

        Long seed = d.getSeed();
        if (node.has("seed")) {
            seed = node.get("seed").isNull() ? null : seed(node.get("seed"));
        }

        JsonNode scheduleNode = node.get("schedule");
        ScheduleConfig schedule = (scheduleNode == null || scheduleNode.isNull())
                ? null
                : parseSchedule(scheduleNode);

        return new ApplianceConfig(
                text(node, "pattern_dir", d.getPatternDir()),
                number(node, "nominal_power", d.getNominalPowerW()),
                number(node, "duration_min", d.getDurationMin()),
                number(node, "baseline", d.getBaselineW()),
                (int) number(node, "activations_per_day", d.getActivationsPerDay()),
                text(node, "generation_method", d.getGenerationMethod()),
                (int) number(node, "timestep_native", d.getNativeTimestepSec()),
                (int) number(node, "output_timestep", d.getOutputTimestepSec()),
                (int) number(node, "ref_index", d.getRefIndex()),
                seed,
                schedule
        );
    }

    /**
     * { activations_per_week, weekday: {hour_probabilities: {"H1-H2": p}}, weekend: {...} }
     */
    public ScheduleConfig parseSchedule(JsonNode node) {
        int perWeek = (int) number(node, "activations_per_week", GenerationConstants.DEFAULT_ACTIVATIONS_PER_WEEK);
        return new ScheduleConfig(
                perWeek,
                HourProbabilities.fromRanges(hourRanges(node.path("weekday"))),
                HourProbabilities.fromRanges(hourRanges(node.path("weekend")))
        );
    }

    private static Map<String, Double> hourRanges(JsonNode dayNode) {
        Map<String, Double> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = dayNode.path("hour_probabilities").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode v = e.getValue();
            if (!v.isNumber()) {
                throw new IllegalArgumentException("Probability for " + e.getKey() + " is not a number: " + v);
            }
            out.put(e.getKey(), v.asDouble());
        }
        return out;
    }

    private static double number(JsonNode node, String field, double def) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return def;
        if (v.isNumber()) return v.asDouble();
        if (v.isTextual()) {
            String s = v.asText().trim();
            if (s.isEmpty()) return def;
            try {
                return Double.parseDouble(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Field '" + field + "' is not numeric: " + s, e);
            }
        }
        throw new IllegalArgumentException("Field '" + field + "' is not numeric: " + v);
    }

    /** Зерно читается как целое без потери разрядов (double хранит только 53 бита). */
    private static long seed(JsonNode v) {
        if (v.isIntegralNumber()) {
            if (!v.canConvertToLong()) {
                throw new IllegalArgumentException("Field 'seed' does not fit into long: " + v);
            }
            return v.asLong();
        }
        if (v.isNumber()) return (long) v.asDouble();
        if (v.isTextual()) {
            String s = v.asText().trim();
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Field 'seed' is not an integer: " + s, e);
            }
        }
        throw new IllegalArgumentException("Field 'seed' is not numeric: " + v);
    }

    private static String text(JsonNode node, String field, String def) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.asText().isBlank()) return def;
        return v.asText();
    }

    private static LocalDateTime timestamp(JsonNode root, String field) {
        String s = root.path(field).asText(null);
        if (s == null) {
            throw new IllegalArgumentException("Missing '" + field + "' in batch config");
        }
        try {
            return LocalDateTime.parse(s.trim(), GenerationConstants.TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Bad '" + field + "' timestamp: " + s, e);
        }
    }
}
