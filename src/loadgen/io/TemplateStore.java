package loadgen.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import loadgen.config.GenerationConstants;
import loadgen.model.TemplatePattern;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка шаблонов циклов прибора из каталога.
 * <p>
 * Файл: JSON-объект с массивом "time_warping_patterns", элемент -
 * { power_sequence, statistical_features.max_power, total_duration_seconds, pattern_id }.
 * Отсутствующая пиковая мощность считается по последовательности,
 * отсутствующая длительность - как (число отсчётов) * (внутренний шаг).
 */
public class TemplateStore {

    private final ObjectMapper mapper;
    private final int nativeTimestepSec;

    public TemplateStore() {
        this(GenerationConstants.DEFAULT_NATIVE_TIMESTEP_SEC);
    }

    public TemplateStore(int nativeTimestepSec) {
        this.mapper = new ObjectMapper();
        this.nativeTimestepSec = nativeTimestepSec;
    }

    public List<TemplatePattern> load(Path directory) throws IOException {
        return load(directory, null);
    }

    /**
     * @param directory каталог шаблонов прибора
     * @param fileName  явное имя файла или null (поиск по умолчанию)
     * @throws TemplateNotFoundException нет каталога или файла шаблонов
     */
    public List<TemplatePattern> load(Path directory, String fileName) throws IOException {
        Path file = locate(directory, fileName);

        JsonNode root = mapper.readTree(file.toFile());
        JsonNode items = root.path(GenerationConstants.PATTERNS_ROOT_KEY);
        if (!items.isArray()) {
            throw new IOException("No '" + GenerationConstants.PATTERNS_ROOT_KEY + "' array in " + file);
        }

        List<TemplatePattern> out = new ArrayList<>(items.size());
        int k = 0;
        for (JsonNode item : items) {
            out.add(parsePattern(item, k++, file));
        }
        if (out.isEmpty()) {
            throw new IllegalArgumentException("Pattern file " + file + " holds no templates");
        }
        return out;
    }

    /**
     * Файл шаблонов: явно заданный, затем имя по умолчанию, затем первый по имени *time_warping_patterns.json.
     */
    Path locate(Path directory, String fileName) throws IOException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new TemplateNotFoundException("Pattern directory not found: " + directory);
        }
        if (fileName != null) {
            Path explicit = directory.resolve(fileName);
            if (!Files.isRegularFile(explicit)) {
                throw new TemplateNotFoundException("Pattern file not found: " + explicit);
            }
            return explicit;
        }

        Path preferred = directory.resolve(GenerationConstants.DEFAULT_PATTERN_FILE);
        if (Files.isRegularFile(preferred)) {
            return preferred;
        }

        Path found = null;
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(directory)) {
            for (Path p : ds) {
                String name = p.getFileName().toString();
                if (!Files.isRegularFile(p) || !name.endsWith(GenerationConstants.PATTERN_FILE_SUFFIX)) continue;
                if (found == null || name.compareTo(found.getFileName().toString()) < 0) {
                    found = p;
                }
            }
        }
        if (found == null) {
            throw new TemplateNotFoundException("No pattern files found in " + directory);
        }
        return found;
    }

    private TemplatePattern parsePattern(JsonNode item, int index, Path file) {
        JsonNode seqNode = item.path("power_sequence");
        if (!seqNode.isArray() || seqNode.size() == 0) {
            throw new IllegalArgumentException("Template #" + index + " in " + file + " has no power_sequence");
        }
        double[] seq = new double[seqNode.size()];
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < seq.length; i++) {
            seq[i] = seqNode.get(i).asDouble();
            max = Math.max(max, seq[i]);
        }

        JsonNode maxNode = item.path("statistical_features").path("max_power");
        double maxPower = maxNode.isNumber() ? maxNode.asDouble() : max;

        JsonNode durNode = item.path("total_duration_seconds");
        double duration = durNode.isNumber() ? durNode.asDouble() : (double) seq.length * nativeTimestepSec;

        String id = item.hasNonNull("pattern_id") ? item.get("pattern_id").asText() : "pattern_" + index;
        return new TemplatePattern(id, seq, maxPower, duration);
    }
}
