package loadgen.io;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Поиск каталога шаблонов прибора в базовом каталоге.
 * Варианты: имя как есть, в нижнем регистре, с заменой пробелов на '_'.
 */
public final class PatternDirectoryResolver {

    private final Path baseDir;

    public PatternDirectoryResolver(Path baseDir) {
        this.baseDir = baseDir;
    }

    public Path resolve(String patternDir) throws TemplateNotFoundException {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(patternDir);
        candidates.add(patternDir.toLowerCase(Locale.ROOT));
        candidates.add(patternDir.replace(" ", "_"));

        for (String name : candidates) {
            Path p = baseDir.resolve(name);
            if (Files.isDirectory(p)) {
                return p;
            }
        }
        throw new TemplateNotFoundException("Pattern directory not found: " + baseDir.resolve(patternDir));
    }
}
