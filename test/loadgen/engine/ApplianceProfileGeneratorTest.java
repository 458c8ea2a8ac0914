package loadgen.engine;

import loadgen.config.ApplianceConfig;
import loadgen.config.HourProbabilities;
import loadgen.config.ScheduleConfig;
import loadgen.engine.placement.PlacementResult;
import loadgen.io.TemplateNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Map;

import static loadgen.TemplateFixtures.bell;
import static loadgen.TemplateFixtures.patternJson;
import static loadgen.TemplateFixtures.writePatternFile;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ApplianceProfileGeneratorTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);
    private static final LocalDateTime END = LocalDateTime.of(2024, 1, 7, 23, 59);

    @TempDir
    Path patternsBase;

    private final ApplianceProfileGenerator generator = new ApplianceProfileGenerator();

    @BeforeEach
    public void writeTemplates() throws Exception {
        writePatternFile(patternsBase.resolve("washer_patterns"), "Appliance3_time_warping_patterns.json",
                patternJson(1900, 3600, bell(60, 1900)),
                patternJson(2300, 5400, bell(80, 2300)),
                patternJson(2600, 4200, bell(70, 2600)));
    }

    @Test
    public void testUniformDailyProfile() throws Exception {
        ApplianceConfig cfg = config("weighted", 2, 42L, null);

        PlacementResult r = generator.generate(cfg, START, END, patternsBase);

        assertThat(r.series().size()).isEqualTo(7 * 1440);
        assertThat(r.activationCount()).isEqualTo(14);
        double peak = Arrays.stream(r.series().toArray()).max().getAsDouble();
        assertThat(peak).isBetween(2000 * 0.9, 2000 * 1.1);
        assertThat(Arrays.stream(r.series().toArray()).min().getAsDouble()).isGreaterThanOrEqualTo(0.0);
    }

    @Test
    public void testSameSeedSameProfile() throws Exception {
        for (String method : new String[]{"weighted", "interpolate", "scaling", "dtw"}) {
            PlacementResult a = generator.generate(config(method, 1, 7L, null), START, END, patternsBase);
            PlacementResult b = generator.generate(config(method, 1, 7L, null), START, END, patternsBase);

            assertThat(a.series().toArray()).as(method).containsExactly(b.series().toArray());
        }
    }

    @Test
    public void testScheduleSwitchesToWeeklyPlacement() throws Exception {
        ScheduleConfig schedule = new ScheduleConfig(3,
                HourProbabilities.fromRanges(Map.of("19-22", 1.0)),
                HourProbabilities.fromRanges(Map.of("9-12", 1.0)));

        PlacementResult r = generator.generate(config("scaling", 5, 42L, schedule), START, END, patternsBase);

        assertThat(r.activationCount()).isEqualTo(3);
    }

    @Test
    public void testUnknownMethod() {
        assertThatThrownBy(() -> generator.generate(config("median", 1, 42L, null), START, END, patternsBase))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("median");
    }

    @Test
    public void testMissingPatterns() {
        ApplianceConfig cfg = new ApplianceConfig("oven_patterns", 2000, 60, 0, 1,
                "scaling", 7, 60, 0, 42L, null);

        assertThatThrownBy(() -> generator.generate(cfg, START, END, patternsBase))
                .isInstanceOf(TemplateNotFoundException.class);
    }

    private static ApplianceConfig config(String method, int perDay, Long seed, ScheduleConfig schedule) {
        return new ApplianceConfig("washer_patterns", 2000, 60, 0, perDay,
                method, 7, 60, 0, seed, schedule);
    }
}
