package loadgen.engine;

import loadgen.config.ApplianceConfig;
import loadgen.config.GenerationParameters;
import loadgen.config.GenerationParametersBuilder;
import loadgen.config.ScheduleConfig;
import loadgen.engine.placement.ActivationPlacer;
import loadgen.engine.placement.PlacementResult;
import loadgen.engine.placement.UniformDailyPlacer;
import loadgen.engine.placement.WeeklySchedulePlacer;
import loadgen.engine.synthesis.ActivationSynthesizer;
import loadgen.io.PatternDirectoryResolver;
import loadgen.io.TemplateStore;
import loadgen.model.ActivationCurve;
import loadgen.model.TemplatePattern;
import loadgen.model.TimeSeries;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Единый вход генерации профиля одного прибора:
 * шаблоны -> одна активация -> размещение на календаре.
 * <p>
 * ВАЖНО:
 * - каждый вызов владеет своими шаблонами, буферами и генератором случайных чисел;
 * - общего изменяемого состояния между вызовами нет.
 */
public class ApplianceProfileGenerator {

    private final ActivationSynthesizer synthesizer;

    public ApplianceProfileGenerator() {
        this(new ActivationSynthesizer());
    }

    public ApplianceProfileGenerator(ActivationSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    public List<TemplatePattern> loadTemplates(Path directory, int nativeTimestepSec) throws IOException {
        return new TemplateStore(nativeTimestepSec).load(directory);
    }

    public ActivationCurve synthesizeActivation(List<TemplatePattern> templates, GenerationParameters params) {
        return synthesizer.synthesize(templates, params);
    }

    public PlacementResult placeUniformRandom(ActivationCurve curve,
                                              LocalDateTime start,
                                              LocalDateTime end,
                                              int activationsPerDay,
                                              int outputTimestepSec,
                                              Long seed) {
        TimeSeries series = new TimeSeries(start, end, outputTimestepSec);
        return new UniformDailyPlacer(activationsPerDay)
                .place(curve, series, ActivationPlacer.randomFor(seed));
    }

    public PlacementResult placeProbabilisticWeekly(ActivationCurve curve,
                                                    LocalDateTime start,
                                                    LocalDateTime end,
                                                    ScheduleConfig schedule,
                                                    int outputTimestepSec,
                                                    Long seed) {
        TimeSeries series = new TimeSeries(start, end, outputTimestepSec);
        return new WeeklySchedulePlacer(schedule)
                .place(curve, series, ActivationPlacer.randomFor(seed));
    }

    /**
     * Полный цикл для прибора из пакетной конфигурации.
     * С расписанием - недельное размещение, без него - ежедневное равномерное.
     *
     * @throws loadgen.io.TemplateNotFoundException нет каталога или файла шаблонов
     * @throws IllegalArgumentException             неверные параметры прибора
     */
    public PlacementResult generate(ApplianceConfig cfg,
                                    LocalDateTime start,
                                    LocalDateTime end,
                                    Path patternsBaseDir) throws IOException {

        GenerationParameters params = GenerationParametersBuilder.from(cfg).build();

        Path dir = new PatternDirectoryResolver(patternsBaseDir).resolve(cfg.getPatternDir());
        List<TemplatePattern> templates = loadTemplates(dir, params.getNativeTimestepSec());

        ActivationCurve curve = synthesizeActivation(templates, params);

        if (cfg.hasSchedule()) {
            return placeProbabilisticWeekly(curve, start, end, cfg.getSchedule(),
                    params.getOutputTimestepSec(), cfg.getSeed());
        }
        return placeUniformRandom(curve, start, end, cfg.getActivationsPerDay(),
                params.getOutputTimestepSec(), cfg.getSeed());
    }
}
