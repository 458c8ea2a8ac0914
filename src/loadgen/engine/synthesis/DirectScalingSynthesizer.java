package loadgen.engine.synthesis;

import loadgen.config.GenerationParameters;
import loadgen.model.TemplatePattern;

import java.util.List;

/**
 * Воспроизведение одного записанного цикла, масштабированного под номинал.
 * Индекс вне диапазона - берётся шаблон 0.
 */
public final class DirectScalingSynthesizer implements CurveSynthesizer {

    private final int templateIndex;

    public DirectScalingSynthesizer(int templateIndex) {
        this.templateIndex = templateIndex;
    }

    @Override
    public double[] synthesize(List<TemplatePattern> templates, GenerationParameters params) {
        CurveSynthesizer.requireTemplates(templates);

        TemplatePattern t = (templateIndex >= 0 && templateIndex < templates.size())
                ? templates.get(templateIndex)
                : templates.get(0);
        return CurveResampler.prepare(
                t.getPowerSequence(),
                params.getNominalPowerW(),
                params.getBaselineW(),
                params.getDurationMin(),
                params.getNativeTimestepSec());
    }
}
