package loadgen.engine.synthesis;

import loadgen.config.GenerationParameters;
import loadgen.model.TemplatePattern;

import java.util.List;

/**
 * Среднее шаблонов после DTW-выравнивания на опорный шаблон.
 * Длина результата и привязка по времени определяются опорным шаблоном.
 */
public final class DtwAverageSynthesizer implements CurveSynthesizer {

    private final int referenceIndex;

    public DtwAverageSynthesizer(int referenceIndex) {
        this.referenceIndex = referenceIndex;
    }

    @Override
    public double[] synthesize(List<TemplatePattern> templates, GenerationParameters params) {
        CurveSynthesizer.requireTemplates(templates);

        if (referenceIndex < 0 || referenceIndex >= templates.size()) {
            throw new IllegalArgumentException("Reference index " + referenceIndex
                    + " is out of range, templates: " + templates.size());
        }

        double[] reference = prepare(templates.get(referenceIndex), params);

        double[] sum = new double[reference.length];
        for (TemplatePattern t : templates) {
            double[] aligned = DtwAligner.align(prepare(t, params), reference);
            for (int i = 0; i < sum.length; i++) {
                sum[i] += aligned[i];
            }
        }
        for (int i = 0; i < sum.length; i++) {
            sum[i] /= templates.size();
        }
        return CurveMath.clampNonNegative(sum);
    }

    private static double[] prepare(TemplatePattern t, GenerationParameters params) {
        return CurveResampler.prepare(
                t.getPowerSequence(),
                params.getNominalPowerW(),
                params.getBaselineW(),
                params.getDurationMin(),
                params.getNativeTimestepSec());
    }
}
