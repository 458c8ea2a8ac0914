package loadgen.engine.synthesis;

import loadgen.config.GenerationMethod;
import loadgen.config.GenerationParameters;
import loadgen.model.ActivationCurve;
import loadgen.model.TemplatePattern;

import java.util.List;

/**
 * Синтез одной активации: выбранный способ на внутреннем шаге,
 * затем перевод на выходной шаг.
 */
public final class ActivationSynthesizer {

    /**
     * Отрицательные отсчёты (недолёт сплайна у резких фронтов, отрицательная база) обнуляются.
     *
     * @throws IllegalArgumentException пустой список шаблонов или неверный индекс опорного шаблона
     */
    public ActivationCurve synthesize(List<TemplatePattern> templates, GenerationParameters params) {
        CurveSynthesizer.requireTemplates(templates);

        double[] nativeCurve = synthesizerFor(params.getMethod()).synthesize(templates, params);

        double[] output = CurveResampler.toOutputGrid(
                nativeCurve,
                params.getDurationMin(),
                params.getNativeTimestepSec(),
                params.getOutputTimestepSec());

        return new ActivationCurve(CurveMath.clampNonNegative(output), params.getOutputTimestepSec());
    }

    public static CurveSynthesizer synthesizerFor(GenerationMethod method) {
        if (method instanceof GenerationMethod.WeightedAverage) {
            return new WeightedAverageSynthesizer();
        }
        if (method instanceof GenerationMethod.NearestTwoInterpolation) {
            return new NearestTwoSynthesizer();
        }
        if (method instanceof GenerationMethod.DirectScaling s) {
            return new DirectScalingSynthesizer(s.templateIndex());
        }
        if (method instanceof GenerationMethod.DtwAverage d) {
            return new DtwAverageSynthesizer(d.referenceIndex());
        }
        throw new IllegalArgumentException("Unsupported method " + method);
    }
}
