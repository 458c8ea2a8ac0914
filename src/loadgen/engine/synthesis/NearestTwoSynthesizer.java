package loadgen.engine.synthesis;

import loadgen.config.GenerationParameters;
import loadgen.model.TemplatePattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Линейное смешивание двух шаблонов, ближайших к номиналу по пиковой мощности.
 * alpha = (P - p1) / (p2 - p1), ограничено [0;1]; при p1 == p2 alpha = 0.5.
 */
public final class NearestTwoSynthesizer implements CurveSynthesizer {

    @Override
    public double[] synthesize(List<TemplatePattern> templates, GenerationParameters params) {
        CurveSynthesizer.requireTemplates(templates);

        double nominal = params.getNominalPowerW();

        List<TemplatePattern> ranked = new ArrayList<>(templates);
        // сортировка устойчивая: при равной удалённости сохраняется исходный порядок
        ranked.sort(Comparator.comparingDouble(t -> Math.abs(t.getMaxPower() - nominal)));

        TemplatePattern t1 = ranked.get(0);
        double[] s1 = prepare(t1, params);
        if (ranked.size() == 1) {
            return s1;
        }

        TemplatePattern t2 = ranked.get(1);
        double[] s2 = prepare(t2, params);

        double alpha = mixingFactor(nominal, t1.getMaxPower(), t2.getMaxPower());
        double[] out = new double[s1.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = (1.0 - alpha) * s1[i] + alpha * s2[i];
        }
        return out;
    }

    public static double mixingFactor(double nominal, double p1, double p2) {
        double alpha = (p1 == p2) ? 0.5 : (nominal - p1) / (p2 - p1);
        return Math.max(0.0, Math.min(1.0, alpha));
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
