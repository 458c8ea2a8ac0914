package loadgen.engine.synthesis;

import loadgen.config.GenerationParameters;
import loadgen.model.TemplatePattern;

import java.util.List;

/**
 * Взвешенное среднее всех шаблонов.
 * Вес шаблона тем больше, чем ближе его пиковая мощность и длительность к целевым:
 * w = 1 / (1 + |Pmax - P| / P) * 1 / (1 + |T - Tцель| / Tцель).
 */
public final class WeightedAverageSynthesizer implements CurveSynthesizer {

    @Override
    public double[] synthesize(List<TemplatePattern> templates, GenerationParameters params) {
        CurveSynthesizer.requireTemplates(templates);

        double[] w = weights(templates, params.getNominalPowerW(), params.getDurationMin());

        double[] avg = null;
        for (int k = 0; k < templates.size(); k++) {
            double[] proc = CurveResampler.prepare(
                    templates.get(k).getPowerSequence(),
                    params.getNominalPowerW(),
                    params.getBaselineW(),
                    params.getDurationMin(),
                    params.getNativeTimestepSec());
            if (avg == null) {
                avg = new double[proc.length];
            }
            for (int i = 0; i < avg.length; i++) {
                avg[i] += proc[i] * w[k];
            }
        }
        return CurveMath.clampNonNegative(avg);
    }

    /**
     * Нормированные веса шаблонов (сумма = 1).
     */
    public static double[] weights(List<TemplatePattern> templates, double nominalW, double durationMin) {
        double[] w = new double[templates.size()];
        double sum = 0.0;
        for (int k = 0; k < w.length; k++) {
            TemplatePattern t = templates.get(k);
            double pw = 1.0 / (1.0 + Math.abs(t.getMaxPower() - nominalW) / nominalW);
            double dw = 1.0 / (1.0 + Math.abs(t.getTotalDurationMin() - durationMin) / durationMin);
            w[k] = pw * dw;
            sum += w[k];
        }
        for (int k = 0; k < w.length; k++) {
            w[k] /= sum;
        }
        return w;
    }
}
