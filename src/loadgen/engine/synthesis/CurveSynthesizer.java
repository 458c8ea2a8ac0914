package loadgen.engine.synthesis;

import loadgen.config.GenerationParameters;
import loadgen.model.TemplatePattern;

import java.util.List;

/**
 * Способ построения одной активации из шаблонов.
 * Результат - кривая на внутреннем шаге длиной params.nativeSteps().
 */
public interface CurveSynthesizer {

    /**
     * @throws IllegalArgumentException пустой список шаблонов
     */
    double[] synthesize(List<TemplatePattern> templates, GenerationParameters params);

    static void requireTemplates(List<TemplatePattern> templates) {
        if (templates == null || templates.isEmpty()) {
            throw new IllegalArgumentException("No templates to synthesize from");
        }
    }
}
