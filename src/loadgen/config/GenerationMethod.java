package loadgen.config;

import java.util.Locale;

/**
 * Способ синтеза одной активации из набора шаблонов.
 * Закрытый набор вариантов; у каждого варианта свои параметры.
 */
public sealed interface GenerationMethod
        permits GenerationMethod.WeightedAverage,
                GenerationMethod.NearestTwoInterpolation,
                GenerationMethod.DirectScaling,
                GenerationMethod.DtwAverage {

    /** Внешний идентификатор способа (как в конфигурации прибора). */
    String id();

    /** Взвешенное среднее всех шаблонов. */
    record WeightedAverage() implements GenerationMethod {
        @Override
        public String id() { return "weighted"; }
    }

    /** Линейное смешивание двух ближайших по мощности шаблонов. */
    record NearestTwoInterpolation() implements GenerationMethod {
        @Override
        public String id() { return "interpolate"; }
    }

    /** Масштабирование одного шаблона, выбранного по индексу. */
    record DirectScaling(int templateIndex) implements GenerationMethod {
        @Override
        public String id() { return "scaling"; }
    }

    /** Усреднение шаблонов после выравнивания DTW на опорный шаблон. */
    record DtwAverage(int referenceIndex) implements GenerationMethod {
        @Override
        public String id() { return "dtw"; }
    }

    /**
     * Разбор внешнего идентификатора.
     *
     * @param id    weighted / interpolate / scaling / dtw
     * @param index индекс шаблона для scaling и dtw
     * @throws IllegalArgumentException неизвестный идентификатор
     */
    static GenerationMethod parse(String id, int index) {
        if (id == null) {
            throw new IllegalArgumentException("Generation method is not set");
        }
        switch (id.trim().toLowerCase(Locale.ROOT)) {
            case "weighted":
                return new WeightedAverage();
            case "interpolate":
                return new NearestTwoInterpolation();
            case "scaling":
                return new DirectScaling(index);
            case "dtw":
                return new DtwAverage(index);
            default:
                throw new IllegalArgumentException("Unknown method " + id);
        }
    }
}
