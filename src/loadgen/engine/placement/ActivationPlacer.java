package loadgen.engine.placement;

import loadgen.model.ActivationCurve;
import loadgen.model.TimeSeries;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Размещение активаций прибора на календарной сетке.
 * Ряд изменяется на месте (поточечный максимум), генератор случайных чисел - свой на вызов.
 */
public interface ActivationPlacer {

    PlacementResult place(ActivationCurve curve, TimeSeries series, RandomGenerator rng);

    /**
     * Генератор для одного вызова; seed == null - без фиксированного зерна.
     */
    static RandomGenerator randomFor(Long seed) {
        return (seed == null) ? new Well19937c() : new Well19937c(seed);
    }
}
