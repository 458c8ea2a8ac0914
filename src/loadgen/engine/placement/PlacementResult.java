package loadgen.engine.placement;

import loadgen.model.TimeSeries;

import java.util.List;

/**
 * Итог размещения: заполненный ряд и индексы начала активаций (по возрастанию).
 */
public record PlacementResult(TimeSeries series, List<Integer> activationStarts) {

    public PlacementResult {
        activationStarts = List.copyOf(activationStarts);
    }

    public int activationCount() {
        return activationStarts.size();
    }
}
