package loadgen.model;

import java.time.LocalDateTime;

/**
 * Точка временного ряда: метка времени и мощность, Вт.
 */
public record SeriesPoint(LocalDateTime timestamp, double powerW) {}
