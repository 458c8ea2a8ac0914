package loadgen.config;

/**
 * Недельное вероятностное расписание прибора.
 */
public final class ScheduleConfig {

    /** Целевое количество включений за полную неделю. */
    private final int activationsPerWeek;

    /** Вероятности по часам для будних дней (пн-пт). */
    private final HourProbabilities weekday;

    /** Вероятности по часам для выходных (сб-вс). */
    private final HourProbabilities weekend;

    public ScheduleConfig(int activationsPerWeek,
                          HourProbabilities weekday,
                          HourProbabilities weekend) {
        if (activationsPerWeek < 0) {
            throw new IllegalArgumentException("activationsPerWeek must be >= 0");
        }
        this.activationsPerWeek = activationsPerWeek;
        this.weekday = weekday != null ? weekday : HourProbabilities.none();
        this.weekend = weekend != null ? weekend : HourProbabilities.none();
    }

    public int getActivationsPerWeek() {
        return activationsPerWeek;
    }

    public HourProbabilities getWeekday() {
        return weekday;
    }

    public HourProbabilities getWeekend() {
        return weekend;
    }

    public HourProbabilities forDay(boolean weekendDay) {
        return weekendDay ? weekend : weekday;
    }
}
