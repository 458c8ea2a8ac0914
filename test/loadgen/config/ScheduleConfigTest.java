package loadgen.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScheduleConfigTest {

    @Test
    public void testMissingDayTypeIsAllZero() {
        HourProbabilities evenings = HourProbabilities.fromRanges(Map.of("18-21", 1.0));

        ScheduleConfig schedule = new ScheduleConfig(5, evenings, null);

        assertThat(schedule.getWeekday()).isSameAs(evenings);
        assertThat(schedule.getWeekend().toArray()).containsOnly(0.0);
    }

    @Test
    public void testForDayPicksProfile() {
        ScheduleConfig schedule = new ScheduleConfig(7,
                HourProbabilities.fromRanges(Map.of("6-9", 0.4)),
                HourProbabilities.fromRanges(Map.of("10-14", 0.9)));

        assertThat(schedule.forDay(false)).isSameAs(schedule.getWeekday());
        assertThat(schedule.forDay(true)).isSameAs(schedule.getWeekend());
    }

    @Test
    public void testNegativeCount() {
        assertThatThrownBy(() -> new ScheduleConfig(-1, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
