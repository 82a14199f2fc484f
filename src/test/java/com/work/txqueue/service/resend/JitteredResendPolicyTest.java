package com.work.txqueue.service.resend;

import com.work.txqueue.config.TxQueueProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class JitteredResendPolicyTest {

    private static final List<Duration> SCHEDULE =
            Arrays.asList(Duration.ofSeconds(45), Duration.ofSeconds(90), Duration.ofSeconds(180));

    @Test
    public void attempt_selects_schedule_entry_and_caps_at_last() {
        JitteredResendPolicy p = new JitteredResendPolicy(SCHEDULE, 0.0,
                Duration.ofSeconds(10), Duration.ofMinutes(10), new Random(1));

        assertEquals(45_000L, p.delayMs(0));
        assertEquals(45_000L, p.delayMs(1));
        assertEquals(90_000L, p.delayMs(2));
        assertEquals(180_000L, p.delayMs(3));
        assertEquals(180_000L, p.delayMs(7));
        assertEquals(45_000L, p.delayMs(-1));
    }

    @Test
    public void jitter_stays_within_ratio_of_base() {
        JitteredResendPolicy p = new JitteredResendPolicy(SCHEDULE, 0.25,
                Duration.ofSeconds(10), Duration.ofMinutes(10), new Random(42));

        for (int i = 0; i < 500; i++) {
            long d1 = p.delayMs(1);
            assertTrue(d1 >= 33_750L && d1 <= 56_250L, "attempt1 delay=" + d1);
            long d3 = p.delayMs(3);
            assertTrue(d3 >= 135_000L && d3 <= 225_000L, "attempt3 delay=" + d3);
        }
    }

    @Test
    public void delay_is_clamped_to_min_and_max() {
        JitteredResendPolicy tiny = new JitteredResendPolicy(Collections.singletonList(Duration.ofSeconds(1)), 0.25,
                Duration.ofSeconds(10), Duration.ofMinutes(10), new Random(7));
        JitteredResendPolicy huge = new JitteredResendPolicy(Collections.singletonList(Duration.ofHours(2)), 0.25,
                Duration.ofSeconds(10), Duration.ofMinutes(10), new Random(7));

        for (int i = 0; i < 100; i++) {
            assertEquals(10_000L, tiny.delayMs(1));
            assertEquals(600_000L, huge.delayMs(1));
        }
    }

    @Test
    public void next_resend_at_is_base_time_plus_delay() {
        JitteredResendPolicy p = new JitteredResendPolicy(SCHEDULE, 0.0,
                Duration.ofSeconds(10), Duration.ofMinutes(10), new Random(1));
        Instant base = Instant.parse("2024-01-01T00:00:00Z");

        assertEquals(base.plusSeconds(90), p.nextResendAt(2, base));
    }

    @Test
    public void from_properties_uses_configured_defaults() {
        JitteredResendPolicy p = JitteredResendPolicy.fromProperties(new TxQueueProperties(), new Random(3));

        for (int i = 0; i < 100; i++) {
            long d = p.delayMs(2);
            assertTrue(d >= 67_500L && d <= 112_500L, "delay=" + d);
        }
    }

    @Test
    public void invalid_configuration_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new JitteredResendPolicy(Collections.<Duration>emptyList(), 0.1,
                Duration.ofSeconds(10), Duration.ofMinutes(10), new Random()));
        assertThrows(IllegalArgumentException.class, () -> new JitteredResendPolicy(SCHEDULE, 1.5,
                Duration.ofSeconds(10), Duration.ofMinutes(10), new Random()));
        assertThrows(IllegalArgumentException.class, () -> new JitteredResendPolicy(SCHEDULE, 0.1,
                Duration.ofMinutes(20), Duration.ofMinutes(10), new Random()));
    }
}
