package io.tock.core.schedule;

import java.time.Instant;
import org.immutables.value.Value;

/**
 * A parsed interval-notation schedule such as {@code R5/2014-03-08T20:00:00Z/P1D}.
 */
@Value.Immutable
public interface IntervalSchedule
{
    long REPEAT_FOREVER = -1L;

    /**
     * Number of occurrences after the first one, or {@link #REPEAT_FOREVER}.
     */
    long getRepeatCount();

    Instant getAnchorTime();

    IsoDuration getStep();

    default boolean isRepeatForever()
    {
        return getRepeatCount() == REPEAT_FOREVER;
    }

    static IntervalSchedule of(long repeatCount, Instant anchorTime, IsoDuration step)
    {
        return ImmutableIntervalSchedule.builder()
            .repeatCount(repeatCount)
            .anchorTime(anchorTime)
            .step(step)
            .build();
    }
}
