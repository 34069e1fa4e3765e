package io.tock.core.schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses schedules written as {@code R[n]/<start>/<step>}.
 *
 * <ul>
 * <li>{@code R} repeats forever, {@code Rn} repeats n more times after the first run.</li>
 * <li>{@code start} is an ISO-8601 date-time with an offset, e.g. {@code 2014-03-08T20:00:00Z}.</li>
 * <li>{@code step} is an ISO-8601 duration, e.g. {@code PT2H} or {@code P1M}.</li>
 * </ul>
 */
public class IntervalScheduleParser
{
    private static final Logger logger = LoggerFactory.getLogger(IntervalScheduleParser.class);

    private static final Splitter PART_SPLITTER = Splitter.on('/');
    private static final Pattern REPEAT_PATTERN = Pattern.compile("R(\\d*)");
    private static final String EXAMPLE = "R/2014-03-08T20:00:00Z/PT2H";

    /**
     * Parses a schedule without checking whether its start time has passed.
     * Used to restore jobs whose first run already happened.
     */
    public IntervalSchedule parse(String schedule)
        throws ScheduleException
    {
        return parse(schedule, Optional.absent());
    }

    /**
     * Parses a schedule for a new job. The start time must be after {@code now}.
     */
    public IntervalSchedule parseFutureSchedule(String schedule, Instant now)
        throws ScheduleException
    {
        return parse(schedule, Optional.of(now));
    }

    private IntervalSchedule parse(String schedule, Optional<Instant> notAfter)
        throws ScheduleException
    {
        List<String> parts = PART_SPLITTER.splitToList(schedule);
        if (parts.size() != 3) {
            throw new MalformedScheduleException(String.format(
                        "Schedule not formatted correctly: '%s'. Should look like: %s", schedule, EXAMPLE));
        }

        long repeatCount = parseRepeatCount(parts.get(0));
        logger.debug("Repeat count: {}", repeatCount);

        Instant anchorTime = parseStartTime(parts.get(1));
        if (notAfter.isPresent() && !anchorTime.isAfter(notAfter.get())) {
            throw new PastScheduleException(
                    String.format("Schedule start time %s has passed", anchorTime), anchorTime);
        }
        logger.debug("Schedule start time: {}", anchorTime);

        IsoDuration step = IsoDuration.parse(parts.get(2));
        if (step.isZero()) {
            throw new DurationParseException("Schedule step must not be zero: " + parts.get(2));
        }
        checkStepRange(step, anchorTime, parts.get(2));
        logger.debug("Schedule step: {}", step);

        return IntervalSchedule.of(repeatCount, anchorTime, step);
    }

    private static long parseRepeatCount(String repeat)
        throws RepeatCountParseException
    {
        Matcher m = REPEAT_PATTERN.matcher(repeat);
        if (!m.matches()) {
            throw new RepeatCountParseException("Repeat part must be R or R<count>: " + repeat);
        }
        if (m.group(1).isEmpty()) {
            return IntervalSchedule.REPEAT_FOREVER;
        }
        try {
            return Long.parseLong(m.group(1));
        }
        catch (NumberFormatException ex) {
            throw new RepeatCountParseException("Repeat count is out of range: " + repeat, ex);
        }
    }

    // the step is added to the current time on every occurrence
    private static void checkStepRange(IsoDuration step, Instant from, String text)
        throws DurationParseException
    {
        try {
            step.waitFrom(from).toMillis();
        }
        catch (DateTimeException | ArithmeticException ex) {
            throw new DurationParseException("Schedule step is out of range: " + text, ex);
        }
    }

    private static Instant parseStartTime(String start)
        throws TimestampParseException
    {
        try {
            return OffsetDateTime.parse(start, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        }
        catch (DateTimeParseException ex) {
            throw new TimestampParseException("Invalid schedule start time: " + start, ex);
        }
    }
}
