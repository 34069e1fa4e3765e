package io.tock.core.schedule;

import java.time.Duration;
import java.time.Instant;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class IntervalScheduleParserTest
{
    private static final Instant NOW = Instant.parse("2020-06-01T00:00:00Z");

    private final IntervalScheduleParser parser = new IntervalScheduleParser();

    @Test
    public void parseRepeatForever()
            throws Exception
    {
        IntervalSchedule s = parser.parse("R/2014-03-08T20:00:00Z/PT2H");
        assertThat(s.getRepeatCount(), is(IntervalSchedule.REPEAT_FOREVER));
        assertThat(s.isRepeatForever(), is(true));
        assertThat(s.getAnchorTime(), is(Instant.parse("2014-03-08T20:00:00Z")));
        assertThat(s.getStep().getTime(), is(Duration.ofHours(2)));
    }

    @Test
    public void parseFutureSchedule()
            throws Exception
    {
        IntervalSchedule s = parser.parseFutureSchedule("R2/2030-01-01T00:00:00+09:00/PT10M", NOW);
        assertThat(s.getRepeatCount(), is(2L));
        assertThat(s.isRepeatForever(), is(false));
        assertThat(s.getAnchorTime(), is(Instant.parse("2029-12-31T15:00:00Z")));
        assertThat(s.getStep().getTime(), is(Duration.ofMinutes(10)));
    }

    @Test
    public void parseZeroRepeats()
            throws Exception
    {
        assertThat(parser.parse("R0/2030-01-01T00:00:00Z/P1D").getRepeatCount(), is(0L));
    }

    @Test
    public void rejectWrongNumberOfParts()
    {
        assertRejected("R/2030-01-01T00:00:00Z", MalformedScheduleException.class);
        assertRejected("R/2030-01-01T00:00:00Z/PT1H/x", MalformedScheduleException.class);
        assertRejected("", MalformedScheduleException.class);
    }

    @Test
    public void rejectPastStartTime()
    {
        try {
            parser.parseFutureSchedule("R/2014-03-08T20:00:00Z/PT2H", NOW);
            fail();
        }
        catch (PastScheduleException ex) {
            assertThat(ex.getStartTime(), is(Instant.parse("2014-03-08T20:00:00Z")));
        }
        catch (ScheduleException ex) {
            fail("Unexpected " + ex);
        }
    }

    @Test
    public void rejectStartTimeEqualToNow()
    {
        assertRejected("R/2020-06-01T00:00:00Z/PT2H", PastScheduleException.class);
    }

    @Test
    public void rejectBadRepeat()
    {
        assertRejected("X/2030-01-01T00:00:00Z/PT1H", RepeatCountParseException.class);
        assertRejected("R-1/2030-01-01T00:00:00Z/PT1H", RepeatCountParseException.class);
        assertRejected("Rx/2030-01-01T00:00:00Z/PT1H", RepeatCountParseException.class);
        assertRejected("R99999999999999999999/2030-01-01T00:00:00Z/PT1H", RepeatCountParseException.class);
    }

    @Test
    public void rejectBadTimestamp()
    {
        assertRejected("R/2030-13-01T00:00:00Z/PT1H", TimestampParseException.class);
        assertRejected("R/2030-01-01T00:00:00/PT1H", TimestampParseException.class);
        assertRejected("R/tomorrow/PT1H", TimestampParseException.class);
    }

    @Test
    public void rejectBadStep()
    {
        assertRejected("R/2030-01-01T00:00:00Z/2H", DurationParseException.class);
        assertRejected("R/2030-01-01T00:00:00Z/PT", DurationParseException.class);
    }

    @Test
    public void rejectStepOutOfRange()
    {
        assertRejected("R1/2030-01-01T00:00:00Z/P999999999Y", DurationParseException.class);
        assertRejected("R/2030-01-01T00:00:00Z/PT9999999999999999H", DurationParseException.class);
    }

    @Test
    public void rejectZeroStep()
    {
        try {
            parser.parseFutureSchedule("R/2030-01-01T00:00:00Z/PT0S", NOW);
            fail();
        }
        catch (ScheduleException ex) {
            assertThat(ex, instanceOf(DurationParseException.class));
            assertThat(ex.getMessage(), containsString("zero"));
        }
    }

    private void assertRejected(String schedule, Class<? extends ScheduleException> expected)
    {
        try {
            parser.parseFutureSchedule(schedule, NOW);
            fail("Expected " + expected.getSimpleName() + " for " + schedule);
        }
        catch (ScheduleException ex) {
            assertThat(ex, instanceOf(expected));
        }
    }
}
