package io.tock.core.schedule;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.time.ZoneOffset.UTC;

/**
 * An ISO-8601 duration such as {@code P1M}, {@code PT2H} or {@code P1DT12H}.
 *
 * The calendar part (years, months, weeks, days) is kept apart from the
 * time part because its length depends on the instant it is added to.
 * Calendar arithmetic is done in UTC.
 */
public final class IsoDuration
{
    private static final Pattern PATTERN = Pattern.compile(
            "P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)W)?(?:(\\d+)D)?" +
            "(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+(?:[.,]\\d+)?)S)?)?");

    private final String text;
    private final Period period;
    private final Duration time;

    private IsoDuration(String text, Period period, Duration time)
    {
        this.text = text;
        this.period = period;
        this.time = time;
    }

    public static IsoDuration parse(String text)
        throws DurationParseException
    {
        Matcher m = PATTERN.matcher(text);
        if (!m.matches() || text.endsWith("T") || !anyGroup(m)) {
            throw new DurationParseException("Invalid ISO-8601 duration: " + text);
        }
        try {
            Period period = Period.of(
                    intGroup(m, 1),
                    intGroup(m, 2),
                    Math.addExact(Math.multiplyExact(intGroup(m, 3), 7), intGroup(m, 4)));
            Duration time = Duration.ofHours(longGroup(m, 5))
                .plusMinutes(longGroup(m, 6))
                .plus(seconds(m.group(7)));
            return new IsoDuration(text, period, time);
        }
        catch (ArithmeticException | NumberFormatException ex) {
            throw new DurationParseException("ISO-8601 duration is out of range: " + text, ex);
        }
    }

    public static IsoDuration of(Period period, Duration time)
    {
        return new IsoDuration(format(period, time), period, time);
    }

    public Period getPeriod()
    {
        return period;
    }

    public Duration getTime()
    {
        return time;
    }

    public boolean isZero()
    {
        return period.isZero() && time.isZero();
    }

    public Instant addTo(Instant from)
    {
        return from.atZone(UTC).plus(period).plus(time).toInstant();
    }

    /**
     * Length of this duration when it starts at {@code now}.
     */
    public Duration waitFrom(Instant now)
    {
        return Duration.between(now, addTo(now));
    }

    private static boolean anyGroup(Matcher m)
    {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) {
                return true;
            }
        }
        return false;
    }

    private static int intGroup(Matcher m, int group)
    {
        String value = m.group(group);
        return value == null ? 0 : Integer.parseInt(value);
    }

    private static long longGroup(Matcher m, int group)
    {
        String value = m.group(group);
        return value == null ? 0L : Long.parseLong(value);
    }

    private static Duration seconds(String value)
    {
        if (value == null) {
            return Duration.ZERO;
        }
        BigDecimal seconds = new BigDecimal(value.replace(',', '.'));
        return Duration.ofSeconds(
                seconds.setScale(0, RoundingMode.DOWN).longValueExact(),
                seconds.remainder(BigDecimal.ONE).movePointRight(9).intValue());
    }

    private static String format(Period period, Duration time)
    {
        StringBuilder sb = new StringBuilder("P");
        if (period.getYears() != 0) {
            sb.append(period.getYears()).append('Y');
        }
        if (period.getMonths() != 0) {
            sb.append(period.getMonths()).append('M');
        }
        if (period.getDays() != 0) {
            sb.append(period.getDays()).append('D');
        }
        if (!time.isZero() || sb.length() == 1) {
            sb.append(time.toString().substring(1));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        IsoDuration that = (IsoDuration) o;
        return period.equals(that.period) && time.equals(that.time);
    }

    @Override
    public int hashCode()
    {
        return 31 * period.hashCode() + time.hashCode();
    }

    @Override
    public String toString()
    {
        return text;
    }
}
