package com.telcobright.chunkschema.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.google.common.base.Strings;

import java.io.IOException;
import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compact textual form of table rotation periods.
 *
 * <p>A period is written as its years, weeks, days, hours, minutes, seconds and millis
 * from largest to smallest with zero units left out, e.g. {@code 1w}, {@code 6h},
 * {@code 1d12h}, {@code 1w1d}. Zero is written {@code 0s}.
 *
 * <p>Parsing accepts any ordered combination of {@code y w d h m s ms} units
 * ({@code y} is 365 days) as well as a bare {@code 0}.
 */
public final class PeriodCodec {

    private static final long MILLIS_PER_SECOND = 1_000L;
    private static final long MILLIS_PER_MINUTE = 60 * MILLIS_PER_SECOND;
    private static final long MILLIS_PER_HOUR = 60 * MILLIS_PER_MINUTE;
    private static final long MILLIS_PER_DAY = 24 * MILLIS_PER_HOUR;
    private static final long MILLIS_PER_WEEK = 7 * MILLIS_PER_DAY;
    private static final long MILLIS_PER_YEAR = 365 * MILLIS_PER_DAY;

    private static final Pattern PERIOD_PATTERN = Pattern.compile(
        "^(?:(\\d+)y)?(?:(\\d+)w)?(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?(?:(\\d+)ms)?$");

    // Unit sizes in the order of the capture groups above.
    private static final long[] GROUP_UNITS = {
        MILLIS_PER_YEAR, MILLIS_PER_WEEK, MILLIS_PER_DAY,
        MILLIS_PER_HOUR, MILLIS_PER_MINUTE, MILLIS_PER_SECOND, 1L
    };
    private static final String[] UNIT_SUFFIXES = {"y", "w", "d", "h", "m", "s", "ms"};

    private PeriodCodec() {
    }

    /**
     * Render a period in its canonical compact form.
     *
     * @throws IllegalArgumentException for negative or sub-millisecond durations
     */
    public static String format(Duration period) {
        if (period == null) {
            throw new IllegalArgumentException("Period cannot be null");
        }
        if (period.isNegative()) {
            throw new IllegalArgumentException("Period cannot be negative: " + period);
        }
        if (period.getNano() % 1_000_000 != 0) {
            throw new IllegalArgumentException("Period must have millisecond precision: " + period);
        }

        long millis = period.toMillis();
        if (millis == 0) {
            return "0s";
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < GROUP_UNITS.length; i++) {
            millis = appendUnit(sb, millis, GROUP_UNITS[i], UNIT_SUFFIXES[i]);
        }
        return sb.toString();
    }

    /**
     * Parse the compact form back into a duration.
     *
     * @throws IllegalArgumentException if the text is not a valid period
     */
    public static Duration parse(String text) {
        if (Strings.isNullOrEmpty(text)) {
            throw new IllegalArgumentException("Period cannot be empty");
        }
        String value = text.trim();
        if ("0".equals(value)) {
            return Duration.ZERO;
        }

        Matcher matcher = PERIOD_PATTERN.matcher(value);
        if (value.isEmpty() || !matcher.matches()) {
            throw new IllegalArgumentException(String.format("Invalid period '%s'", text));
        }

        try {
            long millis = 0;
            for (int group = 1; group <= GROUP_UNITS.length; group++) {
                String amount = matcher.group(group);
                if (amount != null) {
                    millis = Math.addExact(millis,
                        Math.multiplyExact(Long.parseLong(amount), GROUP_UNITS[group - 1]));
                }
            }
            return Duration.ofMillis(millis);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Period '%s' is out of range", text), e);
        }
    }

    private static long appendUnit(StringBuilder sb, long millis, long unit, String suffix) {
        long amount = millis / unit;
        if (amount > 0) {
            sb.append(amount).append(suffix);
        }
        return millis % unit;
    }

    /**
     * Jackson serializer writing periods in compact form.
     */
    public static class Serializer extends JsonSerializer<Duration> {
        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(format(value));
        }
    }

    /**
     * Jackson deserializer reading periods in compact form.
     */
    public static class Deserializer extends JsonDeserializer<Duration> {
        @Override
        public Duration deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            String text = parser.getValueAsString();
            try {
                return parse(text);
            } catch (IllegalArgumentException e) {
                return (Duration) context.handleWeirdStringValue(Duration.class, text, e.getMessage());
            }
        }
    }
}
