package com.platform.gitops.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and prints durations in the Go style used by manifests ({@code 1h30m}, {@code 45s},
 * {@code 500ms}). ISO-8601 values such as {@code PT5M} are accepted too.
 */
public final class DurationFormat {

    private static final Pattern GO_DURATION = Pattern.compile("^(?:(\\d+)h)?(?:(\\d+)m(?!s))?(?:(\\d+)s)?(?:(\\d+)ms)?$");

    private DurationFormat() {
    }

    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration must not be blank");
        }
        String value = text.trim();
        if (value.startsWith("P") || value.startsWith("p")) {
            try {
                return Duration.parse(value);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid duration: " + text, e);
            }
        }
        if ("0".equals(value)) {
            return Duration.ZERO;
        }
        Matcher m = GO_DURATION.matcher(value);
        if (!m.matches() || value.isEmpty()) {
            throw new IllegalArgumentException("Invalid duration: " + text);
        }
        Duration result = Duration.ZERO;
        if (m.group(1) != null) {
            result = result.plusHours(Long.parseLong(m.group(1)));
        }
        if (m.group(2) != null) {
            result = result.plusMinutes(Long.parseLong(m.group(2)));
        }
        if (m.group(3) != null) {
            result = result.plusSeconds(Long.parseLong(m.group(3)));
        }
        if (m.group(4) != null) {
            result = result.plusMillis(Long.parseLong(m.group(4)));
        }
        return result;
    }

    public static String format(Duration duration) {
        if (duration == null) {
            return null;
        }
        if (duration.isZero()) {
            return "0s";
        }
        StringBuilder sb = new StringBuilder();
        long hours = duration.toHours();
        int minutes = duration.toMinutesPart();
        int seconds = duration.toSecondsPart();
        int millis = duration.toMillisPart();
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (minutes > 0) {
            sb.append(minutes).append('m');
        }
        if (seconds > 0) {
            sb.append(seconds).append('s');
        }
        if (millis > 0) {
            sb.append(millis).append("ms");
        }
        return sb.toString();
    }

    public static class Serializer extends JsonSerializer<Duration> {
        @Override
        public void serialize(Duration value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(format(value));
        }
    }

    public static class Deserializer extends JsonDeserializer<Duration> {
        @Override
        public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            String text = p.getValueAsString();
            try {
                return parse(text);
            } catch (IllegalArgumentException e) {
                return (Duration) ctxt.handleWeirdStringValue(Duration.class, text, e.getMessage());
            }
        }
    }
}
