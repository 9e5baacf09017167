package com.example.giveaway_system.domain.vo;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 진행 기간 값 객체.
 * "1d2h30m15s", "1h 30m", "H:M:S", "M:S", 분 단위 숫자("90")를 해석합니다.
 * 최대 30일까지 허용합니다.
 */
public record GiveawayDuration(long millis) {

    private static final long SECOND = 1_000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    public static final Duration MAX_DURATION = Duration.ofDays(30);

    private static final Pattern COMPOUND = Pattern.compile("^(\\s*\\d+\\s*[dhms])+\\s*$");
    private static final Pattern TOKEN = Pattern.compile("(\\d+)\\s*([dhms])");
    private static final Pattern CLOCK = Pattern.compile("^\\d+(:\\d+){0,2}$");

    public GiveawayDuration {
        if (millis <= 0) {
            throw new IllegalArgumentException("진행 기간은 0보다 커야 합니다.");
        }
        if (millis > MAX_DURATION.toMillis()) {
            throw new IllegalArgumentException("진행 기간은 최대 30일까지 설정할 수 있습니다.");
        }
    }

    public static GiveawayDuration ofMillis(long millis) {
        return new GiveawayDuration(millis);
    }

    public static GiveawayDuration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("진행 기간이 비어 있습니다.");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);

        try {
            if (COMPOUND.matcher(normalized).matches()) {
                return new GiveawayDuration(parseCompound(normalized));
            }
            if (CLOCK.matcher(normalized).matches()) {
                return new GiveawayDuration(parseClock(normalized));
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("진행 기간 값이 너무 큽니다: " + text, e);
        }
        throw new IllegalArgumentException("진행 기간 형식이 올바르지 않습니다: " + text);
    }

    private static long parseCompound(String text) {
        long total = 0;
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            long value = Long.parseLong(matcher.group(1));
            long unit = switch (matcher.group(2)) {
                case "d" -> DAY;
                case "h" -> HOUR;
                case "m" -> MINUTE;
                default -> SECOND;
            };
            total = Math.addExact(total, Math.multiplyExact(value, unit));
        }
        return total;
    }

    // H:M:S, M:S 또는 분 단위 정수
    private static long parseClock(String text) {
        String[] parts = text.split(":");
        long[] values = new long[parts.length];
        for (int i = 0; i < parts.length; i++) {
            values[i] = Long.parseLong(parts[i]);
        }
        return switch (values.length) {
            case 3 -> Math.addExact(Math.addExact(Math.multiplyExact(values[0], HOUR),
                    Math.multiplyExact(values[1], MINUTE)), Math.multiplyExact(values[2], SECOND));
            case 2 -> Math.addExact(Math.multiplyExact(values[0], MINUTE), Math.multiplyExact(values[1], SECOND));
            default -> Math.multiplyExact(values[0], MINUTE);
        };
    }

    /**
     * 0이 아닌 단위를 모두 출력합니다. (예: "1d 2h 30m 15s")
     * 출력 결과를 다시 parse 하면 같은 값이 됩니다. (1초 미만 단위 제외)
     */
    public String format() {
        long days = millis / DAY;
        long hours = (millis % DAY) / HOUR;
        long minutes = (millis % HOUR) / MINUTE;
        long seconds = (millis % MINUTE) / SECOND;

        List<String> parts = new ArrayList<>();
        if (days > 0) parts.add(days + "d");
        if (hours > 0) parts.add(hours + "h");
        if (minutes > 0) parts.add(minutes + "m");
        if (seconds > 0) parts.add(seconds + "s");

        return parts.isEmpty() ? "Less than 1s" : String.join(" ", parts);
    }

    public Duration toDuration() {
        return Duration.ofMillis(millis);
    }
}
