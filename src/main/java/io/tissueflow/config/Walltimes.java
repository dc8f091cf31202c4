package io.tissueflow.config;

import java.time.Duration;

public final class Walltimes {
    private Walltimes() {
    }

    public static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Wall time cannot be empty");
        }
        String[] parts = raw.trim().split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Wall time must have format HH:MM:SS: " + raw);
        }
        try {
            long hours = Long.parseLong(parts[0]);
            long minutes = Long.parseLong(parts[1]);
            long seconds = Long.parseLong(parts[2]);
            if (hours < 0 || minutes < 0 || minutes > 59 || seconds < 0 || seconds > 59) {
                throw new IllegalArgumentException("Wall time out of range: " + raw);
            }
            return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Wall time must have format HH:MM:SS: " + raw, e);
        }
    }

    public static String format(Duration duration) {
        long total = Math.max(0L, duration.getSeconds());
        return String.format("%02d:%02d:%02d", total / 3600, (total % 3600) / 60, total % 60);
    }
}
