package me.go_gradually.soundrelay.domain.voice;

public record GuildId(String value) {
    public GuildId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("GuildId is required");
        }
    }

    public static GuildId of(String value) {
        return new GuildId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
