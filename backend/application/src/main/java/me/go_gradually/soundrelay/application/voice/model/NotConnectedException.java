package me.go_gradually.soundrelay.application.voice.model;

import me.go_gradually.soundrelay.domain.voice.GuildId;

public class NotConnectedException extends RuntimeException {
    private final GuildId guildId;

    public NotConnectedException(GuildId guildId) {
        super("Not connected to a voice channel in guild " + guildId);
        this.guildId = guildId;
    }

    public GuildId getGuildId() {
        return guildId;
    }
}
