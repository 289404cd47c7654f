package me.go_gradually.soundrelay.domain.voice;

public record VoiceChannelRef(GuildId guildId, String channelId, String name) {
    public VoiceChannelRef {
        if (guildId == null) {
            throw new IllegalArgumentException("Guild is required");
        }
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("Voice channel id is required");
        }
    }

    public static VoiceChannelRef of(String guildId, String channelId) {
        return new VoiceChannelRef(GuildId.of(guildId), channelId, null);
    }
}
