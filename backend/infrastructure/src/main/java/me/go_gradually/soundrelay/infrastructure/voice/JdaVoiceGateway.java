package me.go_gradually.soundrelay.infrastructure.voice;

import me.go_gradually.soundrelay.application.voice.port.VoiceConnection;
import me.go_gradually.soundrelay.application.voice.port.VoiceConnectionListener;
import me.go_gradually.soundrelay.application.voice.port.VoiceGateway;
import me.go_gradually.soundrelay.domain.voice.VoiceChannelRef;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.concrete.VoiceChannel;
import net.dv8tion.jda.api.managers.AudioManager;
import org.springframework.stereotype.Component;

@Component
public class JdaVoiceGateway implements VoiceGateway {
    private final JDA jda;

    public JdaVoiceGateway(JDA jda) {
        this.jda = jda;
    }

    @Override
    public VoiceConnection connect(VoiceChannelRef channelRef, VoiceConnectionListener listener) {
        Guild guild = jda.getGuildById(channelRef.guildId().value());
        if (guild == null) {
            throw new IllegalArgumentException("Unknown guild: " + channelRef.guildId());
        }
        VoiceChannel channel = guild.getVoiceChannelById(channelRef.channelId());
        if (channel == null) {
            throw new IllegalArgumentException("Unknown voice channel: " + channelRef.channelId());
        }
        AudioManager audioManager = guild.getAudioManager();
        JdaVoiceConnection connection = new JdaVoiceConnection(channelRef, audioManager, listener);
        audioManager.setConnectionListener(connection);
        audioManager.openAudioConnection(channel);
        return connection;
    }
}
