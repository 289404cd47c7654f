package me.go_gradually.soundrelay.infrastructure.shared.config;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.cache.CacheFlag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.logging.Logger;

@Configuration
public class JdaConfig {
    private static final Logger log = Logger.getLogger(JdaConfig.class.getName());

    @Bean(destroyMethod = "shutdown")
    public JDA jda(AppProperties properties) throws InterruptedException {
        String token = properties.getIntegrations().getDiscord().getToken();
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("soundrelay.integrations.discord.token is required");
        }
        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(GatewayIntent.GUILD_VOICE_STATES)
                .enableCache(CacheFlag.VOICE_STATE)
                .build()
                .awaitReady();
        log.info("discord.gateway ready guilds=" + jda.getGuilds().size());
        return jda;
    }
}
