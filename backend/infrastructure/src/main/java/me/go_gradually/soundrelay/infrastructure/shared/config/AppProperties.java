package me.go_gradually.soundrelay.infrastructure.shared.config;

import me.go_gradually.soundrelay.application.playback.policy.PlaybackPolicy;
import me.go_gradually.soundrelay.application.relay.policy.RelayPolicy;
import me.go_gradually.soundrelay.application.voice.policy.VoicePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "soundrelay")
public class AppProperties implements VoicePolicy, PlaybackPolicy, RelayPolicy {
    private Voice voice = new Voice();
    private Playback playback = new Playback();
    private Relay relay = new Relay();
    private Store store = new Store();
    private Integrations integrations = new Integrations();

    public Voice getVoice() {
        return voice;
    }

    public void setVoice(Voice voice) {
        this.voice = voice;
    }

    public Playback getPlayback() {
        return playback;
    }

    public void setPlayback(Playback playback) {
        this.playback = playback;
    }

    public Relay getRelay() {
        return relay;
    }

    public void setRelay(Relay relay) {
        this.relay = relay;
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    @Override
    public Duration idleDisconnectTimeout() {
        return Duration.ofMillis(voice.getIdleDisconnectMs());
    }

    @Override
    public Duration recoveryWindow() {
        return Duration.ofMillis(voice.getRecoveryWindowMs());
    }

    @Override
    public Duration errorGraceDelay() {
        return Duration.ofMillis(voice.getErrorGraceMs());
    }

    @Override
    public Duration failureTtl() {
        return Duration.ofSeconds(playback.getFailureTtlSeconds());
    }

    @Override
    public int failureThreshold() {
        return playback.getFailureThreshold();
    }

    @Override
    public Duration forceRelayTtl() {
        return Duration.ofSeconds(playback.getForceRelayTtlSeconds());
    }

    @Override
    public int poolSize() {
        return relay.getPoolSize();
    }

    @Override
    public Duration healthCheckInterval() {
        return Duration.ofMillis(relay.getHealthCheckIntervalMs());
    }

    @Override
    public Duration sessionMaintenanceInterval() {
        return Duration.ofMillis(relay.getSessionMaintenanceIntervalMs());
    }

    @Override
    public Duration sessionTtl() {
        return Duration.ofDays(relay.getSessionTtlDays());
    }

    @Override
    public Duration acquireTimeout() {
        return Duration.ofMillis(relay.getAcquireTimeoutMs());
    }

    @Override
    public Duration acquirePollInterval() {
        return Duration.ofMillis(relay.getAcquirePollIntervalMs());
    }

    public static class Voice {
        private long idleDisconnectMs = 300_000;
        private long recoveryWindowMs = 5_000;
        private long errorGraceMs = 1_000;

        public long getIdleDisconnectMs() {
            return idleDisconnectMs;
        }

        public void setIdleDisconnectMs(long idleDisconnectMs) {
            this.idleDisconnectMs = idleDisconnectMs;
        }

        public long getRecoveryWindowMs() {
            return recoveryWindowMs;
        }

        public void setRecoveryWindowMs(long recoveryWindowMs) {
            this.recoveryWindowMs = recoveryWindowMs;
        }

        public long getErrorGraceMs() {
            return errorGraceMs;
        }

        public void setErrorGraceMs(long errorGraceMs) {
            this.errorGraceMs = errorGraceMs;
        }
    }

    public static class Playback {
        private long failureTtlSeconds = 3_600;
        private int failureThreshold = 2;
        private long forceRelayTtlSeconds = 300;

        public long getFailureTtlSeconds() {
            return failureTtlSeconds;
        }

        public void setFailureTtlSeconds(long failureTtlSeconds) {
            this.failureTtlSeconds = failureTtlSeconds;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getForceRelayTtlSeconds() {
            return forceRelayTtlSeconds;
        }

        public void setForceRelayTtlSeconds(long forceRelayTtlSeconds) {
            this.forceRelayTtlSeconds = forceRelayTtlSeconds;
        }
    }

    public static class Relay {
        private int poolSize = 3;
        private String baseUrl = "http://localhost:8080";
        private String username = "admin";
        private String password = "neko";
        private long connectTimeoutMs = 10_000;
        private long controlTimeoutMs = 5_000;
        private long healthCheckTimeoutMs = 3_000;
        private long heartbeatIntervalMs = 10_000;
        private long pingIntervalMs = 30_000;
        private long reconnectBaseDelayMs = 5_000;
        private int maxReconnectAttempts = 5;
        private long settleDelayMs = 5_000;
        private long restartDelayMs = 1_000;
        private long healthCheckIntervalMs = 60_000;
        private long sessionMaintenanceIntervalMs = 3_600_000;
        private long sessionTtlDays = 7;
        private long acquireTimeoutMs = 30_000;
        private long acquirePollIntervalMs = 1_000;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getControlTimeoutMs() {
            return controlTimeoutMs;
        }

        public void setControlTimeoutMs(long controlTimeoutMs) {
            this.controlTimeoutMs = controlTimeoutMs;
        }

        public long getHealthCheckTimeoutMs() {
            return healthCheckTimeoutMs;
        }

        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) {
            this.healthCheckTimeoutMs = healthCheckTimeoutMs;
        }

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }

        public long getPingIntervalMs() {
            return pingIntervalMs;
        }

        public void setPingIntervalMs(long pingIntervalMs) {
            this.pingIntervalMs = pingIntervalMs;
        }

        public long getReconnectBaseDelayMs() {
            return reconnectBaseDelayMs;
        }

        public void setReconnectBaseDelayMs(long reconnectBaseDelayMs) {
            this.reconnectBaseDelayMs = reconnectBaseDelayMs;
        }

        public int getMaxReconnectAttempts() {
            return maxReconnectAttempts;
        }

        public void setMaxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
        }

        public long getSettleDelayMs() {
            return settleDelayMs;
        }

        public void setSettleDelayMs(long settleDelayMs) {
            this.settleDelayMs = settleDelayMs;
        }

        public long getRestartDelayMs() {
            return restartDelayMs;
        }

        public void setRestartDelayMs(long restartDelayMs) {
            this.restartDelayMs = restartDelayMs;
        }

        public long getHealthCheckIntervalMs() {
            return healthCheckIntervalMs;
        }

        public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
            this.healthCheckIntervalMs = healthCheckIntervalMs;
        }

        public long getSessionMaintenanceIntervalMs() {
            return sessionMaintenanceIntervalMs;
        }

        public void setSessionMaintenanceIntervalMs(long sessionMaintenanceIntervalMs) {
            this.sessionMaintenanceIntervalMs = sessionMaintenanceIntervalMs;
        }

        public long getSessionTtlDays() {
            return sessionTtlDays;
        }

        public void setSessionTtlDays(long sessionTtlDays) {
            this.sessionTtlDays = sessionTtlDays;
        }

        public long getAcquireTimeoutMs() {
            return acquireTimeoutMs;
        }

        public void setAcquireTimeoutMs(long acquireTimeoutMs) {
            this.acquireTimeoutMs = acquireTimeoutMs;
        }

        public long getAcquirePollIntervalMs() {
            return acquirePollIntervalMs;
        }

        public void setAcquirePollIntervalMs(long acquirePollIntervalMs) {
            this.acquirePollIntervalMs = acquirePollIntervalMs;
        }
    }

    public static class Store {
        private String type = "memory";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    public static class Integrations {
        private Capture capture = new Capture();
        private Notification notification = new Notification();
        private YtDlp ytDlp = new YtDlp();
        private Ffmpeg ffmpeg = new Ffmpeg();
        private Discord discord = new Discord();

        public Capture getCapture() {
            return capture;
        }

        public void setCapture(Capture capture) {
            this.capture = capture;
        }

        public Notification getNotification() {
            return notification;
        }

        public void setNotification(Notification notification) {
            this.notification = notification;
        }

        public YtDlp getYtDlp() {
            return ytDlp;
        }

        public void setYtDlp(YtDlp ytDlp) {
            this.ytDlp = ytDlp;
        }

        public Ffmpeg getFfmpeg() {
            return ffmpeg;
        }

        public void setFfmpeg(Ffmpeg ffmpeg) {
            this.ffmpeg = ffmpeg;
        }

        public Discord getDiscord() {
            return discord;
        }

        public void setDiscord(Discord discord) {
            this.discord = discord;
        }
    }

    public static class Capture {
        private String baseUrl = "http://localhost:3000";
        private long connectTimeoutMs = 10_000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }
    }

    public static class Notification {
        private String webhookUrl = "";
        private long timeoutMs = 5_000;

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    public static class YtDlp {
        private String executable = "yt-dlp";
        private String cookiesFile;
        private long resolveTimeoutSeconds = 30;

        public String getExecutable() {
            return executable;
        }

        public void setExecutable(String executable) {
            this.executable = executable;
        }

        public String getCookiesFile() {
            return cookiesFile;
        }

        public void setCookiesFile(String cookiesFile) {
            this.cookiesFile = cookiesFile;
        }

        public long getResolveTimeoutSeconds() {
            return resolveTimeoutSeconds;
        }

        public void setResolveTimeoutSeconds(long resolveTimeoutSeconds) {
            this.resolveTimeoutSeconds = resolveTimeoutSeconds;
        }
    }

    public static class Ffmpeg {
        private String executable = "ffmpeg";

        public String getExecutable() {
            return executable;
        }

        public void setExecutable(String executable) {
            this.executable = executable;
        }
    }

    public static class Discord {
        private String token;

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }
    }
}
