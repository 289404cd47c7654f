package me.go_gradually.soundrelay.infrastructure.shared.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import me.go_gradually.soundrelay.application.shared.port.MetricsPort;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class MicrometerMetricsAdapter implements MetricsPort {
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsAdapter(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordPlaybackStartLatency(Duration duration) {
        record("playback.start.latency", duration);
    }

    @Override
    public void recordRelayAcquireLatency(Duration duration) {
        record("relay.acquire.latency", duration);
    }

    @Override
    public void incrementDirectPlayback() {
        meterRegistry.counter("playback.started", "method", "direct").increment();
    }

    @Override
    public void incrementRelayPlayback() {
        meterRegistry.counter("playback.started", "method", "relay").increment();
    }

    @Override
    public void incrementDirectFailure() {
        meterRegistry.counter("playback.direct.failures").increment();
    }

    @Override
    public void incrementBotDetection() {
        meterRegistry.counter("playback.direct.bot_detections").increment();
    }

    @Override
    public void incrementPlaybackUnavailable() {
        meterRegistry.counter("playback.unavailable").increment();
    }

    @Override
    public void incrementRelayReconnect() {
        meterRegistry.counter("relay.reconnects").increment();
    }

    @Override
    public void incrementRelayRestart() {
        meterRegistry.counter("relay.restarts").increment();
    }

    @Override
    public void incrementRelayPoolExhausted() {
        meterRegistry.counter("relay.pool.exhausted").increment();
    }

    @Override
    public void incrementVoiceRecovery() {
        meterRegistry.counter("voice.connection.recoveries").increment();
    }

    @Override
    public void incrementVoiceConnectionLost() {
        meterRegistry.counter("voice.connection.lost").increment();
    }

    @Override
    public void incrementPlayerError() {
        meterRegistry.counter("voice.player.errors").increment();
    }

    private void record(String name, Duration duration) {
        Timer.builder(name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(duration);
    }
}
