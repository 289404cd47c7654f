package me.go_gradually.soundrelay.presentation.health.controller;

import me.go_gradually.soundrelay.application.relay.model.RelayInstanceStatus;
import me.go_gradually.soundrelay.application.relay.usecase.RelayPool;
import me.go_gradually.soundrelay.application.voice.usecase.VoiceSessionManager;
import me.go_gradually.soundrelay.presentation.health.dto.HealthResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class HealthController {
    private final VoiceSessionManager voiceSessionManager;
    private final RelayPool relayPool;

    public HealthController(VoiceSessionManager voiceSessionManager, RelayPool relayPool) {
        this.voiceSessionManager = voiceSessionManager;
        this.relayPool = relayPool;
    }

    /**
     * 인증된 릴레이가 하나도 없으면 unhealthy(503), 일부만 인증되어 있으면 degraded 로 본다.
     * 릴레이 풀이 비어 있으면 직접 재생만 가능하므로 healthy 로 취급한다.
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        List<RelayInstanceStatus> statuses = relayPool.statuses();
        int total = statuses.size();
        int authenticated = (int) statuses.stream().filter(RelayInstanceStatus::authenticated).count();
        int busy = (int) statuses.stream().filter(RelayInstanceStatus::isBusy).count();
        String status = resolveStatus(total, authenticated);
        HealthResponse body = new HealthResponse(
                status,
                voiceSessionManager.activeSessionCount(),
                new HealthResponse.RelaySummary(total, authenticated, busy)
        );
        HttpStatus httpStatus = "unhealthy".equals(status) ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(httpStatus).body(body);
    }

    private String resolveStatus(int total, int authenticated) {
        if (total == 0 || authenticated == total) {
            return "healthy";
        }
        return authenticated == 0 ? "unhealthy" : "degraded";
    }
}
