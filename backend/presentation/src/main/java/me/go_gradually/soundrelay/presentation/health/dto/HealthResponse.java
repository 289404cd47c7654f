package me.go_gradually.soundrelay.presentation.health.dto;

public record HealthResponse(String status, int activeVoiceSessions, RelaySummary relays) {
    public record RelaySummary(int total, int authenticated, int busy) {
    }
}
