package me.go_gradually.soundrelay.presentation.voice.dto;

public record PlayResponse(String videoId, String title, String guildId) {
}
