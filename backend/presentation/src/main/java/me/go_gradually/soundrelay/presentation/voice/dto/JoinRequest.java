package me.go_gradually.soundrelay.presentation.voice.dto;

import jakarta.validation.constraints.NotBlank;

public record JoinRequest(@NotBlank String channelId, String channelName) {
}
