package me.go_gradually.soundrelay.presentation.voice.dto;

public record SkipResponse(boolean skipped) {
}
