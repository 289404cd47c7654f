package me.go_gradually.soundrelay.presentation.voice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

public record PlayRequest(@NotBlank String videoId,
                          String title,
                          @NotBlank String url,
                          @PositiveOrZero long durationSeconds,
                          String thumbnailUrl,
                          String requestedBy) {
}
