package me.go_gradually.soundrelay.domain.track;

public record Track(String id,
                    String title,
                    String sourceUrl,
                    long durationSeconds,
                    String thumbnailUrl,
                    String requestedBy) {
    public Track {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Track id is required");
        }
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("Track source url is required");
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("Track duration must be >= 0");
        }
        title = title == null || title.isBlank() ? id : title;
    }

    public static Track of(String id, String sourceUrl) {
        return new Track(id, id, sourceUrl, 0, null, null);
    }
}
