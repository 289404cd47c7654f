package me.go_gradually.soundrelay.application.playback.model;

public class ExtractionException extends RuntimeException {
    private final String extractor;

    public ExtractionException(String extractor, String message) {
        super(message);
        this.extractor = extractor;
    }

    public ExtractionException(String extractor, String message, Throwable cause) {
        super(message, cause);
        this.extractor = extractor;
    }

    public String getExtractor() {
        return extractor;
    }
}
