package me.go_gradually.soundrelay.application.shared.model;

public record OperatorAlert(String title, String description, Severity severity) {
    public OperatorAlert {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Alert title is required");
        }
        description = description == null ? "" : description;
        severity = severity == null ? Severity.WARNING : severity;
    }

    public static OperatorAlert warning(String title, String description) {
        return new OperatorAlert(title, description, Severity.WARNING);
    }

    public static OperatorAlert critical(String title, String description) {
        return new OperatorAlert(title, description, Severity.CRITICAL);
    }

    public enum Severity {
        WARNING,
        CRITICAL
    }
}
