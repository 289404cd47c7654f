package me.go_gradually.soundrelay.domain.relay;

public record RelayInstanceId(String value) {
    public RelayInstanceId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RelayInstanceId is required");
        }
    }

    public static RelayInstanceId of(String value) {
        return new RelayInstanceId(value);
    }

    public static RelayInstanceId ofIndex(int index) {
        return new RelayInstanceId("neko-" + index);
    }

    @Override
    public String toString() {
        return value;
    }
}
