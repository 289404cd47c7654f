package me.go_gradually.soundrelay.application.relay.model;

public class RelayProtocolTimeoutException extends RuntimeException {
    private final String operation;

    public RelayProtocolTimeoutException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
