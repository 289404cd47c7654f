package me.go_gradually.soundrelay.application.relay.port;

import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;

public interface RelayInstanceFactory {
    RelayInstance create(RelayInstanceId id);
}
