package me.go_gradually.soundrelay.application.relay.policy;

import java.time.Duration;

public interface RelayPolicy {
    int poolSize();

    Duration healthCheckInterval();

    Duration sessionMaintenanceInterval();

    Duration sessionTtl();

    Duration acquireTimeout();

    Duration acquirePollInterval();
}
