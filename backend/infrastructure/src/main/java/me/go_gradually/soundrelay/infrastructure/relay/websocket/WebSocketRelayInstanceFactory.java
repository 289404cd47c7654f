package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.soundrelay.application.relay.port.RelayInstance;
import me.go_gradually.soundrelay.application.relay.port.RelayInstanceFactory;
import me.go_gradually.soundrelay.application.shared.port.MetricsPort;
import me.go_gradually.soundrelay.application.shared.port.SchedulerPort;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;
import me.go_gradually.soundrelay.infrastructure.shared.config.AppProperties;
import org.springframework.stereotype.Component;

@Component
public class WebSocketRelayInstanceFactory implements RelayInstanceFactory {
    private final AppProperties properties;
    private final RelayTransportConnector connector;
    private final RelayMessageCodec codec;
    private final SchedulerPort scheduler;
    private final MetricsPort metrics;

    public WebSocketRelayInstanceFactory(AppProperties properties,
                                         RelayTransportConnector connector,
                                         ObjectMapper objectMapper,
                                         SchedulerPort scheduler,
                                         MetricsPort metrics) {
        this.properties = properties;
        this.connector = connector;
        this.codec = new RelayMessageCodec(objectMapper);
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    @Override
    public RelayInstance create(RelayInstanceId id) {
        return new WebSocketRelayInstance(id, properties.getRelay(), connector, codec, scheduler, metrics);
    }
}
