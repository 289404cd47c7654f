package me.go_gradually.soundrelay.application.playback.port;

import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;

import java.io.InputStream;
import java.util.List;

public interface AudioCapturePort {
    InputStream openCapture(RelayInstanceId instanceId);

    void stopCapture(RelayInstanceId instanceId);

    List<String> activeCaptures();
}
