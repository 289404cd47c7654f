package me.go_gradually.soundrelay.application.voice.port;

import java.io.InputStream;

public interface AudioResourceFactory {
    AudioResource create(InputStream source);
}
