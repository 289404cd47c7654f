package me.go_gradually.soundrelay.application.voice.port;

import java.io.Closeable;
import java.io.IOException;

public interface AudioResource extends Closeable {
    /**
     * 다음 PCM 프레임을 버퍼에 채운다. 읽은 바이트 수, 스트림 끝이면 -1
     */
    int readFrame(byte[] frame) throws IOException;

    @Override
    void close();
}
