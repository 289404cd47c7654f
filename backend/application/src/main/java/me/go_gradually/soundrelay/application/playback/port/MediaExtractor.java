package me.go_gradually.soundrelay.application.playback.port;

import me.go_gradually.soundrelay.application.playback.model.ExtractionException;
import me.go_gradually.soundrelay.domain.track.Track;

import java.io.InputStream;

public interface MediaExtractor {
    String name();

    /**
     * 오디오 스트림을 열거나, 실패 시 원본 오류 문구를 담은 {@link ExtractionException}을 던진다.
     */
    InputStream open(Track track);
}
