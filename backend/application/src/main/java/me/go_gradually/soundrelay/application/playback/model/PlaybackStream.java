package me.go_gradually.soundrelay.application.playback.model;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 음성 계층에 넘기는 오디오 스트림. 읽기 실패는 등록된 핸들러에 한 번만 알리고
 * close 훅도 한 번만 실행한다.
 */
public class PlaybackStream extends FilterInputStream {
    private final List<Consumer<IOException>> errorHandlers = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeHooks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean failed = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private PlaybackStream(InputStream source) {
        super(source);
    }

    public static PlaybackStream wrap(InputStream source) {
        if (source == null) {
            throw new IllegalArgumentException("Stream source is required");
        }
        if (source instanceof PlaybackStream stream) {
            return stream;
        }
        return new PlaybackStream(source);
    }

    public PlaybackStream onError(Consumer<IOException> handler) {
        errorHandlers.add(handler);
        return this;
    }

    public PlaybackStream onClose(Runnable hook) {
        closeHooks.add(hook);
        return this;
    }

    @Override
    public int read() throws IOException {
        try {
            return super.read();
        } catch (IOException e) {
            throw fail(e);
        }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        try {
            return super.read(b, off, len);
        } catch (IOException e) {
            throw fail(e);
        }
    }

    @Override
    public void close() throws IOException {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            super.close();
        } finally {
            for (Runnable hook : closeHooks) {
                hook.run();
            }
        }
    }

    public void closeQuietly() {
        try {
            close();
        } catch (IOException ignored) {
            // 이미 닫히는 중이라 정리할 것이 없다.
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private IOException fail(IOException error) {
        if (!closed.get() && failed.compareAndSet(false, true)) {
            for (Consumer<IOException> handler : errorHandlers) {
                handler.accept(error);
            }
        }
        return error;
    }
}
