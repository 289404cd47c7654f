package me.go_gradually.soundrelay.application.playback.model;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaybackStreamTest {

    @Test
    void read_reportsFailureOnceAndRethrows() {
        AtomicInteger errors = new AtomicInteger();
        PlaybackStream stream = PlaybackStream.wrap(new FailingStream()).onError(error -> errors.incrementAndGet());

        assertThrows(IOException.class, stream::read);
        assertThrows(IOException.class, () -> stream.read(new byte[4], 0, 4));

        assertEquals(1, errors.get());
    }

    @Test
    void close_runsHooksOnce() throws IOException {
        AtomicInteger closed = new AtomicInteger();
        PlaybackStream stream = PlaybackStream.wrap(new ByteArrayInputStream(new byte[]{1, 2}))
                .onClose(closed::incrementAndGet);

        stream.close();
        stream.closeQuietly();

        assertEquals(1, closed.get());
        assertTrue(stream.isClosed());
    }

    @Test
    void wrap_returnsSameInstanceForPlaybackStream() {
        PlaybackStream stream = PlaybackStream.wrap(new ByteArrayInputStream(new byte[0]));

        assertSame(stream, PlaybackStream.wrap(stream));
    }

    private static final class FailingStream extends InputStream {
        @Override
        public int read() throws IOException {
            throw new IOException("connection reset");
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            throw new IOException("connection reset");
        }
    }
}
