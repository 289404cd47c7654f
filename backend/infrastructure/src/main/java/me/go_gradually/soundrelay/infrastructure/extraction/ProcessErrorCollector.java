package me.go_gradually.soundrelay.infrastructure.extraction;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * 프로세스 stderr를 데몬 스레드에서 비우고 오류 보고용으로 마지막 부분만 보관한다.
 */
final class ProcessErrorCollector {
    private static final int MAX_CHARS = 4_000;
    private final StringBuilder output = new StringBuilder();
    private final Thread thread;

    private ProcessErrorCollector(InputStream stderr, String name) {
        this.thread = new Thread(() -> drain(stderr), name);
        this.thread.setDaemon(true);
    }

    static ProcessErrorCollector start(Process process, String name) {
        ProcessErrorCollector collector = new ProcessErrorCollector(process.getErrorStream(), name);
        collector.thread.start();
        return collector;
    }

    String awaitOutput(long timeoutMillis) {
        try {
            thread.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        synchronized (output) {
            return output.toString().trim();
        }
    }

    private void drain(InputStream stderr) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (output) {
                    output.append(line).append('\n');
                    if (output.length() > MAX_CHARS) {
                        output.delete(0, output.length() - MAX_CHARS);
                    }
                }
            }
        } catch (IOException ignored) {
            // 프로세스 종료로 스트림이 닫힌 경우
        }
    }
}
