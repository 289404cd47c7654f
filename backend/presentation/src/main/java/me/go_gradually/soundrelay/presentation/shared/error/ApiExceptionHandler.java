package me.go_gradually.soundrelay.presentation.shared.error;

import me.go_gradually.soundrelay.application.playback.model.ExtractionException;
import me.go_gradually.soundrelay.application.playback.model.NoPlaybackMethodAvailableException;
import me.go_gradually.soundrelay.application.relay.model.RelayProtocolTimeoutException;
import me.go_gradually.soundrelay.application.voice.model.NotConnectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = Logger.getLogger(ApiExceptionHandler.class.getName());

    @ExceptionHandler(NotConnectedException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, String> notConnected(NotConnectedException e) {
        return Map.of(
                "code", "NOT_CONNECTED",
                "message", messageOf(e, "Not connected")
        );
    }

    @ExceptionHandler(NoPlaybackMethodAvailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, String> noPlaybackMethod(NoPlaybackMethodAvailableException e) {
        return Map.of(
                "code", "NO_PLAYBACK_METHOD",
                "message", messageOf(e, "No playback method available")
        );
    }

    @ExceptionHandler(ExtractionException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, String> extractionFailed(ExtractionException e) {
        return Map.of(
                "code", "EXTRACTION_FAILED",
                "message", messageOf(e, "Extraction failed")
        );
    }

    @ExceptionHandler(RelayProtocolTimeoutException.class)
    @ResponseStatus(HttpStatus.GATEWAY_TIMEOUT)
    public Map<String, String> relayTimeout(RelayProtocolTimeoutException e) {
        return Map.of(
                "code", "RELAY_TIMEOUT",
                "message", messageOf(e, "Relay timed out")
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> invalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request");
        return Map.of("message", message);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(Exception e) {
        return Map.of("message", messageOf(e, "Bad request"));
    }

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, String> notFound(Exception e) {
        return Map.of("message", messageOf(e, "Not found"));
    }

    // 비동기 응답에서 감싸진 예외는 원인 기준으로 다시 분류한다
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, String>> asyncFailure(CompletionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof NotConnectedException notConnected) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(notConnected(notConnected));
        }
        if (cause instanceof NoPlaybackMethodAvailableException noMethod) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(noPlaybackMethod(noMethod));
        }
        if (cause instanceof ExtractionException extraction) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(extractionFailed(extraction));
        }
        if (cause instanceof RelayProtocolTimeoutException timeout) {
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(relayTimeout(timeout));
        }
        if (cause instanceof IllegalArgumentException || cause instanceof IllegalStateException) {
            return ResponseEntity.badRequest().body(Map.of("message", messageOf(cause, "Bad request")));
        }
        log.warning("api.async failure type=" + cause.getClass().getSimpleName() + " message=" + cause.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("message", messageOf(cause, "Internal error")));
    }

    private static String messageOf(Throwable e, String fallback) {
        return e.getMessage() == null ? fallback : e.getMessage();
    }
}
