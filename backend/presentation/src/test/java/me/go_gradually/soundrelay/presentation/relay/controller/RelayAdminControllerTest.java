package me.go_gradually.soundrelay.presentation.relay.controller;

import me.go_gradually.soundrelay.application.relay.model.RelayInstanceStatus;
import me.go_gradually.soundrelay.application.relay.usecase.RelayPool;
import me.go_gradually.soundrelay.domain.relay.RelayConnectionState;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;
import me.go_gradually.soundrelay.presentation.TestBootApplication;
import me.go_gradually.soundrelay.presentation.shared.error.ApiExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = {TestBootApplication.class, RelayAdminController.class, ApiExceptionHandler.class})
@AutoConfigureMockMvc
class RelayAdminControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RelayPool relayPool;

    @Test
    void list_returnsInstanceStatuses() throws Exception {
        when(relayPool.statuses()).thenReturn(List.of(
                new RelayInstanceStatus("neko-1", RelayConnectionState.READY, true, false,
                        "https://youtu.be/a", Instant.parse("2026-01-01T00:00:00Z"), 0),
                new RelayInstanceStatus("neko-2", RelayConnectionState.DISCONNECTED, false, false,
                        null, Instant.EPOCH, 3)
        ));

        mockMvc.perform(get("/api/relays"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("neko-1"))
                .andExpect(jsonPath("$[0].connectionState").value("READY"))
                .andExpect(jsonPath("$[0].busy").value(true))
                .andExpect(jsonPath("$[1].authenticated").value(false))
                .andExpect(jsonPath("$[1].reconnectAttempts").value(3));
    }

    @Test
    void restart_returnsAccepted() throws Exception {
        when(relayPool.restart(RelayInstanceId.of("neko-2"))).thenReturn(new CompletableFuture<>());

        mockMvc.perform(post("/api/relays/neko-2/restart"))
                .andExpect(status().isAccepted());

        verify(relayPool).restart(RelayInstanceId.of("neko-2"));
    }

    @Test
    void restart_returnsNotFound_whenInstanceUnknown() throws Exception {
        when(relayPool.restart(RelayInstanceId.of("neko-9")))
                .thenThrow(new NoSuchElementException("Unknown relay instance neko-9"));

        mockMvc.perform(post("/api/relays/neko-9/restart"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Unknown relay instance neko-9"));
    }

    @Test
    void maintain_persistsSessionsBeforeListing() throws Exception {
        when(relayPool.statuses()).thenReturn(List.of());

        mockMvc.perform(post("/api/relays/maintenance"))
                .andExpect(status().isOk());

        InOrder order = inOrder(relayPool);
        order.verify(relayPool).maintainSessions();
        order.verify(relayPool).statuses();
    }
}
