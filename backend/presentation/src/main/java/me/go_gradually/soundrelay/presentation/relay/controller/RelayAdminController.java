package me.go_gradually.soundrelay.presentation.relay.controller;

import me.go_gradually.soundrelay.application.relay.usecase.RelayPool;
import me.go_gradually.soundrelay.domain.relay.RelayInstanceId;
import me.go_gradually.soundrelay.presentation.relay.dto.RelayInstanceResponse;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/relays")
public class RelayAdminController {
    private final RelayPool relayPool;

    public RelayAdminController(RelayPool relayPool) {
        this.relayPool = relayPool;
    }

    @GetMapping
    public List<RelayInstanceResponse> list() {
        return relayPool.statuses().stream().map(RelayInstanceResponse::from).toList();
    }

    // 재시작은 비동기로 진행되고 결과는 목록 조회로 확인한다
    @PostMapping("/{instanceId}/restart")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void restart(@PathVariable("instanceId") String instanceId) {
        relayPool.restart(RelayInstanceId.of(instanceId));
    }

    @PostMapping("/maintenance")
    public List<RelayInstanceResponse> maintain() {
        relayPool.maintainSessions();
        return list();
    }
}
