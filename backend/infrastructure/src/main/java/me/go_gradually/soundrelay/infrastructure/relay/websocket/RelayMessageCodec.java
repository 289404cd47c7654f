package me.go_gradually.soundrelay.infrastructure.relay.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

public class RelayMessageCodec {
    private final ObjectMapper objectMapper;

    public RelayMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RelayMessage decode(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed relay message", e);
        }
        String event = root.path("event").asText("");
        return switch (event) {
            case "system/init" -> new RelayMessage.SystemInit(
                    textOrNull(root, "session_id"),
                    textOrNull(root, "control_host"),
                    memberIds(root.path("members")));
            case "system/disconnect" -> new RelayMessage.SystemDisconnect(root.path("message").asText(""));
            case "system/error" -> new RelayMessage.SystemError(root.path("message").asText(""));
            case "control/locked" -> new RelayMessage.ControlLocked(root.path("id").asText(""));
            case "control/release" -> new RelayMessage.ControlRelease(root.path("id").asText(""));
            case "control/requesting" -> new RelayMessage.ControlRequesting(root.path("id").asText(""));
            case "member/list" -> new RelayMessage.MemberList(root.path("members").size());
            case "member/connected" -> new RelayMessage.MemberConnected(root.path("id").asText(""));
            case "member/disconnected" -> new RelayMessage.MemberDisconnected(root.path("id").asText(""));
            case "screen/resolution" -> new RelayMessage.ScreenResolution(
                    root.path("width").asInt(),
                    root.path("height").asInt(),
                    root.path("rate").asInt());
            default -> new RelayMessage.Unknown(event);
        };
    }

    public String encode(RelayCommand command) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("event", command.event());
        if (command instanceof RelayCommand.MouseMove move) {
            root.put("x", move.x());
            root.put("y", move.y());
        } else if (command instanceof RelayCommand.MouseDown down) {
            root.put("x", down.x());
            root.put("y", down.y());
            root.put("button", down.button());
        } else if (command instanceof RelayCommand.MouseUp up) {
            root.put("x", up.x());
            root.put("y", up.y());
            root.put("button", up.button());
        } else if (command instanceof RelayCommand.KeyDown down) {
            root.put("keysym", down.keysym());
        } else if (command instanceof RelayCommand.KeyUp up) {
            root.put("keysym", up.keysym());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode relay command " + command.event(), e);
        }
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.path(field);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static List<String> memberIds(JsonNode members) {
        List<String> ids = new ArrayList<>();
        for (JsonNode member : members) {
            ids.add(member.path("id").asText(""));
        }
        return ids;
    }
}
