package in.opsdash.service.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.opsdash.domain.notify.ControlKind;
import in.opsdash.domain.notify.DomainEvent;
import in.opsdash.domain.notify.InboundFrame;
import in.opsdash.domain.notify.NotificationPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;

/**
 * Wire codec of the notification channel.
 *
 * Inbound: {@code {"type": string, ...}}. pong/ping/ack/connection/subscribed/online_admins are
 * control frames; any other type is a domain event with optional title, message, priority
 * (default normal), severity, data and timestamp.
 * Outbound: {@code {"type":"ping","timestamp": <epoch-ms>}} plus client requests.
 */
public final class FrameCodec {
    private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /**
     * Parse one raw text frame.
     *
     * @return the frame, or empty if the payload is not a JSON object with a non-blank type
     */
    public Optional<InboundFrame> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Frame is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            return Optional.empty();
        }
        String type = typeNode.asText().trim();

        Optional<ControlKind> control = ControlKind.fromWire(type);
        if (control.isPresent()) {
            return Optional.of(InboundFrame.control(control.get()));
        }

        try {
            DomainEvent event = new DomainEvent(
                type,
                text(root, "title"),
                text(root, "message"),
                NotificationPriority.fromWire(text(root, "priority")),
                timestamp(root),
                text(root, "severity"),
                data(root.get("data"))
            );
            return Optional.of(InboundFrame.event(event));
        } catch (IllegalArgumentException e) {
            log.debug("Frame payload rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Heartbeat ping frame.
     */
    public String ping(long epochMillis) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "ping");
        node.put("timestamp", epochMillis);
        return node.toString();
    }

    /**
     * Client request frame, e.g. {@code subscribe} with a channel or {@code get_online_admins}.
     */
    public String request(String type, Map<String, ?> fields) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        if (fields != null) {
            fields.forEach((key, value) -> node.set(key, MAPPER.valueToTree(value)));
        }
        return node.toString();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static Long timestamp(JsonNode root) {
        JsonNode node = root.has("server_timestamp") ? root.get("server_timestamp") : root.get("timestamp");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText()).toEpochMilli();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }

    private static Map<String, Object> data(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return MAPPER.convertValue(node, MAP_TYPE);
    }
}
