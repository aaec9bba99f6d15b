package in.opsdash.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.opsdash.domain.notify.Notification;
import in.opsdash.service.notify.NotificationFeed;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP handler exposing the local notification feed.
 *
 * - GET  /feed                    - Channel state, unread count and notifications (newest first)
 * - POST /feed/{localId}/read     - Mark one notification read
 * - POST /feed/read-all           - Mark every notification read
 */
public final class FeedHandler {
    private static final Logger log = LoggerFactory.getLogger(FeedHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final NotificationFeed feed;

    public FeedHandler(NotificationFeed feed) {
        this.feed = feed;
    }

    /**
     * GET /feed
     */
    public void getFeed(HttpServerExchange exchange) {
        try {
            List<Map<String, Object>> items = new ArrayList<>();
            for (Notification n : feed.notifications()) {
                items.add(toJson(n));
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("state", feed.currentState().name());
            body.put("unreadCount", feed.unreadCount());
            body.put("droppedFrames", feed.droppedFrames());
            body.put("notifications", items);

            sendJson(exchange, StatusCodes.OK, body);
        } catch (Exception e) {
            log.error("[FEED] Failed to render feed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to render feed: " + e.getMessage());
        }
    }

    /**
     * POST /feed/{localId}/read
     */
    public void markRead(HttpServerExchange exchange) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        String raw = match == null ? null : match.getParameters().get("localId");

        long localId;
        try {
            localId = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid notification id: " + raw);
            return;
        }

        try {
            if (!feed.markRead(localId)) {
                sendError(exchange, StatusCodes.NOT_FOUND, "Notification not found: " + localId);
                return;
            }
            sendJson(exchange, StatusCodes.OK, Map.of("success", true, "unreadCount", feed.unreadCount()));
        } catch (Exception e) {
            log.error("[FEED] Failed to mark {} read: {}", localId, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to mark read: " + e.getMessage());
        }
    }

    /**
     * POST /feed/read-all
     */
    public void markAllRead(HttpServerExchange exchange) {
        try {
            int updated = feed.markAllRead();
            sendJson(exchange, StatusCodes.OK, Map.of("success", true, "updated", updated));
        } catch (Exception e) {
            log.error("[FEED] Failed to mark all read: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to mark all read: " + e.getMessage());
        }
    }

    static Map<String, Object> toJson(Notification n) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", n.localId());
        item.put("type", n.type());
        item.put("title", n.title());
        item.put("message", n.message());
        item.put("priority", n.priority().name().toLowerCase(Locale.ROOT));
        item.put("severity", n.severity());
        item.put("receivedAt", n.receivedAt().toString());
        item.put("read", n.read());
        item.put("data", n.data());
        return item;
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
