package com.ocpbot.channel.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * The fields of a Slack {@code message} / {@code app_mention} event callback
 * that the bot acts on.
 *
 * @param eventId event_id of the envelope, null when absent
 * @param type    event type ("message", "app_mention")
 * @param subtype message subtype, e.g. "bot_message" or "message_changed"
 * @param user    sending user id
 * @param botId   set when the message was posted by a bot
 * @param text    raw message text, never null
 * @param channel channel id
 * @param ts      message timestamp
 */
public record SlackEvent(
        @Nullable String eventId,
        @Nullable String type,
        @Nullable String subtype,
        @Nullable String user,
        @Nullable String botId,
        String text,
        @Nullable String channel,
        @Nullable String ts) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static SlackEvent fromBody(Map<String, ?> body) {
        return fromJson(MAPPER.valueToTree(body == null ? Map.of() : body));
    }

    public static SlackEvent parse(String json) {
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid Slack event payload: " + e.getOriginalMessage(), e);
        }
    }

    static SlackEvent fromJson(JsonNode body) {
        JsonNode event = body.path("event");
        return new SlackEvent(
                text(body, "event_id"),
                text(event, "type"),
                text(event, "subtype"),
                text(event, "user"),
                text(event, "bot_id"),
                event.path("text").asText(""),
                text(event, "channel"),
                text(event, "ts"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public boolean fromBot() {
        return botId != null || "bot_message".equals(subtype);
    }

    /**
     * Key shared by the {@code message} and {@code app_mention} deliveries of
     * the same post.
     */
    @Nullable
    public String dedupeKey() {
        if (channel != null && ts != null) {
            return channel + ":" + ts;
        }
        return eventId;
    }
}
