package com.ocpbot.channel.slack;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SlackEventTest {

    @Test
    void parse_appMention() {
        SlackEvent event = SlackEvent.parse("""
                {
                  "event_id": "Ev01",
                  "event": {
                    "type": "app_mention",
                    "user": "U0ALICE01",
                    "text": "<@UBOT> list-aws-vms",
                    "channel": "C0123",
                    "ts": "1700000000.000100"
                  }
                }
                """);

        assertEquals("Ev01", event.eventId());
        assertEquals("app_mention", event.type());
        assertEquals("U0ALICE01", event.user());
        assertEquals("<@UBOT> list-aws-vms", event.text());
        assertEquals("C0123:1700000000.000100", event.dedupeKey());
        assertFalse(event.fromBot());
    }

    @Test
    void fromBody_missingFieldsAreNullOrEmpty() {
        SlackEvent event = SlackEvent.fromBody(Map.of("event", Map.of("type", "message")));

        assertNull(event.user());
        assertEquals("", event.text());
        assertNull(event.dedupeKey());
        assertEquals("", SlackEvent.fromBody(null).text());
    }

    @Test
    void botMessagesAreFlagged() {
        assertTrue(SlackEvent.fromBody(Map.of("event", Map.of("bot_id", "B01", "text", "hi"))).fromBot());
        assertTrue(SlackEvent.fromBody(Map.of("event", Map.of("subtype", "bot_message"))).fromBot());
    }

    @Test
    void dedupeKeyFallsBackToEventId() {
        SlackEvent event = SlackEvent.fromBody(Map.of("event_id", "Ev02", "event", Map.of("user", "U1")));
        assertEquals("Ev02", event.dedupeKey());
    }

    @Test
    void parse_invalidJson() {
        assertThrows(IllegalArgumentException.class, () -> SlackEvent.parse("{not json"));
    }
}
