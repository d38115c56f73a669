package com.acme.autodoist.event;

import com.acme.autodoist.core.Jsons;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventParserTest {

    private static TodoistWebhookEvent parse(String json) throws Exception {
        return EventParser.parse(Jsons.readTree(json), "d-1");
    }

    @Test
    void testItemCompleted() throws Exception {
        var event = parse("""
            {"event_name":"item:completed","user_id":"u1","triggered_at":"2026-01-05T10:00:00Z",
             "event_data":{"id":"t1","project_id":"p1"}}
            """);

        assertEquals("d-1", event.deliveryId());
        assertEquals("item:completed", event.eventName());
        assertEquals("u1", event.userId());
        assertEquals("2026-01-05T10:00:00Z", event.triggeredAt());
        assertEquals("t1", event.taskId());
        assertEquals("p1", event.projectId());
        assertNull(event.reminderId());
        assertTrue(event.isCompletion());
    }

    @Test
    void testNumericIdsBecomeText() throws Exception {
        var event = parse("{\"event_name\":\"item:completed\",\"user_id\":42,\"event_data\":{\"id\":7,\"project_id\":9}}");
        assertEquals("42", event.userId());
        assertEquals("7", event.taskId());
        assertEquals("9", event.projectId());
    }

    @Test
    void testUpdatedWithCompletionIntent() throws Exception {
        var event = parse("""
            {"event_name":"item:updated","event_data":{"id":"t1"},
             "event_data_extra":{"update_intent":"item_completed"}}
            """);
        assertEquals("item_completed", event.updateIntent());
        assertTrue(event.isCompletion());

        var plain = parse("{\"event_name\":\"item:updated\",\"event_data\":{\"id\":\"t1\"}}");
        assertFalse(plain.isCompletion());
    }

    @Test
    void testReminderUsesItemId() throws Exception {
        var event = parse("{\"event_name\":\"reminder:fired\",\"event_data\":{\"id\":\"r9\",\"item_id\":\"t3\"}}");
        assertEquals("t3", event.taskId());
        assertEquals("r9", event.reminderId());
        assertFalse(event.isCompletion());
    }

    @Test
    void testReminderWithoutItemIdFallsBackToId() throws Exception {
        var event = parse("{\"event_name\":\"reminder:fired\",\"event_data\":{\"id\":\"r9\"}}");
        assertEquals("r9", event.taskId());
    }

    @Test
    void testCamelCaseEventNameAndMissingFields() throws Exception {
        var event = parse("{\"eventName\":\"note:added\",\"event_data\":\"not-an-object\"}");
        assertEquals("note:added", event.eventName());
        assertNull(event.taskId());
        assertFalse(event.hasTask());
        assertNull(event.projectId());
    }

    @Test
    void testMissingEventNameIsEmpty() throws Exception {
        assertEquals("", parse("{}").eventName());
    }
}
