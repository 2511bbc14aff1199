package com.questrail.agentsession.internal.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.agentsession.api.ApprovalRequest;
import com.questrail.agentsession.api.ApprovalType;
import com.questrail.agentsession.api.Message;
import com.questrail.agentsession.api.MessageType;
import com.questrail.agentsession.api.WorkStatus;
import com.questrail.agentsession.internal.effects.EventPayload;
import com.questrail.agentsession.internal.effects.SessionEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionEventCodecTest
{

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00.123Z");

    private final SessionEventCodec codec = new SessionEventCodec();
    private final ObjectMapper mapper = SessionEventCodec.defaultMapper();

    @Test
    void writesTypeDiscriminatorAndIsoTimestamp() throws JsonProcessingException {
        SessionEvent event = new SessionEvent(7, "s-1", T0,
                new EventPayload.WorkStatusChanged(WorkStatus.WORKING, "turn-2", 2));

        JsonNode json = mapper.readTree(codec.encode(event));

        assertEquals(7, json.get("revision").asLong());
        assertEquals("s-1", json.get("sessionId").asText());
        assertEquals("2026-03-01T10:00:00.123Z", json.get("timestamp").asText());
        assertEquals("work_status_changed", json.get("payload").get("type").asText());
        assertEquals("WORKING", json.get("payload").get("workStatus").asText());
    }

    @Test
    void omitsAbsentFields() throws JsonProcessingException {
        Message message = Message.user("m-1", "s-1", "hello", T0);
        SessionEvent event = new SessionEvent(1, "s-1", T0, new EventPayload.MessageAppended(message));

        JsonNode payload = mapper.readTree(codec.encode(event)).get("payload");

        assertFalse(payload.get("message").has("toolName"));
        assertEquals("USER", payload.get("message").get("type").asText());
    }

    @Test
    void decodesWhatItEncodes() throws JsonProcessingException {
        Message tool = new Message("t-1", "s-1", MessageType.TOOL, "", "bash", "ls -la", "a\nb",
                false, T0, 31L);
        ApprovalRequest request = new ApprovalRequest("req-1", "s-1", ApprovalType.EXEC, "rm -rf /tmp/x",
                null, null, null, List.of("rm", "-rf"));

        for (EventPayload payload : List.of(
                new EventPayload.MessageAppended(tool),
                new EventPayload.ApprovalRequested(request),
                new EventPayload.SessionResumed())) {
            SessionEvent event = new SessionEvent(3, "s-1", T0, payload);
            assertEquals(event, codec.decode(codec.encode(event)));
        }
    }

    @Test
    void ignoresUnknownProperties() throws JsonProcessingException {
        String json = "{\"revision\":4,\"sessionId\":\"s-1\",\"timestamp\":\"2026-03-01T10:00:00.123Z\","
                + "\"payload\":{\"type\":\"plan_updated\",\"plan\":\"step 1\",\"extra\":true},\"origin\":\"x\"}";

        SessionEvent event = codec.decode(json);

        assertEquals(new EventPayload.PlanUpdated("step 1"), event.payload());
        assertEquals(4, event.revision());
    }
}
