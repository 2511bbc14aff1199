package com.questrail.agentsession.internal.log;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.questrail.agentsession.internal.effects.SessionEvent;

import java.util.Objects;

/**
 * SessionEventCodec
 * =============================================================================
 * JSON form of {@link SessionEvent}s, as stored in the event log and sent to
 * viewers.
 *
 * <p>Timestamps are written as ISO-8601 strings, absent optional fields are
 * omitted, and payloads carry a {@code type} discriminator. Unknown
 * properties are ignored on decode so older viewers can read newer events.</p>
 *
 * <p>Instances are thread-safe once constructed.</p>
 */
public final class SessionEventCodec
{
    private final ObjectMapper mapper;

    public SessionEventCodec() {
        this(defaultMapper());
    }

    public SessionEventCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public String encode(SessionEvent event) throws JsonProcessingException {
        Objects.requireNonNull(event, "event");
        return mapper.writeValueAsString(event);
    }

    public SessionEvent decode(String json) throws JsonProcessingException {
        Objects.requireNonNull(json, "json");
        return mapper.readValue(json, SessionEvent.class);
    }
}
