package com.browserpilot.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON form of {@link SessionRecord}s.
 */
public final class SessionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SessionJson() {}

    public static String write(SessionRecord record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new TaskStateStoreException("Failed to serialize session "
                    + record.continuation().sessionId(), e);
        }
    }

    public static SessionRecord read(String json) {
        try {
            return MAPPER.readValue(json, SessionRecord.class);
        } catch (JsonProcessingException e) {
            throw new TaskStateStoreException("Failed to deserialize session record", e);
        }
    }
}
