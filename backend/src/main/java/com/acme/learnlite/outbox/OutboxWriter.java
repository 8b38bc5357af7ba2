package com.acme.learnlite.outbox;

import com.acme.learnlite.db.SqlClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Appends domain events to outbox_events. Callers run it inside their own
 * transaction so the event commits or rolls back with the change it describes.
 */
@Component
public class OutboxWriter {
    private static final Logger log = LoggerFactory.getLogger(OutboxWriter.class);

    private final SqlClient sql;
    private final ObjectMapper objectMapper;

    public OutboxWriter(SqlClient sql, ObjectMapper objectMapper) {
        this.sql = sql;
        this.objectMapper = objectMapper;
    }

    public void write(String eventType, Map<String, ?> payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize outbox payload for " + eventType, e);
        }
        sql.query("INSERT INTO outbox_events (event_type, payload) VALUES (?, ?)", List.of(eventType, json));
        log.debug("outbox event queued type={}", eventType);
    }
}
