package com.acme.learnlite.outbox;

import com.acme.learnlite.db.QueryResult;
import com.acme.learnlite.db.SqlClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OutboxWriterTest {

    @Test
    void serializesPayloadAsJson() {
        SqlClient sql = mock(SqlClient.class);
        when(sql.query(anyString(), anyList())).thenReturn(QueryResult.updated(1));
        OutboxWriter writer = new OutboxWriter(sql, new ObjectMapper());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("enrollmentId", 9L);
        payload.put("courseId", 1L);
        writer.write("enrollment.created", payload);

        verify(sql).query("INSERT INTO outbox_events (event_type, payload) VALUES (?, ?)",
                List.of("enrollment.created", "{\"enrollmentId\":9,\"courseId\":1}"));
    }
}
