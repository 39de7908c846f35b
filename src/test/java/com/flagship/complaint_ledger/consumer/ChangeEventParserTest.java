package com.flagship.complaint_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Phase 4 Tests: Change event parsing
 */
class ChangeEventParserTest {

    private ChangeEventParser parser;

    @BeforeEach
    void setUp() {
        parser = new ChangeEventParser(new ObjectMapper());
    }

    @Test
    @DisplayName("Canonical INSERT event is parsed with its record projection")
    void testCanonicalInsert() {
        String json = """
            {"operation": "INSERT", "table": "complaints",
             "after": {"id": 7, "status": "pending", "municipal_id": "Springfield",
                       "locationAB": "12 Main St", "category_id": "Roads", "title": "Pothole"}}
            """;

        ChangeEvent event = parser.parse(json).orElseThrow();

        assertEquals(ChangeOperation.INSERT, event.getOperation());
        assertEquals("complaints", event.getTable());
        assertNull(event.getBefore());

        ComplaintRecord after = event.getAfter();
        assertEquals(7L, after.getId());
        assertEquals("pending", after.getStatus());
        assertEquals("Springfield", after.getCity());
        assertEquals("12 Main St", after.getLocationAddress());
        assertEquals("Roads", after.getCategory());
        assertFalse(after.hasReceipt());
    }

    @Test
    @DisplayName("Debezium update with schema envelope is unwrapped")
    void testDebeziumUpdate() {
        String json = """
            {"schema": {"type": "struct"},
             "payload": {"op": "u", "source": {"table": "complaints", "db": "civic"},
                         "before": {"id": 7, "status": "pending"},
                         "after": {"id": 7, "status": "resolved", "tx_hash": "0xabc", "category_id": 3}}}
            """;

        ChangeEvent event = parser.parse(json).orElseThrow();

        assertEquals(ChangeOperation.UPDATE, event.getOperation());
        assertEquals("complaints", event.getTable());
        assertEquals("pending", event.getBefore().getStatus());
        assertEquals("resolved", event.getAfter().getStatus());
        assertEquals("0xabc", event.getAfter().getLedgerReceipt());
        assertEquals("3", event.getAfter().getCategory());
    }

    @Test
    @DisplayName("Supabase realtime event uses old/new and string ids")
    void testSupabaseShape() {
        String json = """
            {"eventType": "UPDATE", "schema": "public", "table": "complaints",
             "old": {"id": "7"}, "new": {"id": "7", "status": "verified", "city": "Shelbyville"}}
            """;

        ChangeEvent event = parser.parse(json).orElseThrow();

        assertEquals(ChangeOperation.UPDATE, event.getOperation());
        assertEquals(7L, event.getAfter().getId());
        assertNull(event.getBefore().getStatus());
        assertEquals("Shelbyville", event.getAfter().getCity());
    }

    @Test
    @DisplayName("Debezium ops c, r and d map to INSERT, INSERT and DELETE")
    void testDebeziumOps() {
        assertEquals(ChangeOperation.INSERT,
            parser.parse("{\"op\":\"c\",\"after\":{\"id\":1}}").orElseThrow().getOperation());
        assertEquals(ChangeOperation.INSERT,
            parser.parse("{\"op\":\"r\",\"after\":{\"id\":1}}").orElseThrow().getOperation());
        ChangeEvent delete = parser.parse("{\"op\":\"d\",\"before\":{\"id\":1}}").orElseThrow();
        assertEquals(ChangeOperation.DELETE, delete.getOperation());
        assertEquals(1L, delete.complaintId());
    }

    @Test
    @DisplayName("Malformed, empty and operation-less events are skipped")
    void testInvalidEventsSkipped() {
        assertEquals(Optional.empty(), parser.parse("{not json"));
        assertEquals(Optional.empty(), parser.parse(""));
        assertEquals(Optional.empty(), parser.parse(null));
        assertEquals(Optional.empty(), parser.parse("[1, 2]"));
        assertEquals(Optional.empty(), parser.parse("{\"table\": \"complaints\", \"after\": {\"id\": 1}}"));
        assertEquals(Optional.empty(), parser.parse("{\"operation\": \"TRUNCATE\"}"));
    }

    @Test
    @DisplayName("Non-numeric id leaves the record without an id")
    void testNonNumericId() {
        ChangeEvent event = parser.parse("{\"operation\":\"INSERT\",\"after\":{\"id\":\"abc\"}}").orElseThrow();

        assertNull(event.getAfter().getId());
    }
}
