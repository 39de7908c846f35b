package com.flagship.complaint_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Parses change events from the feed topic.
 *
 * Accepted envelopes:
 * - {"operation": "INSERT", "table": "complaints", "before": {...}, "after": {...}}
 * - Debezium: {"op": "c|r|u|d", "source": {"table": ...}, "before": {...}, "after": {...}},
 *   optionally wrapped in {"schema": ..., "payload": {...}}
 * - Supabase realtime: {"eventType": "UPDATE", "table": ..., "old": {...}, "new": {...}}
 *
 * Unknown fields are ignored. Malformed events are logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChangeEventParser {

    private final ObjectMapper objectMapper;

    public Optional<ChangeEvent> parse(String json) {
        if (json == null || json.isBlank()) {
            log.warn("Empty change event, skipping");
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Malformed change event: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject()) {
            log.warn("Change event is not a JSON object, skipping");
            return Optional.empty();
        }

        if (!root.has("op") && root.path("payload").isObject()) {
            root = root.get("payload");
        }

        ChangeOperation operation = parseOperation(root);
        if (operation == null) {
            log.warn("Change event without a recognizable operation, skipping");
            return Optional.empty();
        }

        return Optional.of(new ChangeEvent(
            operation,
            parseTable(root),
            parseRecord(firstObject(root, "before", "old")),
            parseRecord(firstObject(root, "after", "new", "record"))
        ));
    }

    private ChangeOperation parseOperation(JsonNode root) {
        String named = firstText(root, "operation", "eventType", "type");
        if (named != null) {
            switch (named.trim().toUpperCase(Locale.ROOT)) {
                case "INSERT":
                case "CREATE":
                    return ChangeOperation.INSERT;
                case "UPDATE":
                    return ChangeOperation.UPDATE;
                case "DELETE":
                    return ChangeOperation.DELETE;
                default:
                    log.debug("Unknown operation name '{}'", named);
                    return null;
            }
        }

        String op = text(root, "op");
        if (op == null) {
            return null;
        }
        switch (op) {
            case "c":
            case "r":
                return ChangeOperation.INSERT;
            case "u":
                return ChangeOperation.UPDATE;
            case "d":
                return ChangeOperation.DELETE;
            default:
                log.debug("Unknown Debezium op '{}'", op);
                return null;
        }
    }

    private String parseTable(JsonNode root) {
        String table = text(root, "table");
        return table != null ? table : text(root.path("source"), "table");
    }

    private ComplaintRecord parseRecord(JsonNode node) {
        if (node == null) {
            return null;
        }
        return ComplaintRecord.builder()
            .id(parseId(node.get("id")))
            .status(text(node, "status"))
            .city(firstText(node, "municipal_id", "city"))
            .locationAddress(text(node, "locationAB"))
            .category(firstText(node, "category_id", "category"))
            .ledgerReceipt(text(node, "tx_hash"))
            .build();
    }

    private Long parseId(JsonNode idNode) {
        if (idNode == null || idNode.isNull()) {
            return null;
        }
        if (idNode.canConvertToLong() && idNode.isIntegralNumber()) {
            return idNode.asLong();
        }
        if (idNode.isTextual()) {
            try {
                return Long.parseLong(idNode.asText().trim());
            } catch (NumberFormatException e) {
                log.warn("Non-numeric complaint id '{}'", idNode.asText());
            }
        }
        return null;
    }

    private static JsonNode firstObject(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isObject()) {
                return value;
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }
}
