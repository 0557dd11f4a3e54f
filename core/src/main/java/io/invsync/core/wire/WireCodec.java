package io.invsync.core.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invsync.core.Document;
import io.invsync.core.DocumentEvent;
import io.invsync.core.DocumentRef;
import io.invsync.core.FieldValue;
import io.invsync.core.Fields;
import io.invsync.core.WriteOp;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between document values and their JSON wire form.
 * <p>
 * Encoding:
 *  - String, integer and null map to JSON scalars.
 *  - Timestamps map to {"$timestamp": "ISO-8601"}.
 *  - The server-timestamp sentinel maps to {"$serverTimestamp": true}.
 * <p>
 * Decoding works on the plain Java objects Jackson produces for untyped JSON
 * (String, Integer/Long, Map, null). Fractional numbers, booleans and arrays
 * are rejected.
 */
public final class WireCodec {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    static final String TIMESTAMP_KEY = "$timestamp";
    static final String SERVER_TIMESTAMP_KEY = "$serverTimestamp";

    private WireCodec() {
        // utility
    }

    // ---------- values ----------

    public static Object encodeValue(Object value) {
        if (value instanceof Instant t) {
            return Map.of(TIMESTAMP_KEY, t.toString());
        }
        if (value == FieldValue.SERVER_TIMESTAMP) {
            return Map.of(SERVER_TIMESTAMP_KEY, true);
        }
        return Fields.normalize(value, false);
    }

    public static Object decodeValue(Object raw, boolean allowSentinel) {
        if (raw == null || raw instanceof String) {
            return raw;
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Map<?, ?> m && m.size() == 1) {
            if (m.get(TIMESTAMP_KEY) instanceof String iso) {
                try {
                    return Instant.parse(iso);
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("invalid timestamp: " + iso, e);
                }
            }
            if (allowSentinel && Boolean.TRUE.equals(m.get(SERVER_TIMESTAMP_KEY))) {
                return FieldValue.SERVER_TIMESTAMP;
            }
        }
        throw new IllegalArgumentException("unsupported wire value: " + raw);
    }

    public static Map<String, Object> encodeFields(Map<String, Object> fields) {
        Map<String, Object> out = new LinkedHashMap<>();
        fields.forEach((k, v) -> out.put(k, encodeValue(v)));
        return out;
    }

    public static Map<String, Object> decodeFields(Map<String, Object> raw, boolean allowSentinel) {
        if (raw == null) {
            return Map.of();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> out.put(k, decodeValue(v, allowSentinel)));
        return out;
    }

    /** Cursor values travel as a JSON document in a query parameter. */
    public static String encodeCursorValue(Object value) {
        try {
            return MAPPER.writeValueAsString(encodeValue(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cannot encode cursor value " + value, e);
        }
    }

    public static Object decodeCursorValue(String json) {
        try {
            return decodeValue(MAPPER.readValue(json, Object.class), false);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid cursor value: " + json, e);
        }
    }

    // ---------- documents ----------

    public static DocumentResponse toResponse(Document doc) {
        var dto = new DocumentResponse();
        dto.path = doc.ref().path();
        dto.exists = true;
        dto.updateTime = doc.updateTime().toString();
        dto.fields = encodeFields(doc.fields());
        return dto;
    }

    public static DocumentResponse missing(DocumentRef ref) {
        var dto = new DocumentResponse();
        dto.path = ref.path();
        dto.exists = false;
        dto.fields = Map.of();
        return dto;
    }

    /** Decode an existing document; callers must check {@code dto.exists} first. */
    public static Document fromResponse(DocumentResponse dto) {
        if (!dto.exists) {
            throw new IllegalArgumentException("document does not exist: " + dto.path);
        }
        return new Document(
                DocumentRef.parse(dto.path),
                decodeFields(dto.fields, false),
                Instant.parse(dto.updateTime)
        );
    }

    public static DocumentEvent toEvent(DocumentResponse dto) {
        return dto.exists
                ? DocumentEvent.of(fromResponse(dto))
                : DocumentEvent.missing(DocumentRef.parse(dto.path));
    }

    // ---------- writes ----------

    public static CommitRequest toRequest(List<WriteOp> writes, String opId) {
        var req = new CommitRequest();
        req.opId = opId;
        req.writes = new ArrayList<>(writes.size());
        for (WriteOp op : writes) {
            var w = new CommitRequest.WriteRequest();
            w.path = op.ref().path();
            if (op instanceof WriteOp.Set set) {
                w.op = "set";
                w.fields = encodeFields(set.fields());
                w.merge = set.merge();
            } else {
                w.op = "delete";
            }
            req.writes.add(w);
        }
        return req;
    }

    public static List<WriteOp> fromRequest(CommitRequest req) {
        if (req.writes == null) {
            throw new IllegalArgumentException("writes must not be null");
        }
        List<WriteOp> out = new ArrayList<>(req.writes.size());
        for (CommitRequest.WriteRequest w : req.writes) {
            if (w == null || w.path == null || w.op == null) {
                throw new IllegalArgumentException("write requires op and path");
            }
            DocumentRef ref = DocumentRef.parse(w.path);
            switch (w.op) {
                case "set" -> out.add(new WriteOp.Set(ref, decodeFields(w.fields, true), w.merge));
                case "delete" -> out.add(WriteOp.delete(ref));
                default -> throw new IllegalArgumentException("unknown write op: " + w.op);
            }
        }
        return out;
    }
}
