package com.pathway.ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.util.PGobject;

import java.sql.SQLException;
import java.util.List;

/**
 * Column conversions for the assignment table: child id lists as JSONB, bounded name columns.
 */
public final class AssignmentSqlMapper {

    public static final int NAME_MAX_LEN = 255;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};

    private AssignmentSqlMapper() {}

    /** Truncate to max length for name columns; null stays null. */
    public static String toName(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.length() > NAME_MAX_LEN ? t.substring(0, NAME_MAX_LEN) : t;
    }

    public static String childIdsToJson(List<String> ids) {
        try {
            return MAPPER.writeValueAsString(ids != null ? ids : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode child ids " + ids, e);
        }
    }

    /** Decodes a JSON array of ids; null or blank reads as empty. */
    public static List<String> childIdsFromJson(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return List.copyOf(MAPPER.readValue(json, ID_LIST));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed child id column: " + json, e);
        }
    }

    /** Wraps a JSON string as PG jsonb for a single placeholder. */
    public static PGobject toJsonb(String json) throws SQLException {
        PGobject o = new PGobject();
        o.setType("jsonb");
        o.setValue(json != null ? json : "[]");
        return o;
    }
}
