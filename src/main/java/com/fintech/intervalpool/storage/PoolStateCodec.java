package com.fintech.intervalpool.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for {@link PoolState}.
 *
 * Timestamps are written as ISO-8601 strings with their original offset.
 * Decoding rejects anything that is not a version-1 single-subject layout.
 */
public final class PoolStateCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        MAPPER.registerModule(new JavaTimeModule());
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // keep the source offset instead of normalizing to UTC
        MAPPER.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private PoolStateCodec() {
        // Utility
    }

    public static String encode(PoolState state) {
        try {
            return MAPPER.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize pool state for subject " + state.subjectId(), e);
        }
    }

    /**
     * Parses persisted state.
     *
     * @throws CorruptStateException if the JSON is malformed or not the current layout
     */
    public static PoolState decode(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CorruptStateException("Pool state is not valid JSON", e);
        }

        if (root == null || !root.isObject()) {
            throw new CorruptStateException("Pool state is not a JSON object");
        }
        if (root.has("subjects") || root.has("homes")) {
            throw new CorruptStateException("Pool state uses the old multi-subject layout");
        }
        if (!root.hasNonNull("subjectId") || !root.has("fetchGroups") || !root.get("fetchGroups").isArray()) {
            throw new CorruptStateException("Pool state is missing subjectId or fetchGroups");
        }
        int version = root.path("version").asInt(-1);
        if (version != PoolState.CURRENT_VERSION) {
            throw new CorruptStateException("Unsupported pool state version: " + version);
        }

        try {
            return MAPPER.treeToValue(root, PoolState.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptStateException("Pool state has malformed fetch groups", e);
        }
    }
}
