package org.eventsourcing.migrations.snapshot.pipeline.codec;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import org.eventsourcing.migrations.snapshot.pipeline.error.DeserializationException;

/**
 * JSON payloads, either as a raw tree ({@link #tree()}) or bound to a class registered under a
 * specific manifest ({@link #typed(int, Class, String)}).
 */
public class JsonSnapshotSerializer<T> implements SnapshotSerializer<T> {
    public static final int DEFAULT_IDENTIFIER = 30;

    // Decimals stay BigDecimal with their scale so a re-encoded payload keeps its exact digits
    private static final ObjectMapper objectMapper = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES)
        .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
        .build();

    private final int identifier;
    private final Class<T> type;
    private final String manifest;

    public JsonSnapshotSerializer(int identifier, Class<T> type, String manifest) {
        this.identifier = identifier;
        this.type = type;
        this.manifest = manifest != null ? manifest : "";
    }

    public static JsonSnapshotSerializer<JsonNode> tree() {
        return new JsonSnapshotSerializer<>(DEFAULT_IDENTIFIER, JsonNode.class, "");
    }

    public static <T> JsonSnapshotSerializer<T> typed(int identifier, Class<T> type, String manifest) {
        return new JsonSnapshotSerializer<>(identifier, type, manifest);
    }

    @Override
    public int identifier() {
        return identifier;
    }

    @Override
    public T fromBinary(byte[] bytes, String manifest) {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new DeserializationException("Payload is not valid JSON", e);
        }
        if (tree == null || tree.isMissingNode()) {
            throw new DeserializationException("Payload is empty, expected a JSON document");
        }
        try {
            return objectMapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DeserializationException("JSON payload cannot be read as " + type.getName(), e);
        }
    }

    @Override
    public byte[] toBinary(T value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot write " + type.getName() + " as JSON", e);
        }
    }

    @Override
    public String manifest(T value) {
        return manifest;
    }
}
