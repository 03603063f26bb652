package org.eventsourcing.migrations.snapshot.pipeline.codec;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.eventsourcing.migrations.snapshot.pipeline.error.DeserializationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Immutable lookup table from (serializer id, manifest) to the serializer that decodes it.
 *
 * A serializer registered for a specific manifest takes precedence over one registered for
 * any manifest under the same id. Rows without a serializer id resolve to the default id.
 */
@Slf4j
public final class SerializerRegistry {

    private final Map<Integer, SnapshotSerializer<?>> anyManifest;
    private final Map<ManifestKey, SnapshotSerializer<?>> byManifest;
    private final int defaultSerializerId;

    private SerializerRegistry(Builder builder) {
        this.anyManifest = Map.copyOf(builder.anyManifest);
        this.byManifest = Map.copyOf(builder.byManifest);
        this.defaultSerializerId = builder.defaultSerializerId;
    }

    /**
     * Raw bytes, UTF-8 text and JSON trees, defaulting to raw bytes.
     */
    public static SerializerRegistry defaults() {
        return builder()
            .register(new ByteArraySnapshotSerializer())
            .register(new StringSnapshotSerializer())
            .register(JsonSnapshotSerializer.tree())
            .defaultSerializerId(ByteArraySnapshotSerializer.IDENTIFIER)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param serializerId stored serializer id, or null to use the default
     * @param manifest stored manifest, null is treated as empty
     * @throws DeserializationException if nothing is registered for the pair
     */
    public SnapshotSerializer<?> resolve(Integer serializerId, String manifest) {
        int id = serializerId != null ? serializerId : defaultSerializerId;
        String effectiveManifest = manifest != null ? manifest : "";

        var exact = byManifest.get(new ManifestKey(id, effectiveManifest));
        if (exact != null) {
            return exact;
        }
        var fallback = anyManifest.get(id);
        if (fallback != null) {
            return fallback;
        }
        throw new DeserializationException(
            "No serializer registered for id " + id + " and manifest '" + effectiveManifest + "'");
    }

    public int getDefaultSerializerId() {
        return defaultSerializerId;
    }

    public Set<Integer> registeredIds() {
        var ids = new TreeSet<>(anyManifest.keySet());
        byManifest.keySet().forEach(key -> ids.add(key.serializerId()));
        return ids;
    }

    private record ManifestKey(int serializerId, String manifest) {}

    public static final class Builder {
        private final Map<Integer, SnapshotSerializer<?>> anyManifest = new HashMap<>();
        private final Map<ManifestKey, SnapshotSerializer<?>> byManifest = new HashMap<>();
        private int defaultSerializerId = ByteArraySnapshotSerializer.IDENTIFIER;

        private Builder() {}

        /** Register a serializer for every manifest stored under its id. */
        public Builder register(SnapshotSerializer<?> serializer) {
            var previous = anyManifest.putIfAbsent(serializer.identifier(), serializer);
            if (previous != null) {
                throw new IllegalArgumentException("Serializer id " + serializer.identifier()
                    + " is already registered to " + previous.getClass().getName());
            }
            return this;
        }

        /** Register a serializer for one manifest only. */
        public Builder register(String manifest, SnapshotSerializer<?> serializer) {
            var key = new ManifestKey(serializer.identifier(), manifest != null ? manifest : "");
            var previous = byManifest.putIfAbsent(key, serializer);
            if (previous != null) {
                throw new IllegalArgumentException("Serializer id " + key.serializerId()
                    + " with manifest '" + key.manifest() + "' is already registered");
            }
            return this;
        }

        public Builder defaultSerializerId(int serializerId) {
            this.defaultSerializerId = serializerId;
            return this;
        }

        public SerializerRegistry build() {
            var registry = new SerializerRegistry(this);
            log.atDebug().setMessage("Built serializer registry with ids {}, default {}")
                .addArgument(registry::registeredIds)
                .addArgument(defaultSerializerId)
                .log();
            return registry;
        }
    }
}
