package org.eventsourcing.migrations.snapshot;

import org.eventsourcing.migrations.snapshot.pipeline.codec.ByteArraySnapshotSerializer;
import org.eventsourcing.migrations.snapshot.pipeline.codec.JsonSnapshotSerializer;
import org.eventsourcing.migrations.snapshot.pipeline.codec.SerializerRegistry;
import org.eventsourcing.migrations.snapshot.pipeline.codec.StringSnapshotSerializer;

/**
 * Builds the serializer registry once at startup: the built-in serializers plus the typed JSON
 * serializers named in the configuration.
 */
final class SerializerRegistryFactory {
    private SerializerRegistryFactory() {}

    static SerializerRegistry create(MigrationConfig config) {
        var builder = SerializerRegistry.builder()
            .register(new ByteArraySnapshotSerializer())
            .register(new StringSnapshotSerializer())
            .register(JsonSnapshotSerializer.tree())
            .defaultSerializerId(config.getDefaultSerializerId());
        try {
            for (var json : config.getJsonSerializers()) {
                var serializer = JsonSnapshotSerializer.typed(json.getIdentifier(), loadClass(json.getType()),
                    json.getManifest());
                if (json.getManifest() == null || json.getManifest().isEmpty()) {
                    builder.register(serializer);
                } else {
                    builder.register(json.getManifest(), serializer);
                }
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(e.getMessage(), e);
        }
    }

    private static Class<?> loadClass(String name) {
        try {
            return Class.forName(name, false, Thread.currentThread().getContextClassLoader());
        } catch (ClassNotFoundException e) {
            throw new InvalidConfigurationException("JSON snapshot type " + name + " is not on the classpath", e);
        }
    }
}
