package org.eventsourcing.migrations.snapshot;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Binds JSON payloads stored under a serializer id and manifest to a class on the classpath.
 */
@Value
@Builder
@Jacksonized
public class JsonSerializerConfig {
    int identifier;
    /** Empty or absent registers the class for every manifest of the id. */
    String manifest;
    /** Fully qualified class name. */
    String type;
}
