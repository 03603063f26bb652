package org.eventsourcing.migrations.snapshot.pipeline.source;

import reactor.core.publisher.Flux;

/**
 * Port for listing the persistence ids known to the journal.
 */
public interface EntityEnumerator {

    /**
     * Stream distinct persistence ids, at most {@code limit} of them.
     * Returns a cold Flux; every subscription runs the query again.
     */
    Flux<String> enumerate(long limit);

    default Flux<String> enumerateAll() {
        return enumerate(Long.MAX_VALUE);
    }
}
