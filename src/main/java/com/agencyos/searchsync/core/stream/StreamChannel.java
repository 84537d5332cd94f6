package com.agencyos.searchsync.core.stream;

import com.agencyos.searchsync.core.model.StreamEntry;
import reactor.core.publisher.Mono;

/**
 * A live connection to the streaming store, produced by a {@link StreamConnector}.
 *
 * <p>Implementations must be thread-safe: concurrent {@code handle()} calls append through the same
 * channel.</p>
 */
public interface StreamChannel extends AutoCloseable {

    /**
     * Appends one entry to the configured stream.
     *
     * @return a Mono emitting the entry id assigned by the store, or an error if the append failed
     */
    Mono<String> append(StreamEntry entry);

    /**
     * Closes the underlying connection. Must not invoke the connection-lost callback and must not throw.
     */
    @Override
    void close();
}
