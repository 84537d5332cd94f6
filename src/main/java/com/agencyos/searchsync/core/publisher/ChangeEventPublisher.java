package com.agencyos.searchsync.core.publisher;

import com.agencyos.searchsync.core.collection.CollectionClassifier;
import com.agencyos.searchsync.core.connection.ConnectionManager;
import com.agencyos.searchsync.core.model.ChangeNotification;
import com.agencyos.searchsync.core.model.ClassificationResult;
import com.agencyos.searchsync.core.model.PublishResult;
import com.agencyos.searchsync.core.model.PublishStatus;
import com.agencyos.searchsync.core.model.StreamEntry;
import com.agencyos.searchsync.core.stream.StreamChannel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns committed CMS changes into search sync stream entries.
 *
 * <h2>Flow</h2>
 * <pre>
 * handle(notification)
 *   ├─ no record ids            -&gt; SKIPPED_EMPTY
 *   ├─ collection not relevant  -&gt; SKIPPED_NOT_RELEVANT
 *   ├─ connection not CONNECTED -&gt; SKIPPED_UNAVAILABLE
 *   └─ one append per id, in order -&gt; PUBLISHED | PARTIALLY_PUBLISHED | FAILED
 * </pre>
 *
 * <h2>Failure contract</h2>
 * The host transaction has already committed when a notification arrives, so nothing here may fail it:
 * <ul>
 *   <li>The returned {@link Mono} never errors.</li>
 *   <li>A failed or timed-out append is logged and dropped; the remaining ids are still appended.</li>
 *   <li>There is no retry and no buffering. Delivery is best-effort.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * Calls for different notifications may run concurrently and interleave on the stream. Within one call
 * entries are appended sequentially in {@code recordIds} order. The publisher only reads the
 * connection state; it never changes it.
 */
public class ChangeEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(ChangeEventPublisher.class);

    public static final String METRIC_ENTRIES = "searchsync.entries";
    public static final String METRIC_NOTIFICATIONS = "searchsync.notifications";

    private final CollectionClassifier classifier;
    private final ConnectionManager connection;
    private final Clock clock;
    private final Duration appendTimeout;

    private final Counter entriesAppended;
    private final Counter entriesFailed;
    private final Map<PublishStatus, Counter> notifications = new EnumMap<>(PublishStatus.class);

    public ChangeEventPublisher(CollectionClassifier classifier,
                                ConnectionManager connection,
                                Clock clock,
                                Duration appendTimeout,
                                MeterRegistry meterRegistry) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.connection = Objects.requireNonNull(connection, "connection");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.appendTimeout = Objects.requireNonNull(appendTimeout, "appendTimeout");

        this.entriesAppended = Counter.builder(METRIC_ENTRIES)
                .description("Stream entries appended")
                .tag("outcome", "appended")
                .register(meterRegistry);
        this.entriesFailed = Counter.builder(METRIC_ENTRIES)
                .description("Stream entries dropped after an append failure")
                .tag("outcome", "failed")
                .register(meterRegistry);
        for (PublishStatus status : PublishStatus.values()) {
            if (status == PublishStatus.DISABLED) {
                continue;
            }
            notifications.put(status, Counter.builder(METRIC_NOTIFICATIONS)
                    .description("Change notifications handled, by outcome")
                    .tag("status", status.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
    }

    /**
     * Publishes one stream entry per record id of a qualifying notification.
     *
     * @return the outcome; never an error signal
     */
    public Mono<PublishResult> handle(ChangeNotification notification) {
        return Mono.defer(() -> dispatch(notification))
                .onErrorResume(err -> {
                    // Only reachable through a bug in this class or a misbehaving channel.
                    log.error("Search sync: unexpected error handling notification collection={} err={}",
                            notification == null ? null : notification.sourceName(), err.toString(), err);
                    int ids = notification == null ? 0 : notification.recordIds().size();
                    return Mono.just(PublishResult.attempted(List.of(), Math.max(ids, 1)));
                })
                .doOnNext(this::record);
    }

    private Mono<PublishResult> dispatch(ChangeNotification notification) {
        if (notification == null || notification.recordIds().isEmpty()) {
            return Mono.just(PublishResult.skipped(PublishStatus.SKIPPED_EMPTY));
        }

        ClassificationResult classification = classifier.classify(notification.sourceName());
        if (!classification.relevant()) {
            return Mono.just(PublishResult.skipped(PublishStatus.SKIPPED_NOT_RELEVANT));
        }

        // The connection manager already logged the transition that made it unavailable.
        Optional<StreamChannel> channel = connection.availableChannel();
        if (channel.isEmpty()) {
            return Mono.just(PublishResult.skipped(PublishStatus.SKIPPED_UNAVAILABLE));
        }

        StreamChannel ch = channel.get();
        return Flux.fromIterable(notification.recordIds())
                .concatMap(id -> appendOne(ch, notification, classification, id))
                .collectList()
                .map(outcomes -> summarize(notification, outcomes));
    }

    private Mono<Optional<String>> appendOne(StreamChannel ch, ChangeNotification notification,
                                             ClassificationResult classification, String recordId) {
        return Mono.defer(() -> {
                    // Timestamp taken per entry, at append time.
                    StreamEntry entry = StreamEntry.of(notification, classification, recordId, clock.millis());
                    return ch.append(entry);
                })
                .timeout(appendTimeout)
                .map(Optional::of)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("store returned no entry id")))
                .onErrorResume(err -> {
                    log.error("Search sync: failed to append entry collection={} id={} action={} err={}",
                            notification.sourceName(), recordId, notification.action().wireValue(), err.toString());
                    return Mono.just(Optional.<String>empty());
                });
    }

    private PublishResult summarize(ChangeNotification notification, List<Optional<String>> outcomes) {
        List<String> ids = new ArrayList<>(outcomes.size());
        int failed = 0;
        for (Optional<String> o : outcomes) {
            if (o.isPresent()) {
                ids.add(o.get());
            } else {
                failed++;
            }
        }
        PublishResult result = PublishResult.attempted(ids, failed);
        log.debug("Search sync: published {} {} events for {} (failed={})",
                ids.size(), notification.action().wireValue(), notification.sourceName(), failed);
        return result;
    }

    private void record(PublishResult result) {
        entriesAppended.increment(result.appended());
        entriesFailed.increment(result.failed());
        Counter c = notifications.get(result.status());
        if (c != null) {
            c.increment();
        }
    }

    public CollectionClassifier classifier() {
        return classifier;
    }

    public ConnectionManager connection() {
        return connection;
    }
}
