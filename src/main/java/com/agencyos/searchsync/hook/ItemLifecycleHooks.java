package com.agencyos.searchsync.hook;

import com.agencyos.searchsync.config.EndpointResolver;
import com.agencyos.searchsync.core.model.ChangeNotification;
import com.agencyos.searchsync.core.model.PublishResult;
import com.agencyos.searchsync.core.model.PublishStatus;
import com.agencyos.searchsync.core.publisher.ChangeEventPublisher;
import com.agencyos.searchsync.core.stream.StreamEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry points the host CMS calls after a create, update or delete has committed.
 *
 * <p>Create and update map to {@code upsert}, delete maps to {@code delete}. Every method returns a
 * {@link Mono} that never errors; callers that do not care about the outcome may just subscribe.
 * When no endpoint is configured all calls return {@link PublishStatus#DISABLED} and nothing is
 * classified.</p>
 */
@Component
public class ItemLifecycleHooks {

    private static final Logger log = LoggerFactory.getLogger(ItemLifecycleHooks.class);

    private static final PublishResult DISABLED = PublishResult.skipped(PublishStatus.DISABLED);

    private final ChangeEventPublisher publisher;

    public ItemLifecycleHooks(ObjectProvider<ChangeEventPublisher> publisher, Environment env) {
        this.publisher = publisher.getIfAvailable();
        if (this.publisher == null) {
            reportInert(env);
        }
    }

    public boolean isEnabled() {
        return publisher != null;
    }

    public Mono<PublishResult> onItemCreated(String collection, Object key) {
        return publish(ChangeNotification.upsert(collection, key == null ? List.of() : List.of(String.valueOf(key))));
    }

    public Mono<PublishResult> onItemsUpdated(String collection, List<?> keys) {
        return publish(ChangeNotification.upsert(collection, stringify(keys)));
    }

    public Mono<PublishResult> onItemsDeleted(String collection, List<?> keys) {
        return publish(ChangeNotification.delete(collection, stringify(keys)));
    }

    /**
     * Fire-and-forget bridge for hosts that publish {@link ItemActionEvent}s.
     */
    @EventListener
    public void onItemAction(ItemActionEvent event) {
        Mono<PublishResult> result = switch (event.kind()) {
            case CREATE, UPDATE -> onItemsUpdated(event.collection(), event.keys());
            case DELETE -> onItemsDeleted(event.collection(), event.keys());
        };
        result.subscribe(
                r -> log.trace("Search sync: event {} on {} -> {}", event.kind(), event.collection(), r.status()),
                err -> log.error("Search sync: event {} on {} failed err={}", event.kind(), event.collection(), err.toString()));
    }

    private Mono<PublishResult> publish(ChangeNotification notification) {
        if (publisher == null) {
            return Mono.just(DISABLED);
        }
        return publisher.handle(notification);
    }

    private static List<String> stringify(List<?> keys) {
        if (keys == null) {
            return List.of();
        }
        List<String> out = new ArrayList<>(keys.size());
        for (Object k : keys) {
            out.add(String.valueOf(k));
        }
        return out;
    }

    private static void reportInert(Environment env) {
        EndpointResolver.resolve(env).ifPresentOrElse(r -> {
            try {
                StreamEndpoint.parse(r.url());
                log.warn("Search sync: endpoint from {} is configured but no publisher is available, "
                        + "change publishing disabled", r.key());
            } catch (IllegalArgumentException e) {
                log.warn("Search sync: endpoint from {} is not usable ({}), change publishing disabled",
                        r.key(), e.getMessage());
            }
        }, () -> EndpointResolver.logMissing(env));
    }
}
