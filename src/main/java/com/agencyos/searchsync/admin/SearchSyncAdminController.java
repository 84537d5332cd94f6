package com.agencyos.searchsync.admin;

import com.agencyos.searchsync.config.SearchSyncProperties;
import com.agencyos.searchsync.core.collection.CollectionClassifier;
import com.agencyos.searchsync.core.model.ChangeAction;
import com.agencyos.searchsync.core.model.ChangeNotification;
import com.agencyos.searchsync.core.model.ClassificationResult;
import com.agencyos.searchsync.core.model.ConnectionSnapshot;
import com.agencyos.searchsync.core.model.PublishResult;
import com.agencyos.searchsync.core.model.PublishStatus;
import com.agencyos.searchsync.core.publisher.ChangeEventPublisher;
import com.agencyos.searchsync.core.stream.StreamEndpoint;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Operational endpoints for the search sync publisher.
 *
 * Production posture: - Disabled by default (must be explicitly enabled via
 * config). - Exposes the masked endpoint only, never credentials. - Should be
 * protected by network controls; POST /notifications writes to the live stream.
 *
 * Enable explicitly: searchsync.admin.enabled=true
 */
@RestController
@RequestMapping(path = "/admin/search-sync", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "searchsync.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
@Validated
public class SearchSyncAdminController {

	private static final Logger log = LoggerFactory.getLogger(SearchSyncAdminController.class);

	/** Upper bound for ids in a single smoke-test notification. */
	static final int MAX_IDS = 500;

	private final CollectionClassifier classifier;
	private final SearchSyncProperties props;
	private final ObjectProvider<ChangeEventPublisher> publisher;
	private final ObjectProvider<StreamEndpoint> endpoint;
	private final ObjectProvider<MeterRegistry> meterRegistry;

	public SearchSyncAdminController(CollectionClassifier classifier, SearchSyncProperties props,
			ObjectProvider<ChangeEventPublisher> publisher, ObjectProvider<StreamEndpoint> endpoint,
			ObjectProvider<MeterRegistry> meterRegistry) {
		this.classifier = classifier;
		this.props = props;
		this.publisher = publisher;
		this.endpoint = endpoint;
		this.meterRegistry = meterRegistry;
	}

	/**
	 * Connection state and publish counters. When publishing is disabled the
	 * state is reported as {@code DISABLED} with no endpoint.
	 */
	@GetMapping("/status")
	public StatusResponse status() {
		ChangeEventPublisher p = publisher.getIfAvailable();
		StreamEndpoint ep = endpoint.getIfAvailable();

		if (p == null) {
			return new StatusResponse(false, "DISABLED", 0, 0, null, null, props.getStream(),
					classifier.suffixes(), counters());
		}
		ConnectionSnapshot s = p.connection().snapshot();
		return new StatusResponse(true, s.state().name(), s.consecutiveFailures(), s.totalAttempts(), s.lastError(),
				ep == null ? null : ep.masked(), props.getStream(), classifier.suffixes(), counters());
	}

	/**
	 * Runs one notification through the publisher and returns its result.
	 *
	 * Production characteristics: - Same code path as the lifecycle hooks. -
	 * Bounded by the publisher's append timeout per id; the response waits for the
	 * whole batch. - If the batch outlives that bound the reply is 504 with a
	 * {@code FAILED} result; entries already appended stay in the stream.
	 */
	@PostMapping(path = "/notifications", consumes = MediaType.APPLICATION_JSON_VALUE)
	public ResponseEntity<PublishResult> publish(@Valid @RequestBody NotificationRequest req) {
		ChangeAction action = ChangeAction.fromWire(req.action());
		String collection = requireNonBlank(req.collection(), "collection");

		ChangeEventPublisher p = publisher.getIfAvailable();
		if (p == null) {
			return ResponseEntity.status(503).body(PublishResult.skipped(PublishStatus.DISABLED));
		}

		ChangeNotification n = new ChangeNotification(action, collection, req.ids());
		Duration bound = batchTimeout(req.ids().size());
		PublishResult result = p.handle(n)
				.timeout(bound)
				.onErrorResume(TimeoutException.class, e -> Mono.empty())
				.block();

		if (result == null) {
			log.warn("Admin publish timed out collection={} action={} ids={} after={}", collection,
					action.wireValue(), req.ids().size(), bound);
			return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
					.body(PublishResult.attempted(List.of(), req.ids().size()));
		}

		log.info("Admin publish collection={} action={} ids={} status={}", collection, action.wireValue(),
				req.ids().size(), result.status());

		return ResponseEntity.ok(result);
	}

	@GetMapping("/classify/{collection}")
	public ClassificationResult classify(@PathVariable("collection") String collection) {
		return classifier.classify(requireNonBlank(collection, "collection"));
	}

	// ---------------------------------------------------------------------
	// DTOs (stable API contracts)
	// ---------------------------------------------------------------------

	public record StatusResponse(boolean enabled, String state, int consecutiveFailures, long totalAttempts,
			String lastError, String endpoint, String stream, List<String> suffixes, Map<String, Double> counters) {
	}

	public record NotificationRequest(@NotBlank String action, @NotBlank String collection,
			@NotEmpty @Size(max = MAX_IDS) List<@NotBlank String> ids) {
	}

	// ---------------------------------------------------------------------
	// Small helpers
	// ---------------------------------------------------------------------

	private Map<String, Double> counters() {
		Map<String, Double> out = new LinkedHashMap<>();
		MeterRegistry registry = meterRegistry.getIfAvailable();
		if (registry == null) {
			return out;
		}
		for (Counter c : registry.find(ChangeEventPublisher.METRIC_ENTRIES).counters()) {
			out.put("entries." + c.getId().getTag("outcome"), c.count());
		}
		for (Counter c : registry.find(ChangeEventPublisher.METRIC_NOTIFICATIONS).counters()) {
			out.put("notifications." + c.getId().getTag("status"), c.count());
		}
		return out;
	}

	private Duration batchTimeout(int ids) {
		// One append timeout per id plus slack for the reply.
		return props.getAppendTimeout().multipliedBy(ids).plusSeconds(1);
	}

	private static String requireNonBlank(String v, String field) {
		if (v == null || v.isBlank()) {
			throw new IllegalArgumentException(field + " is required");
		}
		return v.trim();
	}
}
