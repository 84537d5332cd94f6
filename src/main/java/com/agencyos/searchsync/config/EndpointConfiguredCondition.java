package com.agencyos.searchsync.config;

import com.agencyos.searchsync.core.stream.StreamEndpoint;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when a streaming-store endpoint can be resolved and its scheme is supported.
 *
 * <p>Guards the connection and publisher beans: with no usable endpoint they are never created and
 * the lifecycle hooks stay inert.</p>
 */
public class EndpointConfiguredCondition extends SpringBootCondition {

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        return EndpointResolver.resolve(context.getEnvironment())
                .map(EndpointConfiguredCondition::outcomeFor)
                .orElseGet(() -> ConditionOutcome.noMatch("no search sync endpoint configured"));
    }

    private static ConditionOutcome outcomeFor(EndpointResolver.Resolved resolved) {
        try {
            StreamEndpoint.parse(resolved.url());
            return ConditionOutcome.match("search sync endpoint found in " + resolved.key());
        } catch (IllegalArgumentException e) {
            return ConditionOutcome.noMatch("unusable search sync endpoint in " + resolved.key() + ": " + e.getMessage());
        }
    }
}
