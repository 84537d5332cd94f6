package com.agencyos.searchsync.hook;

import com.agencyos.searchsync.core.model.ChangeAction;
import com.agencyos.searchsync.core.model.ChangeNotification;
import com.agencyos.searchsync.core.model.PublishResult;
import com.agencyos.searchsync.core.model.PublishStatus;
import com.agencyos.searchsync.core.publisher.ChangeEventPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mock.env.MockEnvironment;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ItemLifecycleHooks Tests")
class ItemLifecycleHooksTest {

    @Mock
    private ChangeEventPublisher publisher;

    @Mock
    private ObjectProvider<ChangeEventPublisher> provider;

    private static final PublishResult OK = PublishResult.attempted(List.of("1-0"), 0);

    private ItemLifecycleHooks enabledHooks() {
        when(provider.getIfAvailable()).thenReturn(publisher);
        return new ItemLifecycleHooks(provider, new MockEnvironment());
    }

    private ChangeNotification captured() {
        ArgumentCaptor<ChangeNotification> captor = ArgumentCaptor.forClass(ChangeNotification.class);
        verify(publisher).handle(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("With a publisher")
    class Enabled {

        @Test
        @DisplayName("Create maps to a single-id upsert")
        void created() {
            // Given
            ItemLifecycleHooks hooks = enabledHooks();
            when(publisher.handle(any())).thenReturn(Mono.just(OK));

            // When
            PublishResult result = hooks.onItemCreated("pntl_products", 17).block();

            // Then
            assertThat(result).isEqualTo(OK);
            ChangeNotification n = captured();
            assertThat(n.action()).isEqualTo(ChangeAction.UPSERT);
            assertThat(n.sourceName()).isEqualTo("pntl_products");
            assertThat(n.recordIds()).containsExactly("17");
        }

        @Test
        @DisplayName("Update maps to an upsert with stringified keys in order")
        void updated() {
            ItemLifecycleHooks hooks = enabledHooks();
            when(publisher.handle(any())).thenReturn(Mono.just(OK));
            UUID id = UUID.fromString("7f1e4a0c-1d2b-4c3d-9e8f-0a1b2c3d4e5f");

            hooks.onItemsUpdated("pntl_products", List.of(3, "b", id)).block();

            ChangeNotification n = captured();
            assertThat(n.action()).isEqualTo(ChangeAction.UPSERT);
            assertThat(n.recordIds()).containsExactly("3", "b", id.toString());
        }

        @Test
        @DisplayName("Delete maps to a delete")
        void deleted() {
            ItemLifecycleHooks hooks = enabledHooks();
            when(publisher.handle(any())).thenReturn(Mono.just(OK));

            hooks.onItemsDeleted("pntl_categories", List.of("x")).block();

            assertThat(captured().action()).isEqualTo(ChangeAction.DELETE);
        }

        @Test
        @DisplayName("Null keys become an empty notification")
        void nullKeys() {
            ItemLifecycleHooks hooks = enabledHooks();
            when(publisher.handle(any())).thenReturn(Mono.just(PublishResult.skipped(PublishStatus.SKIPPED_EMPTY)));

            hooks.onItemsDeleted("pntl_products", null).block();
            hooks.onItemCreated("pntl_products", null).block();

            ArgumentCaptor<ChangeNotification> captor = ArgumentCaptor.forClass(ChangeNotification.class);
            verify(publisher, times(2)).handle(captor.capture());
            assertThat(captor.getAllValues()).allSatisfy(n -> assertThat(n.recordIds()).isEmpty());
        }

        @Test
        @DisplayName("Null elements inside the key list are stringified")
        void nullElement() {
            ItemLifecycleHooks hooks = enabledHooks();
            when(publisher.handle(any())).thenReturn(Mono.just(OK));

            hooks.onItemsUpdated("pntl_products", Arrays.asList("a", null)).block();

            assertThat(captured().recordIds()).containsExactly("a", "null");
        }

        @Test
        @DisplayName("Application events are forwarded to the publisher")
        void applicationEvent() {
            ItemLifecycleHooks hooks = enabledHooks();
            when(publisher.handle(any())).thenReturn(Mono.just(OK));

            hooks.onItemAction(ItemActionEvent.deleted("pntl_products", List.of(5, 6)));

            ArgumentCaptor<ChangeNotification> captor = ArgumentCaptor.forClass(ChangeNotification.class);
            verify(publisher, timeout(1000)).handle(captor.capture());
            assertThat(captor.getValue().action()).isEqualTo(ChangeAction.DELETE);
            assertThat(captor.getValue().recordIds()).containsExactly("5", "6");
        }

        @Test
        @DisplayName("Create events map to upserts")
        void createEvent() {
            ItemLifecycleHooks hooks = enabledHooks();
            when(publisher.handle(any())).thenReturn(Mono.just(OK));

            hooks.onItemAction(ItemActionEvent.created("pntl_products", "k1"));

            ArgumentCaptor<ChangeNotification> captor = ArgumentCaptor.forClass(ChangeNotification.class);
            verify(publisher, timeout(1000)).handle(captor.capture());
            assertThat(captor.getValue().action()).isEqualTo(ChangeAction.UPSERT);
            assertThat(captor.getValue().recordIds()).containsExactly("k1");
        }
    }

    @Nested
    @DisplayName("Without a publisher")
    class Disabled {

        @Test
        @DisplayName("Every hook returns DISABLED")
        void disabled() {
            when(provider.getIfAvailable()).thenReturn(null);
            ItemLifecycleHooks hooks = new ItemLifecycleHooks(provider, new MockEnvironment());

            assertThat(hooks.isEnabled()).isFalse();
            StepVerifier.create(hooks.onItemsUpdated("pntl_products", List.of("a")))
                    .assertNext(r -> assertThat(r.status()).isEqualTo(PublishStatus.DISABLED))
                    .verifyComplete();
            StepVerifier.create(hooks.onItemsDeleted("pntl_products", List.of("a")))
                    .assertNext(r -> assertThat(r.status()).isEqualTo(PublishStatus.DISABLED))
                    .verifyComplete();
            verifyNoInteractions(publisher);
        }

        @Test
        @DisplayName("Unusable endpoint is reported without failing construction")
        void unusableEndpoint() {
            when(provider.getIfAvailable()).thenReturn(null);
            MockEnvironment env = new MockEnvironment().withProperty("searchsync.url", "ftp://files:21");

            ItemLifecycleHooks hooks = new ItemLifecycleHooks(provider, env);

            assertThat(hooks.onItemCreated("pntl_products", "a").block().status()).isEqualTo(PublishStatus.DISABLED);
        }
    }
}
