package com.agencyos.searchsync.jetstream;

import com.agencyos.searchsync.core.model.ChangeAction;
import com.agencyos.searchsync.core.model.StreamEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Message;
import io.nats.client.api.PublishAck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JetStreamChannel Tests")
class JetStreamChannelTest {

    @Mock
    private Connection connection;

    @Mock
    private JetStream js;

    @Mock
    private PublishAck ack;

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<Throwable> lost = new ArrayList<>();
    private JetStreamConnector.JetStreamChannel channel;

    @BeforeEach
    void setUp() {
        channel = new JetStreamConnector.JetStreamChannel(connection, js, "search.sync", mapper, lost::add);
    }

    @Test
    @DisplayName("Append publishes headers and JSON body; the entry id is the sequence number")
    void appendPublishes() throws Exception {
        // Given
        when(ack.getSeqno()).thenReturn(42L);
        when(js.publishAsync(any(Message.class))).thenReturn(CompletableFuture.completedFuture(ack));
        StreamEntry entry = new StreamEntry(ChangeAction.UPSERT, "pntl", "products", "a", "pntl_products", 1700000000000L);

        // When / Then
        StepVerifier.create(channel.append(entry))
                .expectNext("42")
                .verifyComplete();

        ArgumentCaptor<Message> msg = ArgumentCaptor.forClass(Message.class);
        verify(js).publishAsync(msg.capture());
        Message m = msg.getValue();
        assertThat(m.getSubject()).isEqualTo("search.sync");
        assertThat(m.getHeaders().getFirst("entity_id")).isEqualTo("a");
        assertThat(m.getHeaders().getFirst("action")).isEqualTo("upsert");

        @SuppressWarnings("unchecked")
        Map<String, String> body = mapper.readValue(m.getData(), Map.class);
        assertThat(body).containsEntry("tenant", "pntl")
                .containsEntry("entity_type", "products")
                .containsEntry("collection", "pntl_products")
                .containsEntry("timestamp", "1700000000000");
    }

    @Test
    @DisplayName("A failed publish surfaces as an error")
    void appendFails() {
        when(js.publishAsync(any(Message.class)))
                .thenReturn(CompletableFuture.failedFuture(new IOException("No response from stream")));
        StreamEntry entry = new StreamEntry(ChangeAction.DELETE, "pntl", "products", "a", "pntl_products", 1L);

        StepVerifier.create(channel.append(entry))
                .expectError(IOException.class)
                .verify();
    }

    @Test
    @DisplayName("Loss is reported once and not at all after close")
    void lossOnce() {
        channel.fireLost(null);
        channel.fireLost(null);
        assertThat(lost).hasSize(1);

        JetStreamConnector.JetStreamChannel other =
                new JetStreamConnector.JetStreamChannel(connection, js, "search.sync", mapper, lost::add);
        other.close();
        other.fireLost(null);
        assertThat(lost).hasSize(1);
    }
}
