package com.lox.inventoryreservation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lox.inventoryreservation.api.exceptions.OutcomePublishException;
import com.lox.inventoryreservation.api.kafka.consumer.ConsumerLoopStats;
import com.lox.inventoryreservation.api.kafka.consumer.OrderCreatedConsumer;
import com.lox.inventoryreservation.api.kafka.events.InventoryOutcomeEvent;
import com.lox.inventoryreservation.api.kafka.events.OrderCreatedEvent;
import com.lox.inventoryreservation.api.kafka.events.OutcomeStatus;
import com.lox.inventoryreservation.api.kafka.producer.OutcomeProducer;
import com.lox.inventoryreservation.api.kafka.producer.PublishResult;
import com.lox.inventoryreservation.api.repositories.r2dbc.R2dbcReservationLedger;
import com.lox.inventoryreservation.api.repositories.r2dbc.R2dbcStockStore;
import com.lox.inventoryreservation.api.services.ReservationEngineImpl;
import com.lox.inventoryreservation.common.config.ReservationProperties;
import com.lox.inventoryreservation.support.H2TestDatabase;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs order payloads through the consumer, engine and R2DBC store on an in-memory database, with
 * a recording producer in place of Kafka.
 */
@DisplayName("Reservation pipeline against H2")
class ReservationPipelineIntegrationTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private H2TestDatabase database;
    private R2dbcStockStore stockStore;
    private ReservationEngineImpl engine;
    private RecordingProducer producer;
    private ConsumerLoopStats stats;
    private OrderCreatedConsumer consumer;

    @BeforeEach
    void setUp() {
        database = H2TestDatabase.create();
        stockStore = new R2dbcStockStore(database.template());

        ReservationProperties properties = new ReservationProperties();
        properties.setStoreTimeout(Duration.ofSeconds(5));
        properties.setCycleTimeout(Duration.ofSeconds(30));

        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(5)
                .waitDuration(Duration.ofMillis(20))
                .build());

        engine = new ReservationEngineImpl(stockStore,
                new R2dbcReservationLedger(database.template()),
                database.transactionalOperator(), properties, retryRegistry);
        producer = new RecordingProducer();
        stats = new ConsumerLoopStats();
        consumer = new OrderCreatedConsumer(engine, producer, objectMapper, properties, stats);
    }

    private String payload(long orderId, long productId, int quantity) throws Exception {
        return objectMapper.writeValueAsString(OrderCreatedEvent.builder()
                .orderId(orderId)
                .userId(3L)
                .productId(productId)
                .quantity(quantity)
                .total(new BigDecimal("19.99"))
                .build());
    }

    private void deliver(String payload) {
        consumer.handleOrderCreated(new ConsumerRecord<>("orders", 0, 0L, null, payload));
    }

    @Test
    @DisplayName("reserves and decrements when stock is sufficient")
    void reservesWhenStockIsSufficient() throws Exception {
        stockStore.insert(42L, 10).block();

        deliver(payload(1L, 42L, 5));

        assertThat(producer.outcomes()).containsExactly(InventoryOutcomeEvent.reserved(1L));
        assertThat(database.quantityOf(42L)).isEqualTo(5);
    }

    @Test
    @DisplayName("fails with 'Not enough stock' and leaves stock unchanged")
    void failsWhenStockIsInsufficient() throws Exception {
        stockStore.insert(42L, 3).block();

        deliver(payload(2L, 42L, 5));

        assertThat(producer.outcomes())
                .containsExactly(InventoryOutcomeEvent.failed(2L, "Not enough stock"));
        assertThat(database.quantityOf(42L)).isEqualTo(3);
    }

    @Test
    @DisplayName("fails with 'Product not found' for unknown products")
    void failsForUnknownProduct() throws Exception {
        deliver(payload(3L, 999L, 1));

        assertThat(producer.outcomes())
                .containsExactly(InventoryOutcomeEvent.failed(3L, "Product not found"));
        assertThat(database.quantityOf(999L)).isNull();
    }

    @Test
    @DisplayName("serves exactly one of two orders competing for the last unit")
    void servesOneOfTwoOrdersForLastUnit() throws Exception {
        stockStore.insert(1L, 1).block();

        deliver(payload(10L, 1L, 1));
        deliver(payload(11L, 1L, 1));

        assertThat(producer.outcomes()).containsExactly(
                InventoryOutcomeEvent.reserved(10L),
                InventoryOutcomeEvent.failed(11L, "Not enough stock"));
        assertThat(database.quantityOf(1L)).isZero();
    }

    @Test
    @DisplayName("skips malformed payloads without publishing")
    void skipsMalformedPayload() {
        deliver("{\"orderId\":5,\"userId\":1,\"productId\":42,\"quantity\":\"five\",\"total\":9.5}");

        assertThat(producer.outcomes()).isEmpty();
        assertThat(stats.getMalformed()).isEqualTo(1);
    }

    @Test
    @DisplayName("applies the decrement once when the same order is redelivered")
    void appliesDecrementOnceUnderRedelivery() throws Exception {
        stockStore.insert(42L, 10).block();
        String order = payload(20L, 42L, 4);

        deliver(order);
        deliver(order);
        deliver(order);

        assertThat(database.quantityOf(42L)).isEqualTo(6);
        assertThat(database.reservationCount(20L)).isEqualTo(1L);
        assertThat(producer.outcomes()).hasSize(3)
                .allMatch(outcome -> outcome.equals(InventoryOutcomeEvent.reserved(20L)));
    }

    @Test
    @DisplayName("replays a rejection unchanged even after stock is replenished")
    void replaysRejectionAfterRestock() throws Exception {
        stockStore.insert(42L, 1).block();
        String order = payload(21L, 42L, 5);

        deliver(order);
        stockStore.updateQuantity(42L, 50).block();
        deliver(order);

        assertThat(producer.outcomes()).containsExactly(
                InventoryOutcomeEvent.failed(21L, "Not enough stock"),
                InventoryOutcomeEvent.failed(21L, "Not enough stock"));
        assertThat(database.quantityOf(42L)).isEqualTo(50);
    }

    @Test
    @DisplayName("keeps the decision when publishing fails and republishes it on redelivery")
    void republishesRecordedDecisionAfterPublishFailure() throws Exception {
        stockStore.insert(42L, 10).block();
        String order = payload(30L, 42L, 2);

        producer.failNext();
        assertThatThrownBy(() -> deliver(order)).isInstanceOf(OutcomePublishException.class);
        assertThat(database.quantityOf(42L)).isEqualTo(8);

        deliver(order);

        assertThat(producer.outcomes()).containsExactly(InventoryOutcomeEvent.reserved(30L));
        assertThat(database.quantityOf(42L)).isEqualTo(8);
    }

    @Test
    @DisplayName("publishes RESERVED exactly for the committed decrements under concurrency")
    void outcomesMatchCommittedDecrements() {
        stockStore.insert(7L, 10).block();

        List<InventoryOutcomeEvent> outcomes = Flux.range(100, 8)
                .flatMap(orderId -> engine.reserve(OrderCreatedEvent.builder()
                        .orderId((long) orderId)
                        .userId(1L)
                        .productId(7L)
                        .quantity(3)
                        .total(BigDecimal.TEN)
                        .build())
                        .subscribeOn(Schedulers.boundedElastic()), 8)
                .collectList()
                .block();

        long reserved = outcomes.stream()
                .filter(outcome -> outcome.getStatus() == OutcomeStatus.RESERVED)
                .count();
        assertThat(reserved).isEqualTo(3);
        assertThat(outcomes).filteredOn(outcome -> outcome.getStatus() == OutcomeStatus.FAILED)
                .allMatch(outcome -> outcome.getMessage().equals("Not enough stock"));
        assertThat(database.quantityOf(7L)).isEqualTo(10 - 3 * (int) reserved);
    }

    private static final class RecordingProducer implements OutcomeProducer {

        private final List<InventoryOutcomeEvent> published = new CopyOnWriteArrayList<>();
        private final AtomicBoolean failNext = new AtomicBoolean();

        @Override
        public Mono<PublishResult> publish(InventoryOutcomeEvent outcome) {
            String topic = outcome.getStatus().getTopic();
            if (failNext.getAndSet(false)) {
                return Mono.just(PublishResult.failed(topic, new IllegalStateException("broker down")));
            }
            published.add(outcome);
            return Mono.just(PublishResult.published(topic, published.size()));
        }

        void failNext() {
            failNext.set(true);
        }

        List<InventoryOutcomeEvent> outcomes() {
            return published;
        }
    }
}
