package com.lox.inventoryreservation.api.kafka.producer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lox.inventoryreservation.api.kafka.events.InventoryOutcomeEvent;
import com.lox.inventoryreservation.api.kafka.events.OutcomeStatus;
import com.lox.inventoryreservation.common.config.ReservationProperties;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Component
@Slf4j
public class KafkaOutcomeProducer implements OutcomeProducer {

    static final String PUBLISH_RETRY = "outcomePublisher";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final ReservationProperties properties;
    private final Retry publishRetry;

    public KafkaOutcomeProducer(KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper, ReservationProperties properties,
            RetryRegistry retryRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.publishRetry = retryRegistry.retry(PUBLISH_RETRY);
    }

    @Override
    public Mono<PublishResult> publish(InventoryOutcomeEvent outcome) {
        String topic = topicFor(outcome);
        String key = String.valueOf(outcome.getOrderId());

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(outcome))
                // send() may block on metadata, so it runs off the caller's thread and the deadline can fire
                .flatMap(json -> Mono.defer(() -> Mono.fromFuture(kafkaTemplate.send(topic, key, json)))
                        .subscribeOn(Schedulers.boundedElastic())
                        .timeout(properties.getPublishTimeout())
                        .transformDeferred(RetryOperator.of(publishRetry)))
                .map(result -> toPublished(topic, result))
                .doOnNext(result -> log.info("Published {} outcome for Order ID: {} to '{}' at offset [{}]",
                        outcome.getStatus(), outcome.getOrderId(), topic, result.getOffset()))
                .onErrorResume(e -> {
                    log.error("Failed to publish outcome for Order ID: {} to '{}' after retries: {}",
                            outcome.getOrderId(), topic, e.toString());
                    return Mono.just(PublishResult.failed(topic, e));
                });
    }

    private static String topicFor(InventoryOutcomeEvent outcome) {
        return outcome.getStatus() == OutcomeStatus.RESERVED
                ? OutcomeStatus.RESERVED.getTopic()
                : OutcomeStatus.FAILED.getTopic();
    }

    private static PublishResult toPublished(String topic, SendResult<String, String> result) {
        long offset = result.getRecordMetadata() != null ? result.getRecordMetadata().offset() : -1L;
        return PublishResult.published(topic, offset);
    }
}
