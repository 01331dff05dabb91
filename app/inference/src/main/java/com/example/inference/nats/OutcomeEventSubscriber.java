/*
 * どこで: Inference NATS 購読
 * 何を: 実測ラベルのイベントを JetStream から購読し ledger へ upsert する
 * なぜ: HTTP を経由しない outcome feed からも同じ冪等規則で結合するため
 */
package com.example.inference.nats;

import com.example.common.event.OutcomeEventPayload;
import com.example.inference.config.InferenceNatsProperties;
import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.OutcomeUpsertResult;
import com.example.inference.service.OutcomeLedgerService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
public class OutcomeEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(OutcomeEventSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final OutcomeLedgerService ledgerService;
  private final InferenceNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public OutcomeEventSubscriber(
      Connection connection,
      OutcomeLedgerService ledgerService,
      InferenceNatsProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.connection = connection;
    this.ledgerService = ledgerService;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.outcomeSubject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "outcome subscriber started subject={} stream={} durable={}",
          properties.outcomeSubject(),
          properties.outcomeStream(),
          properties.outcomeDurable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    final OutcomeUpdate update;
    try {
      update = toUpdate(objectMapper.readValue(message.getData(), OutcomeEventPayload.class));
    } catch (IOException | IllegalArgumentException | DateTimeParseException ex) {
      // payload 破損は再配信で回復しないため恒久的に TERM する
      logger.warn("failed to parse outcome event payload", ex);
      termSilently(message);
      return;
    }
    try {
      final OutcomeUpsertResult result = ledgerService.recordOutcome(update);
      if (result == OutcomeUpsertResult.CONFLICT) {
        // ラベル違いの再配信は何度届いても結果が変わらない
        termSilently(message);
        return;
      }
      // JetStream 明示 ack: 成功時は ack して再配信を止める
      message.ack();
    } catch (RuntimeException ex) {
      // 不明な例外はデータロス回避のため再配信に倒す
      logger.warn("failed to handle outcome event requestId={}", update.requestId(), ex);
      nakSilently(message);
    }
  }

  private OutcomeUpdate toUpdate(OutcomeEventPayload payload) {
    if (payload == null || payload.requestId() == null || payload.requestId().isBlank()) {
      throw new IllegalArgumentException("request_id is required");
    }
    final Integer label = payload.realizedLabel();
    if (label == null || (label != 0 && label != 1)) {
      throw new IllegalArgumentException("realized_label must be 0 or 1");
    }
    final Instant observedAt =
        payload.observedAt() == null || payload.observedAt().isBlank()
            ? Instant.now(clock)
            : Instant.parse(payload.observedAt());
    return new OutcomeUpdate(payload.requestId().trim(), label, observedAt);
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    // Nats-Msg-Id による重複排除を有効化するため stream を必ず作成する
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.outcomeStream())
            .subjects(properties.outcomeSubject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "outcome stream ensured stream={} subject={} duplicateWindow={}",
        properties.outcomeStream(),
        properties.outcomeSubject(),
        properties.duplicateWindow());
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.outcomeStream())
        .durable(properties.outcomeDurable())
        .configuration(consumerConfiguration)
        .build();
  }

  private void nakSilently(Message message) {
    try {
      message.nak();
    } catch (IllegalStateException ex) {
      logger.warn("failed to nack nats message", ex);
    }
  }

  private void termSilently(Message message) {
    try {
      message.term();
    } catch (IllegalStateException ex) {
      logger.warn("failed to term nats message", ex);
    }
  }
}
