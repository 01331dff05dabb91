/*
 * どこで: Inference NATS JetStream 購読テスト
 * 何を: start() 経由で handleMessage が配線されることと ack/nak/term の分岐を検証する
 * なぜ: 実測イベントの再配信制御が ledger の upsert 結果と一致することを保証するため
 */
package com.example.inference.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.inference.config.InferenceNatsProperties;
import com.example.inference.model.OutcomeUpdate;
import com.example.inference.model.OutcomeUpsertResult;
import com.example.inference.service.OutcomeLedgerService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OutcomeEventSubscriberTest {

  private static final String SUBJECT = "inference.outcomes";
  private static final String STREAM = "inference-outcomes";
  private static final String DURABLE = "inference-outcome-consumer";
  private static final Duration ACK_WAIT = Duration.ofSeconds(30);
  private static final int MAX_DELIVER = 5;
  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private Connection connection;
  @Mock private JetStream jetStream;
  @Mock private JetStreamManagement jetStreamManagement;
  @Mock private Dispatcher dispatcher;
  @Mock private JetStreamSubscription subscription;
  @Mock private OutcomeLedgerService ledgerService;
  @Mock private Message message;

  @Captor private ArgumentCaptor<MessageHandler> handlerCaptor;
  @Captor private ArgumentCaptor<PushSubscribeOptions> optionsCaptor;

  private OutcomeEventSubscriber subscriber;

  @BeforeEach
  void setUp() {
    final InferenceNatsProperties properties =
        new InferenceNatsProperties(
            "inference.retraining",
            SUBJECT,
            STREAM,
            DURABLE,
            Duration.ofMinutes(2),
            ACK_WAIT,
            MAX_DELIVER);
    subscriber =
        new OutcomeEventSubscriber(
            connection,
            ledgerService,
            properties,
            new ObjectMapper(),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void ackWhenOutcomeIsJoinedViaSubscriptionWiring() throws Exception {
    stubConnection();
    when(jetStream.subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            handlerCaptor.capture(),
            eq(false),
            any(PushSubscribeOptions.class)))
        .thenReturn(subscription);
    when(message.getData())
        .thenReturn(
            bytes(
                "{\"request_id\":\" req-1 \",\"realized_label\":1,"
                    + "\"observed_at\":\"2026-03-01T10:00:00Z\"}"));
    when(ledgerService.recordOutcome(any())).thenReturn(OutcomeUpsertResult.JOINED);

    subscriber.start();
    handlerCaptor.getValue().onMessage(message);

    verify(ledgerService)
        .recordOutcome(new OutcomeUpdate("req-1", 1, Instant.parse("2026-03-01T10:00:00Z")));
    verify(message).ack();
    verify(message, never()).nak();
  }

  @Test
  void missingObservedAtDefaultsToNow() {
    when(message.getData()).thenReturn(bytes("{\"request_id\":\"req-1\",\"realized_label\":0}"));
    when(ledgerService.recordOutcome(any())).thenReturn(OutcomeUpsertResult.ORPHANED);

    subscriber.handleMessage(message);

    verify(ledgerService).recordOutcome(new OutcomeUpdate("req-1", 0, FIXED_NOW));
    verify(message).ack();
  }

  @Test
  void duplicateRedeliveryIsAcked() {
    when(message.getData()).thenReturn(bytes("{\"request_id\":\"req-1\",\"realized_label\":0}"));
    when(ledgerService.recordOutcome(any())).thenReturn(OutcomeUpsertResult.DUPLICATE);

    subscriber.handleMessage(message);

    verify(message).ack();
  }

  @Test
  void conflictingLabelIsTerminated() {
    when(message.getData()).thenReturn(bytes("{\"request_id\":\"req-1\",\"realized_label\":0}"));
    when(ledgerService.recordOutcome(any())).thenReturn(OutcomeUpsertResult.CONFLICT);

    subscriber.handleMessage(message);

    verify(message).term();
    verify(message, never()).ack();
  }

  @Test
  void malformedPayloadsAreTerminatedWithoutTouchingLedger() {
    final Message notJson = mock(Message.class);
    final Message badLabel = mock(Message.class);
    final Message blankId = mock(Message.class);
    final Message badTimestamp = mock(Message.class);
    when(notJson.getData()).thenReturn(new byte[] {(byte) 0x80});
    when(badLabel.getData()).thenReturn(bytes("{\"request_id\":\"req-1\",\"realized_label\":2}"));
    when(blankId.getData()).thenReturn(bytes("{\"request_id\":\" \",\"realized_label\":1}"));
    when(badTimestamp.getData())
        .thenReturn(
            bytes("{\"request_id\":\"req-1\",\"realized_label\":1,\"observed_at\":\"yesterday\"}"));

    subscriber.handleMessage(notJson);
    subscriber.handleMessage(badLabel);
    subscriber.handleMessage(blankId);
    subscriber.handleMessage(badTimestamp);

    verify(notJson).term();
    verify(badLabel).term();
    verify(blankId).term();
    verify(badTimestamp).term();
    verifyNoInteractions(ledgerService);
  }

  @Test
  void nakWhenLedgerFailsAndSwallowNakFailure() {
    when(message.getData()).thenReturn(bytes("{\"request_id\":\"req-1\",\"realized_label\":1}"));
    when(ledgerService.recordOutcome(any())).thenThrow(new IllegalStateException("boom"));
    doThrow(new IllegalStateException("nak-failed")).when(message).nak();

    assertThatCode(() -> subscriber.handleMessage(message)).doesNotThrowAnyException();

    verify(message).nak();
    verify(message, never()).ack();
  }

  @Test
  void startCreatesStreamWhenMissing() throws Exception {
    stubConnection();
    when(jetStream.subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            any(MessageHandler.class),
            eq(false),
            any(PushSubscribeOptions.class)))
        .thenReturn(subscription);
    when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
        .thenThrow(new StreamNotFoundException());

    subscriber.start();

    verify(jetStreamManagement).addStream(any(StreamConfiguration.class));
  }

  @Test
  void startUsesDurableAckWaitAndMaxDeliver() throws Exception {
    stubConnection();
    when(jetStream.subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            any(MessageHandler.class),
            eq(false),
            optionsCaptor.capture()))
        .thenReturn(subscription);

    subscriber.start();
    // 二重 start は購読を増やさない
    subscriber.start();

    final PushSubscribeOptions options = optionsCaptor.getValue();
    assertThat(options.getDurable()).isEqualTo(DURABLE);
    assertThat(options.getConsumerConfiguration().getAckWait()).isEqualTo(ACK_WAIT);
    assertThat(options.getConsumerConfiguration().getMaxDeliver()).isEqualTo(MAX_DELIVER);
    verify(connection, times(1)).createDispatcher();
  }

  @Test
  void stopIsSafeWhenCalledTwice() throws Exception {
    stubConnection();
    when(jetStream.subscribe(
            eq(SUBJECT),
            eq(dispatcher),
            any(MessageHandler.class),
            eq(false),
            any(PushSubscribeOptions.class)))
        .thenReturn(subscription);

    subscriber.start();
    subscriber.stop();
    subscriber.stop();

    verify(subscription, times(1)).unsubscribe();
    verify(connection, times(1)).closeDispatcher(dispatcher);
  }

  private void stubConnection() throws IOException {
    when(connection.jetStream()).thenReturn(jetStream);
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(connection.createDispatcher()).thenReturn(dispatcher);
  }

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  private static final class StreamNotFoundException extends JetStreamApiException {

    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
