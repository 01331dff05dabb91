/*
 * どこで: Inference NATS 連携
 * 何を: 再学習シグナルを JSON で JetStream へ publish する
 * なぜ: 再学習ジョブ側が puback 済みのシグナルだけを受け取り、Nats-Msg-Id で重複を落とせるようにするため
 */
package com.example.inference.nats;

import com.example.common.TraceIds;
import com.example.common.event.RetrainingSignalPayload;
import com.example.inference.config.InferenceNatsProperties;
import com.example.inference.model.DriftVerdict;
import com.example.inference.service.RetrainingSignalException;
import com.example.inference.service.RetrainingTrigger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
@RequiredArgsConstructor
public class NatsRetrainingTrigger implements RetrainingTrigger {

  private static final Logger logger = LoggerFactory.getLogger(NatsRetrainingTrigger.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_MODEL_VERSION = "model_version";
  private static final String HEADER_TRACE_ID = "trace_id";

  private final JetStream jetStream;
  private final InferenceNatsProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public void signal(DriftVerdict verdict, String modelVersion) {
    final RetrainingSignalPayload payload = toPayload(verdict, modelVersion);
    final Headers headers = new Headers();
    // 重複排除キーとして event_id を NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, payload.eventId());
    headers.add(HEADER_MODEL_VERSION, modelVersion);
    headers.add(HEADER_TRACE_ID, payload.traceId());
    try {
      final PublishAck ack =
          jetStream.publish(properties.retrainingSubject(), headers, serialize(payload));
      // puback を受け取れた場合のみ publish 成功とみなす
      if (ack == null) {
        throw new RetrainingSignalException("puback is missing", null);
      }
      logger.info(
          "retraining signal published eventId={} subject={} stream={} seq={}",
          payload.eventId(),
          properties.retrainingSubject(),
          ack.getStream(),
          ack.getSeqno());
    } catch (IOException | JetStreamApiException ex) {
      throw new RetrainingSignalException("failed to publish retraining signal", ex);
    }
  }

  private RetrainingSignalPayload toPayload(DriftVerdict verdict, String modelVersion) {
    return new RetrainingSignalPayload(
        UUID.randomUUID().toString(),
        verdict.evaluatedAt().toString(),
        modelVersion,
        verdict.windowStart().toString(),
        verdict.windowEnd().toString(),
        verdict.statisticName(),
        verdict.statistic() == null ? Double.NaN : verdict.statistic(),
        verdict.threshold(),
        verdict.sampleSize(),
        TraceIds.currentOrNew());
  }

  private byte[] serialize(RetrainingSignalPayload payload) {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new RetrainingSignalException("failed to serialize retraining signal", ex);
    }
  }
}
