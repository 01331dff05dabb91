/*
 * どこで: Inference サービス層
 * 何を: リクエスト本文 (JSON) を型付きの FeatureRecord へ明示的にデコードする
 * なぜ: schema を知らない入口で値の種類 (数値/カテゴリ) を確定させ、整列処理を型に沿って書くため
 */
package com.example.inference.service;

import com.example.inference.api.InvalidInferenceRequestException;
import com.example.inference.model.FeatureRecord;
import com.example.inference.model.FeatureValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FeatureRecordDecoder {

  private final ObjectMapper objectMapper;

  /**
   * 役割: JSON 本文を FeatureRecord に変換する。
   * 動作: 最上位はオブジェクトのみ受け付ける。有限の数値と文字列以外の値は UNSUPPORTED として残す。
   * 前提: 本文の形が不正なら InvalidInferenceRequestException。値の型とフィールドの過不足は整列側で判定する。
   */
  public FeatureRecord decode(String body) {
    if (body == null || body.isBlank()) {
      throw new InvalidInferenceRequestException("request body is required");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      // パーサの内部文言は露出しない
      throw new InvalidInferenceRequestException("request body is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new InvalidInferenceRequestException("request body must be a JSON object");
    }
    final Map<String, FeatureValue> values = new LinkedHashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      values.put(field.getKey(), toFeatureValue(field.getValue()));
    }
    return new FeatureRecord(values);
  }

  private FeatureValue toFeatureValue(JsonNode node) {
    if (node.isNumber() && Double.isFinite(node.asDouble())) {
      return FeatureValue.numeric(node.asDouble());
    }
    if (node.isTextual()) {
      return FeatureValue.categorical(node.asText());
    }
    // schema に無いフィールドなら aligner が無視する
    return FeatureValue.unsupported(node.toString());
  }
}
