/*
 * どこで: Inference サービス補助
 * 何を: 推論入力の正規化 JSON から SHA-256 ハッシュを生成する
 * なぜ: ledger に入力そのものを残さず、同一入力の同定と監査だけを可能にするため
 */
package com.example.inference.service;

import com.example.inference.model.FeatureRecord;
import com.example.inference.model.FeatureValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FeatureRecordHasher {

  private final ObjectMapper objectMapper;

  public String hash(FeatureRecord record) {
    // キー順を固定し、入力 JSON のフィールド順に依存しないようにする
    final Map<String, Object> canonical = new TreeMap<>();
    for (Map.Entry<String, FeatureValue> entry : record.values().entrySet()) {
      final FeatureValue value = entry.getValue();
      canonical.put(entry.getKey(), value.isNumeric() ? value.numeric() : value.category());
    }
    try {
      final String json = objectMapper.writeValueAsString(canonical);
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return toHex(digest.digest(json.getBytes(StandardCharsets.UTF_8)));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize feature record for hashing", ex);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
