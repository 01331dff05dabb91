package com.example.inference.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.inference.TestArtifacts;
import com.example.inference.model.FeatureRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class FeatureRecordHasherTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final FeatureRecordHasher hasher = new FeatureRecordHasher(objectMapper);
  private final FeatureRecordDecoder decoder = new FeatureRecordDecoder(objectMapper);

  @Test
  void sameFieldsInDifferentOrderHashEqually() {
    final FeatureRecord ordered = decoder.decode(TestArtifacts.churnBody("Two year"));
    final FeatureRecord shuffled =
        decoder.decode(
            "{\"contract_type\":\"Two year\",\"monthly_charges\":70,\"age\":30,"
                + "\"usage\":50,\"tenure\":12}");

    assertThat(hasher.hash(ordered)).isEqualTo(hasher.hash(shuffled)).hasSize(64);
  }

  @Test
  void differentValuesHashDifferently() {
    assertThat(hasher.hash(TestArtifacts.churnRecord("Two year")))
        .isNotEqualTo(hasher.hash(TestArtifacts.churnRecord("One year")));
  }
}
