/*
 * どこで: common のイベント payload 定義
 * 何を: outcome feed から届く実測ラベルの形状を定義する
 * なぜ: HTTP と NATS のどちらから届いても同じ形で ledger へ渡すため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OutcomeEventPayload(String requestId, Integer realizedLabel, String observedAt) {}
