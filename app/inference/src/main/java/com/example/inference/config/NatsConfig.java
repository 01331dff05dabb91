/*
 * どこで: Inference アプリのインフラ設定
 * 何を: NATS Connection と JetStream を Spring 管理下に置く
 * なぜ: 再学習シグナルの publisher と outcome subscriber が同一接続を再利用するため
 */
package com.example.inference.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true")
public class NatsConfig {

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .build();
    return Nats.connect(options);
  }

  @Bean
  public JetStream jetStream(Connection natsConnection) throws IOException {
    return natsConnection.jetStream();
  }
}
