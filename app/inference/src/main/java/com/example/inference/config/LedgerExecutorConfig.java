/*
 * どこで: Inference アプリのインフラ設定
 * 何を: ledger 追記専用の有界スレッドプールを提供する
 * なぜ: 予測応答と ledger 書き込みを切り離し、クライアント切断後も追記を完了させるため
 */
package com.example.inference.config;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class LedgerExecutorConfig {

  public static final String LEDGER_EXECUTOR = "ledgerExecutor";

  @Bean(name = LEDGER_EXECUTOR)
  public ThreadPoolTaskExecutor ledgerExecutor(InferenceLedgerProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.writerThreads());
    executor.setMaxPoolSize(properties.writerThreads());
    executor.setQueueCapacity(properties.writerQueueCapacity());
    executor.setThreadNamePrefix("ledger-");
    executor.setTaskDecorator(mdcPropagatingDecorator());
    // 停止時はキュー済みの追記を流し切ってから終了する
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }

  static TaskDecorator mdcPropagatingDecorator() {
    return runnable -> {
      final Map<String, String> context = MDC.getCopyOfContextMap();
      return () -> {
        if (context != null) {
          MDC.setContextMap(context);
        }
        try {
          runnable.run();
        } finally {
          MDC.clear();
        }
      };
    };
  }
}
