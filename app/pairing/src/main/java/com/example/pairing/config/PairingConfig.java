/*
 * どこで: Pairing インフラ設定
 * 何を: Clock・コーディネータ専用の単一スレッド Executor・送信用 Executor を提供する
 * なぜ: 全ての状態遷移を 1 スレッドで逐次実行し、遅いクライアントへの送信でそのスレッドを止めないため
 */
package com.example.pairing.config;

import com.example.pairing.api.PartnerDescriptor;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PairingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "")
  public ExecutorService pairingCoordinatorExecutor() {
    return Executors.newSingleThreadExecutor(
        new ThreadFactoryBuilder().setNameFormat("pairing-coordinator-%d").setDaemon(false).build());
  }

  @Bean
  public ExecutorService pairingOutboundExecutor() {
    return Executors.newCachedThreadPool(
        new ThreadFactoryBuilder().setNameFormat("pairing-outbound-%d").setDaemon(true).build());
  }

  @Bean
  public PartnerDescriptor partnerDescriptor(PairingProperties properties) {
    return new PartnerDescriptor(properties.partnerName(), properties.partnerBadge());
  }
}
