/*
 * どこで: Pairing アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: WebSocket + Worker + 状態確認エンドポイントを単一プロセスとして起動するため
 */
package com.example.pairing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class PairingApplication {

  public static void main(String[] args) {
    SpringApplication.run(PairingApplication.class, args);
  }
}
