/*
 * どこで: Pairing 設定
 * 何を: マッチング間隔・WebSocket 公開設定・送信制限・相手表示ラベルを保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.example.pairing.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pairing")
public record PairingProperties(
    @NotNull Duration matchInterval,
    boolean workerEnabled,
    @NotBlank String websocketPath,
    @NotEmpty List<String> allowedOrigins,
    @NotNull Duration sendTimeLimit,
    @Positive int sendBufferSizeLimit,
    @NotBlank String partnerName,
    @NotBlank String partnerBadge) {}
