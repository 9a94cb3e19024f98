/*
 * どこで: Pairing Web 設定
 * 何を: WebSocket ハンドラとハンドシェイクインターセプタを登録する
 * なぜ: 接続ごとのクライアント情報をログへ残せるようにするため
 */
package com.example.pairing.config;

import com.example.pairing.websocket.ClientAddressHandshakeInterceptor;
import com.example.pairing.websocket.PairingWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

  private final PairingWebSocketHandler pairingWebSocketHandler;
  private final ClientAddressHandshakeInterceptor clientAddressHandshakeInterceptor;
  private final PairingProperties properties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(pairingWebSocketHandler, properties.websocketPath())
        .addInterceptors(clientAddressHandshakeInterceptor)
        .setAllowedOriginPatterns(properties.allowedOrigins().toArray(new String[0]));
  }
}
