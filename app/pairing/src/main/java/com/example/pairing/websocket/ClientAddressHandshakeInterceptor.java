package com.example.pairing.websocket;

import java.net.InetSocketAddress;
import java.util.Map;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

/** Stores the caller's address in the session attributes for connection logging. */
@Component
public class ClientAddressHandshakeInterceptor implements HandshakeInterceptor {

  public static final String ATTRIBUTE_CLIENT_IP = "client_ip";

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    final String clientIp = resolveClientIp(request);
    if (clientIp != null && !clientIp.isBlank()) {
      attributes.put(ATTRIBUTE_CLIENT_IP, clientIp);
    }
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      @Nullable Exception exception) {
    // no-op
  }

  private String resolveClientIp(ServerHttpRequest request) {
    final String xForwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      final InetSocketAddress remote = request.getRemoteAddress();
      return remote == null ? null : remote.getHostString();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
