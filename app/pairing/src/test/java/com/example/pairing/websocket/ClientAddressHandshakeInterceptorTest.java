package com.example.pairing.websocket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;

class ClientAddressHandshakeInterceptorTest {

  private final ClientAddressHandshakeInterceptor interceptor =
      new ClientAddressHandshakeInterceptor();

  private ServerHttpRequest request;
  private HttpHeaders headers;
  private Map<String, Object> attributes;

  @BeforeEach
  void setUp() {
    request = mock(ServerHttpRequest.class);
    headers = new HttpHeaders();
    attributes = new HashMap<>();
    when(request.getHeaders()).thenReturn(headers);
  }

  @Test
  void usesFirstForwardedAddress() {
    headers.add("X-Forwarded-For", " 203.0.113.9 , 10.0.0.1");

    final boolean proceed = handshake();

    assertThat(proceed).isTrue();
    assertThat(attributes).containsEntry(ClientAddressHandshakeInterceptor.ATTRIBUTE_CLIENT_IP, "203.0.113.9");
  }

  @Test
  void fallsBackToRemoteAddress() {
    when(request.getRemoteAddress()).thenReturn(new InetSocketAddress("192.0.2.5", 5000));

    handshake();

    assertThat(attributes).containsEntry(ClientAddressHandshakeInterceptor.ATTRIBUTE_CLIENT_IP, "192.0.2.5");
  }

  @Test
  void unknownAddressStillAcceptsHandshake() {
    final boolean proceed = handshake();

    assertThat(proceed).isTrue();
    assertThat(attributes).isEmpty();
  }

  private boolean handshake() {
    return interceptor.beforeHandshake(
        request, mock(ServerHttpResponse.class), mock(WebSocketHandler.class), attributes);
  }
}
