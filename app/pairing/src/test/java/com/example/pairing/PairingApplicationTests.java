/*
 * どこで: Pairing アプリの結合テスト
 * 何を: 実サーバを起動し WebSocket 経由で find → matched → chat → partner_left を確認する
 * なぜ: コーディネータと WebSocket 配線がまとめて動くことを担保するため
 */
package com.example.pairing;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class PairingApplicationTests {

  private static final long TIMEOUT_SECONDS = 5;

  private final ObjectMapper objectMapper = new ObjectMapper();

  @LocalServerPort private int port;

  @Autowired private TestRestTemplate restTemplate;

  @Test
  void contextLoads() {}

  @Test
  void statusEndpointRespondsWithPlainText() {
    final ResponseEntity<String> response = restTemplate.getForEntity("/", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo("sayra matchmaking server is running.\n");
  }

  @Test
  void twoClientsArePairedAndChat() throws Exception {
    final Client alice = connect();
    final Client bob = connect();

    final JsonNode aliceHello = alice.next();
    final JsonNode bobHello = bob.next();
    assertThat(aliceHello.get("type").asText()).isEqualTo("hello");
    assertThat(bobHello.get("id").asText()).isNotEqualTo(aliceHello.get("id").asText());

    alice.send("{\"type\":\"find\"}");
    assertThat(alice.next().get("type").asText()).isEqualTo("searching");
    bob.send("{\"type\":\"find\"}");
    assertThat(bob.next().get("type").asText()).isEqualTo("searching");

    final JsonNode aliceMatched = alice.next();
    final JsonNode bobMatched = bob.next();
    assertThat(aliceMatched.get("type").asText()).isEqualTo("matched");
    assertThat(bobMatched.get("type").asText()).isEqualTo("matched");
    assertThat(aliceMatched.get("roomId").asText()).isEqualTo(bobMatched.get("roomId").asText());
    assertThat(aliceMatched.get("partner").get("name").asText()).isEqualTo("Partner");

    alice.send("{\"type\":\"chat\",\"text\":\"hi\"}");
    final JsonNode relayed = bob.next();
    assertThat(relayed.get("type").asText()).isEqualTo("chat");
    assertThat(relayed.get("text").asText()).isEqualTo("hi");

    bob.session.close(CloseStatus.NORMAL);
    assertThat(alice.next().get("type").asText()).isEqualTo("partner_left");

    alice.session.close(CloseStatus.NORMAL);
  }

  private Client connect() throws Exception {
    final Client client = new Client();
    client.session =
        new StandardWebSocketClient()
            .execute(client, "ws://localhost:{port}/ws", port)
            .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    return client;
  }

  private final class Client extends TextWebSocketHandler {

    private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
    private WebSocketSession session;

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
      inbox.add(message.getPayload());
    }

    JsonNode next() throws Exception {
      final String payload = inbox.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
      assertThat(payload).as("message within %ss", TIMEOUT_SECONDS).isNotNull();
      return objectMapper.readTree(payload);
    }

    void send(String json) throws Exception {
      session.sendMessage(new TextMessage(json));
    }
  }
}
