/*
 * どこで: Pairing API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: WebSocket と同じポートで死活確認できるようにするため
 */
package com.example.pairing.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  static final String STATUS_TEXT = "sayra matchmaking server is running.\n";

  @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
  public String home() {
    return STATUS_TEXT;
  }
}
