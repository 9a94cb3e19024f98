/*
 * どこで: Pairing API
 * 何を: 解釈できない受信メッセージを表現する
 * なぜ: 破棄理由をログとメトリクスへ渡すため
 */
package com.example.pairing.api;

public class MalformedInboundMessageException extends RuntimeException {

  private final String reason;

  public MalformedInboundMessageException(String reason, String message) {
    super(message);
    this.reason = reason;
  }

  public MalformedInboundMessageException(String reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public String reason() {
    return reason;
  }
}
