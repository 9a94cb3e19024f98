/*
 * どこで: Pairing API リクエスト
 * 何を: クライアントから受け付ける type 値を定義する
 * なぜ: 未知の type を型レベルで弾くため
 */
package com.example.pairing.api.request;

import java.util.Optional;

public enum InboundType {
  FIND("find"),
  CANCEL("cancel"),
  CHAT("chat"),
  LEAVE("leave");

  private final String value;

  InboundType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** type は大文字小文字を区別して照合する。 */
  public static Optional<InboundType> fromValue(String type) {
    for (InboundType candidate : values()) {
      if (candidate.value.equals(type)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }
}
