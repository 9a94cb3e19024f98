/*
 * どこで: Pairing API リクエスト
 * 何を: デコード済みの受信メッセージを表現する
 * なぜ: JSON 解析と状態遷移の処理を分離するため
 */
package com.example.pairing.api.request;

import com.example.pairing.model.Preferences;

public record InboundMessage(InboundType type, Preferences preferences, String text) {

  public static InboundMessage find(Preferences preferences) {
    return new InboundMessage(InboundType.FIND, preferences, null);
  }

  public static InboundMessage chat(String text) {
    return new InboundMessage(InboundType.CHAT, null, text);
  }

  public static InboundMessage of(InboundType type) {
    return new InboundMessage(type, null, null);
  }
}
