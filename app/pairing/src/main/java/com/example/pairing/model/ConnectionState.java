/*
 * どこで: Pairing ドメインモデル
 * 何を: 接続のライフサイクル状態を定義する
 * なぜ: idle/searching/chatting の排他性を型で表すため
 */
package com.example.pairing.model;

public enum ConnectionState {
  IDLE,
  SEARCHING,
  CHATTING
}
