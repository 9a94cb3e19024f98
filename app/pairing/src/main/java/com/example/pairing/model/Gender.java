/*
 * どこで: Pairing ドメインモデル
 * 何を: 希望する相手の性別を定義する
 * なぜ: prefs.gender の入力値を列挙型で固定するため
 */
package com.example.pairing.model;

public enum Gender {
  MALE("male"),
  FEMALE("female"),
  ANY("any");

  private final String value;

  Gender(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: クライアントから受け取った gender 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、null・空文字・未対応値は ANY とする。
   */
  public static Gender fromValueOrAny(String gender) {
    if (gender == null || gender.isBlank()) {
      return ANY;
    }
    for (Gender candidate : values()) {
      if (candidate.value.equalsIgnoreCase(gender)) {
        return candidate;
      }
    }
    return ANY;
  }
}
