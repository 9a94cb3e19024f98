/*
 * どこで: Pairing ドメインモデル
 * 何を: 会話レベルの希望を定義する
 * なぜ: prefs.level の入力値を列挙型で固定するため
 */
package com.example.pairing.model;

public enum SkillLevel {
  BEGINNER("beginner"),
  INTERMEDIATE("intermediate"),
  ADVANCED("advanced"),
  ANY("any");

  private final String value;

  SkillLevel(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** null・空文字・未対応値は ANY として扱う。 */
  public static SkillLevel fromValueOrAny(String level) {
    if (level == null || level.isBlank()) {
      return ANY;
    }
    for (SkillLevel candidate : values()) {
      if (candidate.value.equalsIgnoreCase(level)) {
        return candidate;
      }
    }
    return ANY;
  }
}
