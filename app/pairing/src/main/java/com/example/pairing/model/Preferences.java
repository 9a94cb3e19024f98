/*
 * どこで: Pairing ドメインモデル
 * 何を: マッチング希望条件 (相手の性別・レベル) を表現する
 * なぜ: Pool Entry に enqueue 時点のスナップショットとして保持するため
 */
package com.example.pairing.model;

public record Preferences(Gender desiredPartnerGender, SkillLevel level) {

  public static final Preferences ANY = new Preferences(Gender.ANY, SkillLevel.ANY);

  public Preferences {
    desiredPartnerGender = desiredPartnerGender == null ? Gender.ANY : desiredPartnerGender;
    level = level == null ? SkillLevel.ANY : level;
  }
}
