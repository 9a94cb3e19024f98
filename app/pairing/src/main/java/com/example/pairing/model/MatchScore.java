/*
 * どこで: Pairing ドメインモデル
 * 何を: ペア候補のスコア内訳を表現する
 * なぜ: 希望一致分と待機ボーナスを分けて検証できるようにするため
 */
package com.example.pairing.model;

public record MatchScore(int base, double waitBonus) {

  public double total() {
    return base + waitBonus;
  }
}
