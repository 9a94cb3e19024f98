/*
 * どこで: 共通ユーティリティ
 * 何を: 推測困難なランダム識別子を生成する
 * なぜ: 接続 ID や room ID を連番にせず SecureRandom から払い出すため
 */
package com.example.common;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class RandomIds {

  private static final int DEFAULT_BYTES = 16;
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  private RandomIds() {}

  public static String newId() {
    return newId(DEFAULT_BYTES);
  }

  public static String newId(int byteLength) {
    if (byteLength <= 0) {
      throw new IllegalArgumentException("byteLength must be positive");
    }
    final byte[] bytes = new byte[byteLength];
    RANDOM.nextBytes(bytes);
    return HEX.formatHex(bytes);
  }
}
