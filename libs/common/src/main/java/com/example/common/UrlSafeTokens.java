/*
 * どこで: 共通ユーティリティ
 * 何を: 推測困難な URL セーフ文字列を生成する
 * なぜ: セッション ID を URL パスにそのまま載せて共有できるようにするため
 */
package com.example.common;

import java.security.SecureRandom;
import java.util.Base64;

public final class UrlSafeTokens {

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private UrlSafeTokens() {}

  /**
   * 役割: 指定バイト数の乱数を base64url (パディングなし) で返す。
   * 前提: byteLength は 1 以上であること。
   */
  public static String newToken(int byteLength) {
    if (byteLength < 1) {
      throw new IllegalArgumentException("byteLength must be positive: " + byteLength);
    }
    final byte[] bytes = new byte[byteLength];
    RANDOM.nextBytes(bytes);
    return ENCODER.encodeToString(bytes);
  }
}
