/*
 * どこで: Pairing ドメインモデル
 * 何を: ペア決定アルゴリズムの種別を定義する
 * なぜ: 設定値の妥当性を列挙型で固定するため
 */
package com.example.pairing.model;

public enum PairingAlgorithm {
  GREEDY("greedy"),
  EXACT("exact");

  private final String value;

  PairingAlgorithm(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * 役割: 設定文字列を列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static PairingAlgorithm fromValue(String algorithm) {
    for (PairingAlgorithm candidate : values()) {
      if (candidate.value.equalsIgnoreCase(algorithm)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported pairing algorithm: " + algorithm);
  }
}
