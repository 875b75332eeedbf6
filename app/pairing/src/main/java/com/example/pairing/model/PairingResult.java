/*
 * どこで: Pairing ドメインモデル
 * 何を: ペアリング結果と集計値を表現する
 * なぜ: 同一入力で同一結果を返す契約をレコードの等価性で検証できるようにするため
 */
package com.example.pairing.model;

import java.util.List;

public record PairingResult(
    List<MatchedPair> pairs,
    String unpaired,
    double totalCompatibility,
    double averageCompatibility) {

  public PairingResult {
    pairs = List.copyOf(pairs);
  }

  public int numPairs() {
    return pairs.size();
  }
}
