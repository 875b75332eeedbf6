/*
 * どこで: Pairing ドメインモデル
 * 何を: セッション単位の提出数/ロスター人数を保持する
 * なぜ: 結果計算の可否判定を一箇所に集約するため
 */
package com.example.pairing.model;

public record SubmissionCounts(int submitted, int total) {

  public boolean allSubmitted() {
    return submitted == total;
  }

  /** 空ロスターは全員提出済みとみなさない。 */
  public boolean readyForPairing() {
    return total > 0 && allSubmitted();
  }
}
