/*
 * どこで: Pairing API
 * 何を: 全員の提出が揃う前の結果要求を表現する
 * なぜ: 現在の提出数を添えて 409 応答へ変換するため
 */
package com.example.pairing.api;

import com.example.pairing.model.SubmissionCounts;

public class PairingNotReadyException extends RuntimeException {

  private final SubmissionCounts counts;

  public PairingNotReadyException(SubmissionCounts counts) {
    super("not all preferences submitted: " + counts.submitted() + "/" + counts.total());
    this.counts = counts;
  }

  public SubmissionCounts counts() {
    return counts;
  }
}
