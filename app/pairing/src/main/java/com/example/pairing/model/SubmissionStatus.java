/*
 * どこで: Pairing ドメインモデル
 * 何を: 提出状況 (総数/提出数/ユーザーごとのフラグ) を表現する
 * なぜ: status API とテストで同じ集計結果を参照するため
 */
package com.example.pairing.model;

import java.util.List;

public record SubmissionStatus(
    PairingSessionRecord session, List<ParticipantStatus> participants) {

  public SubmissionStatus {
    participants = List.copyOf(participants);
  }

  public int total() {
    return participants.size();
  }

  public int submitted() {
    return (int) participants.stream().filter(ParticipantStatus::hasSubmitted).count();
  }

  public SubmissionCounts counts() {
    return new SubmissionCounts(submitted(), total());
  }
}
