/*
 * どこで: Pairing Repository 層
 * 何を: ロスター/有向評価/提出数の永続化操作を抽象化する
 * なぜ: 提出管理とペアリング計算を保存方式の詳細から切り離すため
 */
package com.example.pairing.repository;

import com.example.pairing.model.ParticipantStatus;
import com.example.pairing.model.RatingMatrix;
import com.example.pairing.model.SubmissionCounts;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public interface SubmissionRepository {

  /** 役割: セッションの存在確認。 */
  boolean sessionExists(String sessionId);

  /** 役割: ロスターを作成順で返す。 動作: 未登録セッションは空リスト。 */
  List<String> loadRoster(String sessionId);

  /** 役割: セッション内の有向評価をすべて読み込み、不変スナップショットとして返す。 */
  RatingMatrix loadDirectedRatings(String sessionId);

  /**
   * 役割: 提出者の行を排他ロックする。
   * 動作: 対象が存在すれば true、存在しなければ false を返す。
   * 前提: 呼び出し側トランザクション内で実行すること。
   */
  boolean lockParticipant(String sessionId, String username);

  /**
   * 役割: 提出者の評価を全置換する。
   * 動作: fromUser の既存行をすべて削除してから newRatings を挿入する。
   * 前提: newRatings は検証済み (自己評価なし、0..100) であること。
   */
  void replaceRatings(
      String sessionId, String fromUser, Map<String, Integer> newRatings, Instant submittedAt);

  /** 役割: 提出済みフラグを立てる。 動作: 既に true でもそのまま true。 */
  void markSubmitted(String sessionId, String username);

  SubmissionCounts submissionCounts(String sessionId);

  /** 役割: ユーザーごとの提出フラグを作成順で返す。 */
  List<ParticipantStatus> participantStatuses(String sessionId);
}
