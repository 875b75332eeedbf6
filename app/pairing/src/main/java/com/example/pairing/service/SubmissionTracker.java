/*
 * どこで: Pairing サービス層
 * 何を: 評価提出の受け付けと、提出状況に基づく結果計算の可否判定を担う
 * なぜ: 評価の全置換と提出フラグ更新を 1 トランザクションで整合させるため
 */
package com.example.pairing.service;

import com.example.pairing.api.InvalidPairingRequestException;
import com.example.pairing.api.PairingNotReadyException;
import com.example.pairing.api.ParticipantNotFoundException;
import com.example.pairing.api.SessionNotFoundException;
import com.example.pairing.model.PairingSessionRecord;
import com.example.pairing.model.SubmissionCounts;
import com.example.pairing.model.SubmissionStatus;
import com.example.pairing.repository.PairingSessionRepository;
import com.example.pairing.repository.SubmissionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class SubmissionTracker {

  static final int MIN_SCORE = 0;
  static final int MAX_SCORE = 100;

  private static final Logger logger = LoggerFactory.getLogger(SubmissionTracker.class);

  private final SubmissionRepository submissionRepository;
  private final PairingSessionRepository sessionRepository;
  private final PairingMetrics metrics;
  private final Clock clock;

  /**
   * 役割: 参加者 1 人分の評価行を受け付ける。
   * 動作: 自己評価/ロスター外の相手/0..100 の整数でないスコアは黙って捨て、残りで既存行を全置換し、
   *       提出済みフラグを立てる。
   * 前提: ratings はフィルタ前の時点で 1 件以上あること。
   */
  @Transactional
  public SubmissionCounts recordSubmission(
      String sessionId, String username, Map<String, ? extends Number> ratings) {
    if (username == null || username.isBlank()) {
      throw new InvalidPairingRequestException("username is required");
    }
    if (ratings == null || ratings.isEmpty()) {
      metrics.recordSubmission("rejected_empty", 0);
      throw new InvalidPairingRequestException("ratings must contain at least one entry");
    }
    requireSession(sessionId);
    if (!submissionRepository.lockParticipant(sessionId, username)) {
      throw new ParticipantNotFoundException(sessionId, username);
    }

    final Set<String> roster = new HashSet<>(submissionRepository.loadRoster(sessionId));
    final Map<String, Integer> accepted = acceptedRatings(username, roster, ratings);
    final int dropped = ratings.size() - accepted.size();
    submissionRepository.replaceRatings(sessionId, username, accepted, Instant.now(clock));
    submissionRepository.markSubmitted(sessionId, username);

    final SubmissionCounts counts = submissionRepository.submissionCounts(sessionId);
    metrics.recordSubmission("accepted", dropped);
    logger.info(
        "ratings submitted sessionId={} username={} accepted={} dropped={} progress={}/{}",
        sessionId,
        username,
        accepted.size(),
        dropped,
        counts.submitted(),
        counts.total());
    return counts;
  }

  public SubmissionStatus status(String sessionId) {
    final PairingSessionRecord session =
        sessionRepository
            .findSession(sessionId)
            .orElseThrow(() -> new SessionNotFoundException(sessionId));
    return new SubmissionStatus(session, submissionRepository.participantStatuses(sessionId));
  }

  public boolean isReadyForPairing(String sessionId) {
    requireSession(sessionId);
    return submissionRepository.submissionCounts(sessionId).readyForPairing();
  }

  /** 未提出者が残っていれば現在の提出数を添えて PairingNotReadyException を送出する。 */
  public SubmissionCounts requireReady(String sessionId) {
    requireSession(sessionId);
    final SubmissionCounts counts = submissionRepository.submissionCounts(sessionId);
    if (!counts.readyForPairing()) {
      throw new PairingNotReadyException(counts);
    }
    return counts;
  }

  private void requireSession(String sessionId) {
    if (sessionId == null || !submissionRepository.sessionExists(sessionId)) {
      throw new SessionNotFoundException(sessionId);
    }
  }

  private Map<String, Integer> acceptedRatings(
      String username, Set<String> roster, Map<String, ? extends Number> ratings) {
    final Map<String, Integer> accepted = new LinkedHashMap<>();
    ratings.forEach(
        (target, raw) -> {
          if (target == null || target.equals(username) || !roster.contains(target)) {
            return;
          }
          final Integer score = toScore(raw);
          if (score != null) {
            accepted.put(target, score);
          }
        });
    return accepted;
  }

  /** 0..100 の整数として表せない値は null。 */
  private static Integer toScore(Number raw) {
    if (raw == null) {
      return null;
    }
    if ((raw instanceof Double || raw instanceof Float) && !Double.isFinite(raw.doubleValue())) {
      return null;
    }
    final BigDecimal value = new BigDecimal(raw.toString());
    if (value.compareTo(BigDecimal.valueOf(MIN_SCORE)) < 0
        || value.compareTo(BigDecimal.valueOf(MAX_SCORE)) > 0) {
      return null;
    }
    if (value.stripTrailingZeros().scale() > 0) {
      return null;
    }
    return value.intValue();
  }
}
