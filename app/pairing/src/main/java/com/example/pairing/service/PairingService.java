/*
 * どこで: Pairing サービス層
 * 何を: 評価提出/提出状況/結果計算の API 向け操作を提供する
 * なぜ: SubmissionTracker の判定と PairingEngine の計算を API 契約へつなぐため
 */
package com.example.pairing.service;

import com.example.pairing.api.InvalidPairingRequestException;
import com.example.pairing.api.PairingNotReadyException;
import com.example.pairing.api.request.SubmitRatingsRequest;
import com.example.pairing.api.response.PairResponse;
import com.example.pairing.api.response.PairingResultResponse;
import com.example.pairing.api.response.ParticipantStatusResponse;
import com.example.pairing.api.response.SessionStatusResponse;
import com.example.pairing.api.response.SubmitRatingsResponse;
import com.example.pairing.engine.PairingEngine;
import com.example.pairing.model.MatchedPair;
import com.example.pairing.model.PairingResult;
import com.example.pairing.model.RatingMatrix;
import com.example.pairing.model.SubmissionCounts;
import com.example.pairing.model.SubmissionStatus;
import com.example.pairing.repository.SubmissionRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class PairingService {

  private static final Logger logger = LoggerFactory.getLogger(PairingService.class);

  private final SubmissionTracker submissionTracker;
  private final SubmissionRepository submissionRepository;
  private final PairingEngine pairingEngine;
  private final PairingMetrics metrics;

  public SubmitRatingsResponse submit(String sessionId, SubmitRatingsRequest request) {
    final SubmissionCounts counts =
        submissionTracker.recordSubmission(sessionId, request.username(), request.ratings());
    return new SubmitRatingsResponse(
        "Preferences submitted", counts.submitted(), counts.total(), counts.allSubmitted());
  }

  public SessionStatusResponse status(String sessionId) {
    final SubmissionStatus status = submissionTracker.status(sessionId);
    final List<ParticipantStatusResponse> users =
        status.participants().stream()
            .map(p -> new ParticipantStatusResponse(p.username(), p.hasSubmitted()))
            .toList();
    return new SessionStatusResponse(
        status.session().sessionId(),
        status.session().name(),
        users,
        status.submitted(),
        status.total(),
        status.counts().allSubmitted());
  }

  /**
   * 役割: 全員の提出が揃ったセッションのペアリング結果を計算する。
   * 動作: ロスターと評価を同一スナップショットで読み込み、毎回計算し直す (結果はキャッシュしない)。
   * 前提: 提出が揃っていなければ PairingNotReadyException。
   */
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public PairingResultResponse computeResults(String sessionId) {
    try {
      submissionTracker.requireReady(sessionId);
    } catch (PairingNotReadyException ex) {
      metrics.recordResults("not_ready");
      throw ex;
    }
    final List<String> roster = submissionRepository.loadRoster(sessionId);
    final RatingMatrix ratings = submissionRepository.loadDirectedRatings(sessionId);
    final PairingResult result;
    try {
      result =
          metrics.recordCompute(
              pairingEngine.algorithm().value(), () -> pairingEngine.compute(roster, ratings));
    } catch (IllegalArgumentException ex) {
      // 厳密解の人数上限超過など、ロスター側の問題
      metrics.recordResults("rejected");
      throw new InvalidPairingRequestException(ex.getMessage(), ex);
    }
    metrics.recordResults("computed");
    logger.info(
        "pairing computed sessionId={} algorithm={} pairs={} unpaired={} average={}",
        sessionId,
        pairingEngine.algorithm().value(),
        result.numPairs(),
        result.unpaired(),
        result.averageCompatibility());
    return toResponse(result);
  }

  private PairingResultResponse toResponse(PairingResult result) {
    final List<PairResponse> pairs = result.pairs().stream().map(this::toPairResponse).toList();
    return new PairingResultResponse(
        pairs,
        result.unpaired(),
        result.totalCompatibility(),
        result.averageCompatibility(),
        result.numPairs());
  }

  private PairResponse toPairResponse(MatchedPair pair) {
    final Map<String, Integer> ratings = new LinkedHashMap<>();
    ratings.put(pair.personA(), pair.ratingAToB());
    ratings.put(pair.personB(), pair.ratingBToA());
    return new PairResponse(
        List.of(pair.personA(), pair.personB()), pair.compatibility(), ratings);
  }
}
