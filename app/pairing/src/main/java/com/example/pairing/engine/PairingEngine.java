/*
 * どこで: Pairing エンジン
 * 何を: ロスターと評価スナップショットからペアリング結果と集計値を計算する
 * なぜ: I/O を持たない純粋な計算として、同一入力に同一結果を返すため
 */
package com.example.pairing.engine;

import com.example.pairing.model.MatchedPair;
import com.example.pairing.model.PairingAlgorithm;
import com.example.pairing.model.PairingResult;
import com.example.pairing.model.RatingMatrix;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public class PairingEngine {

  private final PairingStrategy strategy;

  public PairingEngine(PairingStrategy strategy) {
    this.strategy = Objects.requireNonNull(strategy, "strategy");
  }

  public PairingAlgorithm algorithm() {
    return strategy.algorithm();
  }

  /**
   * 役割: ペアリングを計算する。
   * 動作: 2 人未満なら 0 組・合計 0 を返し、1 人ならその人を unpaired とする。
   * 前提: people は重複を含まないこと。ratings はこの呼び出し中に変化しないこと。
   */
  public PairingResult compute(List<String> people, RatingMatrix ratings) {
    Objects.requireNonNull(people, "people");
    Objects.requireNonNull(ratings, "ratings");
    if (new HashSet<>(people).size() != people.size()) {
      throw new IllegalArgumentException("people must not contain duplicates");
    }

    final List<MatchedPair> pairs = people.size() < 2 ? List.of() : strategy.pair(people, ratings);
    final String unpaired = resolveUnpaired(people, pairs);

    double sum = 0;
    for (MatchedPair pair : pairs) {
      sum += pair.compatibility();
    }
    final double total = Compatibility.round2(sum);
    final double average = pairs.isEmpty() ? 0 : Compatibility.round2(sum / pairs.size());
    return new PairingResult(pairs, unpaired, total, average);
  }

  /** 全員が 1 組か unpaired のどちらかにちょうど 1 回現れることを検証する。 */
  private String resolveUnpaired(List<String> people, List<MatchedPair> pairs) {
    final Set<String> assigned = new HashSet<>();
    for (MatchedPair pair : pairs) {
      if (!assigned.add(pair.personA()) || !assigned.add(pair.personB())) {
        throw new IllegalStateException("participant assigned twice: " + pair);
      }
    }
    final List<String> leftover = people.stream().filter(p -> !assigned.contains(p)).toList();
    if (leftover.size() > 1 || assigned.size() + leftover.size() != people.size()) {
      throw new IllegalStateException("pairing left more than one participant: " + leftover);
    }
    return leftover.isEmpty() ? null : leftover.get(0);
  }
}
