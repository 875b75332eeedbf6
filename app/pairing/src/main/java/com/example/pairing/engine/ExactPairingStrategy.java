/*
 * どこで: Pairing エンジン
 * 何を: 部分集合 DP で合計相互スコア最大のマッチングを求める
 * なぜ: 貪欲法の局所最適を避けたい運用向けに、設定で切り替え可能な厳密解を提供するため
 */
package com.example.pairing.engine;

import com.example.pairing.model.MatchedPair;
import com.example.pairing.model.PairingAlgorithm;
import com.example.pairing.model.RatingMatrix;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ExactPairingStrategy implements PairingStrategy {

  private static final Logger logger = LoggerFactory.getLogger(ExactPairingStrategy.class);

  private static final Comparator<MatchedPair> PICK_ORDER =
      Comparator.comparingDouble(MatchedPair::compatibility)
          .reversed()
          .thenComparing(MatchedPair::personA)
          .thenComparing(MatchedPair::personB);

  private final int maxParticipants;

  public ExactPairingStrategy(int maxParticipants) {
    if (maxParticipants < 2 || maxParticipants > 24) {
      throw new IllegalArgumentException("maxParticipants must be within [2, 24]: " + maxParticipants);
    }
    this.maxParticipants = maxParticipants;
  }

  @Override
  public List<MatchedPair> pair(List<String> people, RatingMatrix ratings) {
    final List<String> names = Compatibility.candidateOrder(people);
    final int n = names.size();
    if (n > maxParticipants) {
      throw new IllegalArgumentException(
          "exact pairing supports at most " + maxParticipants + " participants: " + n);
    }
    final double[][] weight = new double[n][n];
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        weight[i][j] = ratings.mutualScore(names.get(i), names.get(j));
      }
    }

    final Solver solver = new Solver(weight);
    final int full = (1 << n) - 1;
    solver.best(full);

    final List<MatchedPair> pairs = new ArrayList<>();
    int mask = full;
    while (mask != 0) {
      final int i = Integer.numberOfTrailingZeros(mask);
      final int j = solver.partner[mask];
      if (j < 0) {
        mask &= ~(1 << i);
        continue;
      }
      pairs.add(Compatibility.matched(names.get(i), names.get(j), ratings));
      mask &= ~((1 << i) | (1 << j));
    }
    pairs.sort(PICK_ORDER);
    logger.debug("exact pairing participants={} total={}", n, solver.memo[full]);
    return pairs;
  }

  @Override
  public PairingAlgorithm algorithm() {
    return PairingAlgorithm.EXACT;
  }

  /** memo[mask] = mask 内の最大合計。partner[mask] = 最下位ビットの相手 (-1 は余り)。 */
  private static final class Solver {

    private final double[][] weight;
    private final double[] memo;
    private final int[] partner;

    private Solver(double[][] weight) {
      this.weight = weight;
      final int size = 1 << weight.length;
      this.memo = new double[size];
      this.partner = new int[size];
      Arrays.fill(memo, Double.NaN);
    }

    private double best(int mask) {
      if (mask == 0) {
        return 0;
      }
      if (!Double.isNaN(memo[mask])) {
        return memo[mask];
      }
      final int i = Integer.numberOfTrailingZeros(mask);
      final int rest = mask & ~(1 << i);
      double bestScore = Double.NEGATIVE_INFINITY;
      int bestPartner = -1;
      // 候補 (i, j) は j 昇順に評価し、同点なら先のものを残す
      for (int j = i + 1; j < weight.length; j++) {
        if ((rest & (1 << j)) == 0) {
          continue;
        }
        final double score = weight[i][j] + best(rest & ~(1 << j));
        if (score > bestScore) {
          bestScore = score;
          bestPartner = j;
        }
      }
      // 奇数人のときだけ 1 人を余らせてよい
      if (Integer.bitCount(mask) % 2 == 1) {
        final double score = best(rest);
        if (score > bestScore) {
          bestScore = score;
          bestPartner = -1;
        }
      }
      memo[mask] = bestScore;
      partner[mask] = bestPartner;
      return bestScore;
    }
  }
}
