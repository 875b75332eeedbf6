/*
 * どこで: Pairing エンジン
 * 何を: 残り候補から相互スコア最大のペアを繰り返し選ぶ貪欲法を実装する
 * なぜ: 小規模ロスター向けに単純で再現性のある既定アルゴリズムを提供するため
 */
package com.example.pairing.engine;

import com.example.pairing.model.MatchedPair;
import com.example.pairing.model.PairingAlgorithm;
import com.example.pairing.model.RatingMatrix;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GreedyPairingStrategy implements PairingStrategy {

  private static final Logger logger = LoggerFactory.getLogger(GreedyPairingStrategy.class);

  @Override
  public List<MatchedPair> pair(List<String> people, RatingMatrix ratings) {
    final List<String> available = Compatibility.candidateOrder(people);
    final List<MatchedPair> pairs = new ArrayList<>();

    while (available.size() >= 2) {
      int bestA = -1;
      int bestB = -1;
      double bestScore = -1;
      // 同点は列挙順で先に現れたペアを残す (strictly greater のみ更新)
      for (int i = 0; i < available.size(); i++) {
        for (int j = i + 1; j < available.size(); j++) {
          final double score = ratings.mutualScore(available.get(i), available.get(j));
          if (score > bestScore) {
            bestScore = score;
            bestA = i;
            bestB = j;
          }
        }
      }
      final String a = available.get(bestA);
      final String b = available.get(bestB);
      pairs.add(Compatibility.matched(a, b, ratings));
      // j > i なので後ろから外す
      available.remove(bestB);
      available.remove(bestA);
      logger.debug("greedy pick a={} b={} score={}", a, b, bestScore);
    }
    return pairs;
  }

  @Override
  public PairingAlgorithm algorithm() {
    return PairingAlgorithm.GREEDY;
  }
}
