/*
 * どこで: Pairing エンジン
 * 何を: 相性スコアの丸めと候補の列挙順を提供する
 * なぜ: 戦略ごとに丸め/タイブレーク規則がずれないようにするため
 */
package com.example.pairing.engine;

import com.example.pairing.model.MatchedPair;
import com.example.pairing.model.RatingMatrix;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

final class Compatibility {

  private Compatibility() {}

  static double round2(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  /** String#compareTo による昇順。候補ペア (a, b) は常に a &lt; b となる。 */
  static List<String> candidateOrder(List<String> people) {
    return new ArrayList<>(new TreeSet<>(people));
  }

  static MatchedPair matched(String a, String b, RatingMatrix ratings) {
    return new MatchedPair(
        a, b, ratings.score(a, b), ratings.score(b, a), round2(ratings.mutualScore(a, b)));
  }
}
