package com.example.pairing.engine;

import com.example.pairing.model.RatingMatrix;

final class EngineFixtures {

  private EngineFixtures() {}

  /** A-B が最大だが、A-C と B-D の組み合わせの方が合計は高い。 */
  static RatingMatrix greedyTrap() {
    return RatingMatrix.builder()
        .rate("A", "B", 100)
        .rate("B", "A", 100)
        .rate("A", "C", 90)
        .rate("C", "A", 90)
        .rate("B", "D", 90)
        .rate("D", "B", 90)
        .build();
  }
}
