/*
 * どこで: Pairing ドメインモデル
 * 何を: セッション内の有向評価 (from -> to -> score) の不変スナップショットを保持する
 * なぜ: エンジンへ明示的に渡す入力をグローバル状態から切り離すため
 */
package com.example.pairing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class RatingMatrix {

  private static final RatingMatrix EMPTY = new RatingMatrix(Map.of());

  private final Map<String, Map<String, Integer>> ratings;

  private RatingMatrix(Map<String, Map<String, Integer>> ratings) {
    this.ratings = ratings;
  }

  public static RatingMatrix empty() {
    return EMPTY;
  }

  /** 入力マップはコピーされ、以後の変更は反映されない。 */
  public static RatingMatrix of(Map<String, ? extends Map<String, Integer>> ratings) {
    final Map<String, Map<String, Integer>> copy = new LinkedHashMap<>();
    ratings.forEach((from, row) -> copy.put(from, Map.copyOf(row)));
    return new RatingMatrix(Collections.unmodifiableMap(copy));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** 未評価は 0 として扱う。 */
  public int score(String from, String to) {
    final Map<String, Integer> row = ratings.get(from);
    if (row == null) {
      return 0;
    }
    final Integer score = row.get(to);
    return score == null ? 0 : score;
  }

  public double mutualScore(String a, String b) {
    return (score(a, b) + score(b, a)) / 2.0;
  }

  public Map<String, Integer> ratingsFrom(String from) {
    return ratings.getOrDefault(from, Map.of());
  }

  public Map<String, Map<String, Integer>> asMap() {
    return ratings;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RatingMatrix matrix && ratings.equals(matrix.ratings);
  }

  @Override
  public int hashCode() {
    return ratings.hashCode();
  }

  @Override
  public String toString() {
    return "RatingMatrix" + ratings;
  }

  public static final class Builder {

    private final Map<String, Map<String, Integer>> ratings = new LinkedHashMap<>();

    private Builder() {}

    public Builder rate(String from, String to, int score) {
      ratings.computeIfAbsent(from, ignored -> new LinkedHashMap<>()).put(to, score);
      return this;
    }

    public RatingMatrix build() {
      return RatingMatrix.of(ratings);
    }
  }
}
