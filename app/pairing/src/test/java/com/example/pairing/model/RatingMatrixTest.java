package com.example.pairing.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RatingMatrixTest {

  @Test
  void missingRatingCountsAsZero() {
    final RatingMatrix matrix = RatingMatrix.builder().rate("Alice", "Bob", 90).build();

    assertThat(matrix.score("Alice", "Bob")).isEqualTo(90);
    assertThat(matrix.score("Bob", "Alice")).isZero();
    assertThat(matrix.score("Charlie", "Alice")).isZero();
  }

  @Test
  void mutualScoreAveragesBothDirections() {
    final RatingMatrix matrix =
        RatingMatrix.builder().rate("Alice", "Bob", 90).rate("Bob", "Alice", 80).build();

    assertThat(matrix.mutualScore("Alice", "Bob")).isEqualTo(85.0);
    assertThat(matrix.mutualScore("Bob", "Alice")).isEqualTo(85.0);
  }

  @Test
  void ofCopiesInputSoLaterChangesAreInvisible() {
    final Map<String, Integer> row = new LinkedHashMap<>();
    row.put("Bob", 10);
    final Map<String, Map<String, Integer>> source = new LinkedHashMap<>();
    source.put("Alice", row);

    final RatingMatrix matrix = RatingMatrix.of(source);
    row.put("Bob", 99);

    assertThat(matrix.score("Alice", "Bob")).isEqualTo(10);
    assertThatThrownBy(() -> matrix.asMap().put("Eve", Map.of()))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void equalMatricesCompareEqual() {
    final RatingMatrix left = RatingMatrix.builder().rate("a", "b", 1).build();
    final RatingMatrix right = RatingMatrix.of(Map.of("a", Map.of("b", 1)));

    assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
    assertThat(RatingMatrix.empty().ratingsFrom("a")).isEmpty();
  }
}
