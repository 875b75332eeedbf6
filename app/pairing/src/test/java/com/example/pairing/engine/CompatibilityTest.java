/*
 * どこで: Pairing エンジンの単体テスト
 * 何を: 相性スコアの 2 桁丸めが十進の HALF_UP であることを固定する
 * なぜ: 2 進表現に引きずられる丸め (銀行家丸め等) に変わると .xx5 の境界で API の値がずれるため
 */
package com.example.pairing.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CompatibilityTest {

  @Test
  void roundsTiesAwayFromZero() {
    assertThat(Compatibility.round2(0.125)).isEqualTo(0.13);
    assertThat(Compatibility.round2(2.675)).isEqualTo(2.68);
    assertThat(Compatibility.round2(14.665)).isEqualTo(14.67);
  }

  @Test
  void keepsValuesAlreadyAtTwoDecimals() {
    assertThat(Compatibility.round2(87.5)).isEqualTo(87.5);
    assertThat(Compatibility.round2(0.0)).isEqualTo(0.0);
    assertThat(Compatibility.round2(14.666666666666666)).isEqualTo(14.67);
  }
}
