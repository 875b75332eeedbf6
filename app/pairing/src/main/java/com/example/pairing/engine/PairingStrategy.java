package com.example.pairing.engine;

import com.example.pairing.model.MatchedPair;
import com.example.pairing.model.PairingAlgorithm;
import com.example.pairing.model.RatingMatrix;
import java.util.List;

public interface PairingStrategy {

  /**
   * 役割: ロスターと評価スナップショットからペアを決める。
   * 動作: 各ペアは personA &lt; personB (辞書順) で返す。偶数人なら全員、奇数人なら 1 人を除く全員を割り当てる。
   * 前提: people は重複を含まず 2 人以上であること。
   */
  List<MatchedPair> pair(List<String> people, RatingMatrix ratings);

  PairingAlgorithm algorithm();
}
