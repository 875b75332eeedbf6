/*
 * どこで: Pairing ドメインモデル
 * 何を: 成立した 1 組と双方向の評価値、相性スコアを表現する
 * なぜ: エンジン出力を API 応答へ欠落なく受け渡すため
 */
package com.example.pairing.model;

/** personA は辞書順で personB より前に来る。 */
public record MatchedPair(
    String personA, String personB, int ratingAToB, int ratingBToA, double compatibility) {}
