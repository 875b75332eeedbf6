/*
 * どこで: Pairing API レスポンス DTO
 * 何を: ペアリング結果 API の応答を定義する
 * なぜ: 組・余り・集計値を 1 回の取得で返すため
 */
package com.example.pairing.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record PairingResultResponse(
    List<PairResponse> pairs,
    String unpaired,
    double totalCompatibility,
    double averageCompatibility,
    int numPairs) {}
