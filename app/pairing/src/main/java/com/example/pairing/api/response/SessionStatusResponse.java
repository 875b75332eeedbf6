/*
 * どこで: Pairing API レスポンス DTO
 * 何を: 提出状況 API の応答を定義する
 * なぜ: クライアントが結果取得可否をポーリングで判断できるようにするため
 */
package com.example.pairing.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record SessionStatusResponse(
    String sessionId,
    String sessionName,
    List<ParticipantStatusResponse> users,
    int submitted,
    int total,
    boolean allSubmitted) {}
