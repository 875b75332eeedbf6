/*
 * どこで: Pairing API レスポンス DTO
 * 何を: セッション作成 API の応答を定義する
 * なぜ: 主催者が参加者へ配布する ID とパスワードをまとめて返すため
 */
package com.example.pairing.api.response;

import com.example.pairing.api.request.ParticipantCredential;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record CreateSessionResponse(
    String message, String sessionId, String sessionName, List<ParticipantCredential> users) {}
