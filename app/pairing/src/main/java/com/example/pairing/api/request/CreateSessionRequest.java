/*
 * どこで: Pairing API リクエスト DTO
 * 何を: セッション作成 API の入力を定義する
 * なぜ: 共有パスワード方式 (usernames) と個別パスワード方式 (users) を 1 つの契約で受けるため
 */
package com.example.pairing.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record CreateSessionRequest(
    @NotBlank(message = "session_name is required") String sessionName,
    List<String> usernames,
    String password,
    List<ParticipantCredential> users) {}
