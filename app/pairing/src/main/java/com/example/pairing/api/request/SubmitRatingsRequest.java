/*
 * どこで: Pairing API リクエスト DTO
 * 何を: 評価提出 API の入力を定義する
 * なぜ: ratings のキーはユーザー名そのものなので命名変換の対象外として受けるため
 *       値は Number で受け、int 範囲外や小数でも本文全体を拒否せず行単位で捨てられるようにする
 */
package com.example.pairing.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record SubmitRatingsRequest(
    @NotBlank(message = "username is required") String username, Map<String, Number> ratings) {}
