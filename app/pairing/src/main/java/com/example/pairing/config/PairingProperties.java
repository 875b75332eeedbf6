/*
 * どこで: Pairing 設定
 * 何を: ロスター人数下限/既定パスワード/セッション ID 長/アルゴリズム選択を保持する
 * なぜ: 運用パラメータをコード外へ出し、起動時に妥当性を検証するため
 */
package com.example.pairing.config;

import com.example.pairing.model.PairingAlgorithm;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "pairing")
@Validated
public record PairingProperties(
    @Min(2) int minParticipants,
    @NotBlank String defaultSharedPassword,
    @Min(16) @Max(64) int sessionIdBytes,
    @NotBlank String algorithm,
    @Min(2) @Max(24) int exactMaxParticipants) {

  @AssertTrue(message = "pairing.algorithm must be one of greedy, exact")
  public boolean isAlgorithmSupported() {
    try {
      pairingAlgorithm();
      return true;
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  public PairingAlgorithm pairingAlgorithm() {
    return PairingAlgorithm.fromValue(algorithm);
  }
}
