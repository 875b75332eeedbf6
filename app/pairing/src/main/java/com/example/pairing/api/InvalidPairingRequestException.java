/*
 * どこで: Pairing API
 * 何を: リクエスト妥当性エラーを表現する
 * なぜ: 空の評価提出やロスター不備を 400 へ正規化するため
 */
package com.example.pairing.api;

public class InvalidPairingRequestException extends RuntimeException {
  public InvalidPairingRequestException(String message) {
    super(message);
  }

  public InvalidPairingRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
