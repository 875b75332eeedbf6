/*
 * どこで: Pairing API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.pairing.api;

public enum ApiErrorCode {
  PAIRING_BAD_REQUEST,
  PAIRING_VALIDATION_ERROR,
  PAIRING_SESSION_NOT_FOUND,
  PAIRING_PARTICIPANT_NOT_FOUND,
  PAIRING_NOT_READY,
  PAIRING_DUPLICATE_PARTICIPANT,
  PAIRING_INVALID_CREDENTIALS,
  PAIRING_INTERNAL_ERROR
}
