/*
 * どこで: Pairing API
 * 何を: ロスター内のユーザー名重複を表現する
 * なぜ: セッション作成時の衝突を 409 へ変換するため
 */
package com.example.pairing.api;

public class DuplicateParticipantException extends RuntimeException {
  public DuplicateParticipantException(String username) {
    super("duplicate username in roster: " + username);
  }
}
