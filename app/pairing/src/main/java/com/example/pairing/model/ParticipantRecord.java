/*
 * どこで: Pairing ドメインモデル
 * 何を: participants テーブル相当のロスター構成員を表現する
 * なぜ: ログイン時の資格情報照合と提出フラグ参照を同じ構造で扱うため
 */
package com.example.pairing.model;

public record ParticipantRecord(
    String sessionId, String username, String passwordHash, boolean hasSubmitted) {}
