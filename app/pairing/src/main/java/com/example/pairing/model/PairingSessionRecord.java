/*
 * どこで: Pairing ドメインモデル
 * 何を: pairing_sessions テーブル相当のセッション情報を表現する
 * なぜ: Repository と Service 間で受け渡す構造を固定するため
 */
package com.example.pairing.model;

import java.time.Instant;

public record PairingSessionRecord(String sessionId, String name, Instant createdAt, boolean active) {}
