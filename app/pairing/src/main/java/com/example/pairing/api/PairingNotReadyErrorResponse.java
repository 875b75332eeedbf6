/*
 * どこで: Pairing API
 * 何を: 結果要求が早すぎた場合の応答を定義する
 * なぜ: クライアントが現在の提出数を見てポーリングを続けられるようにするため
 */
package com.example.pairing.api;

public record PairingNotReadyErrorResponse(
    ApiErrorCode code, String message, int submitted, int total) {}
