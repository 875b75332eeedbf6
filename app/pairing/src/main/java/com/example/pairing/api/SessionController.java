/*
 * どこで: Pairing API
 * 何を: セッション作成/ログイン/提出状況のエンドポイントを公開する
 * なぜ: ロスター登録と参加者の入口をクライアントへ提供するため
 */
package com.example.pairing.api;

import com.example.pairing.api.request.CreateSessionRequest;
import com.example.pairing.api.request.LoginRequest;
import com.example.pairing.api.response.CreateSessionResponse;
import com.example.pairing.api.response.LoginResponse;
import com.example.pairing.api.response.SessionStatusResponse;
import com.example.pairing.service.PairingService;
import com.example.pairing.service.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final SessionService sessionService;
  private final PairingService pairingService;

  @PostMapping
  public ResponseEntity<CreateSessionResponse> createSession(
      @Valid @RequestBody CreateSessionRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.createSession(request));
  }

  @PostMapping("/{sessionId}/login")
  public ResponseEntity<LoginResponse> login(
      @PathVariable("sessionId") String sessionId, @Valid @RequestBody LoginRequest request) {
    return ResponseEntity.ok(sessionService.login(sessionId, request));
  }

  @GetMapping("/{sessionId}/status")
  public ResponseEntity<SessionStatusResponse> status(@PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(pairingService.status(sessionId));
  }
}
