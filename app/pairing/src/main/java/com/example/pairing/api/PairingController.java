/*
 * どこで: Pairing API
 * 何を: 評価提出とペアリング結果取得のエンドポイントを公開する
 * なぜ: 提出が揃ったセッションの結果を要求時に計算して返すため
 */
package com.example.pairing.api;

import com.example.pairing.api.request.SubmitRatingsRequest;
import com.example.pairing.api.response.PairingResultResponse;
import com.example.pairing.api.response.SubmitRatingsResponse;
import com.example.pairing.service.PairingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sessions/{sessionId}")
@RequiredArgsConstructor
public class PairingController {

  private final PairingService pairingService;

  @PostMapping("/ratings")
  public ResponseEntity<SubmitRatingsResponse> submitRatings(
      @PathVariable("sessionId") String sessionId,
      @Valid @RequestBody SubmitRatingsRequest request) {
    return ResponseEntity.ok(pairingService.submit(sessionId, request));
  }

  @GetMapping("/results")
  public ResponseEntity<PairingResultResponse> results(
      @PathVariable("sessionId") String sessionId) {
    return ResponseEntity.ok(pairingService.computeResults(sessionId));
  }
}
