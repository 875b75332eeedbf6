/*
 * どこで: Pairing サービス層
 * 何を: セッション作成 (ロスター一括登録) と参加者ログインを担う
 * なぜ: ロスター検証と資格情報のハッシュ化を 1 箇所で扱うため
 */
package com.example.pairing.service;

import com.example.common.UrlSafeTokens;
import com.example.pairing.api.DuplicateParticipantException;
import com.example.pairing.api.InvalidCredentialsException;
import com.example.pairing.api.InvalidPairingRequestException;
import com.example.pairing.api.request.CreateSessionRequest;
import com.example.pairing.api.request.LoginRequest;
import com.example.pairing.api.request.ParticipantCredential;
import com.example.pairing.api.response.CreateSessionResponse;
import com.example.pairing.api.response.LoginResponse;
import com.example.pairing.config.PairingProperties;
import com.example.pairing.model.PairingSessionRecord;
import com.example.pairing.model.ParticipantRecord;
import com.example.pairing.repository.PairingSessionRepository;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class SessionService {

  private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

  private static final String MODE_SHARED = "shared_password";
  private static final String MODE_INDIVIDUAL = "individual_passwords";

  // BCrypt は 72 バイトを超える入力を扱えない
  static final int MAX_PASSWORD_BYTES = 72;
  // participants.username / directed_ratings.rater,ratee の列幅
  static final int MAX_USERNAME_LENGTH = 255;

  private final PairingSessionRepository sessionRepository;
  private final PasswordEncoder passwordEncoder;
  private final PairingProperties properties;
  private final PairingMetrics metrics;
  private final Clock clock;

  @Transactional
  public CreateSessionResponse createSession(CreateSessionRequest request) {
    if (request == null) {
      throw new InvalidPairingRequestException("request is required");
    }
    if (request.sessionName() == null || request.sessionName().isBlank()) {
      throw new InvalidPairingRequestException("session_name is required");
    }
    final String mode = resolveMode(request);
    final List<ParticipantCredential> credentials =
        MODE_SHARED.equals(mode) ? sharedCredentials(request) : individualCredentials(request);
    ensureUniqueUsernames(credentials);

    final String sessionId = UrlSafeTokens.newToken(properties.sessionIdBytes());
    final PairingSessionRecord session =
        sessionRepository.insertSession(
            new PairingSessionRecord(sessionId, request.sessionName(), Instant.now(clock), true));
    sessionRepository.insertParticipants(
        credentials.stream()
            .map(
                credential ->
                    new ParticipantRecord(
                        sessionId,
                        credential.username(),
                        passwordEncoder.encode(credential.password()),
                        false))
            .toList());

    metrics.recordSessionCreated(mode);
    logger.info(
        "pairing session created sessionId={} mode={} participants={}",
        sessionId,
        mode,
        credentials.size());
    return new CreateSessionResponse("Session created", sessionId, session.name(), credentials);
  }

  /**
   * 役割: セッション内のユーザー名とパスワードを照合する。
   * 動作: セッション不在/ユーザー不在/パスワード不一致はすべて同じ InvalidCredentialsException とする。
   */
  public LoginResponse login(String sessionId, LoginRequest request) {
    if (request == null
        || request.username() == null
        || request.username().isBlank()
        || request.password() == null
        || request.password().isBlank()) {
      throw new InvalidPairingRequestException("username and password are required");
    }
    if (exceedsPasswordLimit(request.password())
        || request.username().length() > MAX_USERNAME_LENGTH) {
      throw new InvalidCredentialsException();
    }
    final ParticipantRecord participant =
        sessionRepository
            .findParticipant(sessionId, request.username())
            .filter(p -> passwordEncoder.matches(request.password(), p.passwordHash()))
            .orElseThrow(InvalidCredentialsException::new);
    final List<String> others = sessionRepository.findOtherUsernames(sessionId, participant.username());
    return new LoginResponse(
        "Login successful", participant.username(), sessionId, participant.hasSubmitted(), others);
  }

  private String resolveMode(CreateSessionRequest request) {
    final boolean hasUsernames = request.usernames() != null;
    final boolean hasUsers = request.users() != null;
    if (hasUsernames == hasUsers) {
      throw new InvalidPairingRequestException("exactly one of usernames or users is required");
    }
    return hasUsernames ? MODE_SHARED : MODE_INDIVIDUAL;
  }

  private List<ParticipantCredential> sharedCredentials(CreateSessionRequest request) {
    requireMinimumSize(request.usernames().size());
    final String password =
        request.password() == null || request.password().isBlank()
            ? properties.defaultSharedPassword()
            : request.password();
    requirePasswordWithinLimit(password);
    return request.usernames().stream()
        .map(
            username -> {
              if (username == null || username.isBlank()) {
                throw new InvalidPairingRequestException("username must not be blank");
              }
              requireUsernameWithinLimit(username);
              return new ParticipantCredential(username, password);
            })
        .toList();
  }

  private List<ParticipantCredential> individualCredentials(CreateSessionRequest request) {
    requireMinimumSize(request.users().size());
    for (ParticipantCredential user : request.users()) {
      if (user == null
          || user.username() == null
          || user.username().isBlank()
          || user.password() == null
          || user.password().isBlank()) {
        throw new InvalidPairingRequestException("each user must have username and password");
      }
      requireUsernameWithinLimit(user.username());
      requirePasswordWithinLimit(user.password());
    }
    return List.copyOf(request.users());
  }

  private void requireMinimumSize(int size) {
    if (size < properties.minParticipants()) {
      throw new InvalidPairingRequestException(
          "at least " + properties.minParticipants() + " users required");
    }
  }

  private static void requireUsernameWithinLimit(String username) {
    if (username.length() > MAX_USERNAME_LENGTH) {
      throw new InvalidPairingRequestException(
          "username must be at most " + MAX_USERNAME_LENGTH + " characters");
    }
  }

  private static void requirePasswordWithinLimit(String password) {
    if (exceedsPasswordLimit(password)) {
      throw new InvalidPairingRequestException(
          "password must be at most " + MAX_PASSWORD_BYTES + " bytes");
    }
  }

  private static boolean exceedsPasswordLimit(String password) {
    return password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
  }

  private void ensureUniqueUsernames(List<ParticipantCredential> credentials) {
    final Set<String> seen = new HashSet<>();
    for (ParticipantCredential credential : credentials) {
      if (!seen.add(credential.username())) {
        throw new DuplicateParticipantException(credential.username());
      }
    }
  }
}
