/*
 * どこで: Submission リポジトリの統合テスト
 * 何を: 評価の全置換/提出フラグ/集計クエリを Postgres で検証する
 * なぜ: 再提出で古い評価行が残らないことを DB 方言込みで保証するため
 */
package com.example.pairing.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.pairing.AbstractPostgresContainerTest;
import com.example.pairing.model.PairingSessionRecord;
import com.example.pairing.model.ParticipantRecord;
import com.example.pairing.model.ParticipantStatus;
import com.example.pairing.model.RatingMatrix;
import com.example.pairing.model.SubmissionCounts;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class JdbcSubmissionRepositoryTest extends AbstractPostgresContainerTest {

  private static final String SESSION_ID = "session-repo";
  private static final Instant BASE_TIME = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private SubmissionRepository submissionRepository;
  @Autowired private PairingSessionRepository sessionRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private TransactionTemplate transactionTemplate;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM directed_ratings", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM participants", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM pairing_sessions", new MapSqlParameterSource());

    sessionRepository.insertSession(new PairingSessionRecord(SESSION_ID, "Team", BASE_TIME, true));
    sessionRepository.insertParticipants(
        List.of(
            new ParticipantRecord(SESSION_ID, "Charlie", "h", false),
            new ParticipantRecord(SESSION_ID, "Alice", "h", false),
            new ParticipantRecord(SESSION_ID, "Bob", "h", false)));
  }

  @Test
  void resubmissionReplacesEarlierRatings() {
    transactionTemplate.executeWithoutResult(
        status -> {
          submissionRepository.lockParticipant(SESSION_ID, "Alice");
          submissionRepository.replaceRatings(
              SESSION_ID, "Alice", Map.of("Bob", 40, "Charlie", 60), BASE_TIME);
          submissionRepository.markSubmitted(SESSION_ID, "Alice");
        });
    transactionTemplate.executeWithoutResult(
        status -> {
          submissionRepository.lockParticipant(SESSION_ID, "Alice");
          submissionRepository.replaceRatings(
              SESSION_ID, "Alice", Map.of("Bob", 95), BASE_TIME.plusSeconds(60));
          submissionRepository.markSubmitted(SESSION_ID, "Alice");
        });

    final RatingMatrix ratings = submissionRepository.loadDirectedRatings(SESSION_ID);
    assertThat(ratings.ratingsFrom("Alice")).containsOnly(Map.entry("Bob", 95));
    assertThat(submissionRepository.submissionCounts(SESSION_ID))
        .isEqualTo(new SubmissionCounts(1, 3));
  }

  @Test
  void rosterAndStatusesFollowInsertionOrder() {
    assertThat(submissionRepository.loadRoster(SESSION_ID))
        .containsExactly("Charlie", "Alice", "Bob");
    assertThat(submissionRepository.participantStatuses(SESSION_ID))
        .containsExactly(
            new ParticipantStatus("Charlie", false),
            new ParticipantStatus("Alice", false),
            new ParticipantStatus("Bob", false));
  }

  @Test
  void lockParticipantReportsUnknownUsername() {
    final Boolean found =
        transactionTemplate.execute(
            status -> submissionRepository.lockParticipant(SESSION_ID, "Mallory"));

    assertThat(found).isFalse();
  }

  @Test
  void writesRequireSurroundingTransaction() {
    assertThatThrownBy(() -> submissionRepository.markSubmitted(SESSION_ID, "Alice"))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void sessionExistsOnlyForInsertedSession() {
    assertThat(submissionRepository.sessionExists(SESSION_ID)).isTrue();
    assertThat(submissionRepository.sessionExists("missing")).isFalse();
  }
}
