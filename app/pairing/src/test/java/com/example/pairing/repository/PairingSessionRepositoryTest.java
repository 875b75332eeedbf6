package com.example.pairing.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.pairing.AbstractPostgresContainerTest;
import com.example.pairing.model.PairingSessionRecord;
import com.example.pairing.model.ParticipantRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class PairingSessionRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private PairingSessionRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM directed_ratings", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM participants", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM pairing_sessions", new MapSqlParameterSource());
  }

  @Test
  void insertAndFindSession() {
    final PairingSessionRecord inserted =
        repository.insertSession(new PairingSessionRecord("s1", "Team", CREATED_AT, true));

    assertThat(inserted.createdAt()).isEqualTo(CREATED_AT);
    assertThat(repository.findSession("s1")).contains(inserted);
    assertThat(repository.findSession("missing")).isEmpty();
  }

  @Test
  void findParticipantAndOtherUsernames() {
    repository.insertSession(new PairingSessionRecord("s1", "Team", CREATED_AT, true));
    repository.insertParticipants(
        List.of(
            new ParticipantRecord("s1", "Alice", "hash-a", false),
            new ParticipantRecord("s1", "Bob", "hash-b", false),
            new ParticipantRecord("s1", "Charlie", "hash-c", false)));

    assertThat(repository.findParticipant("s1", "Bob"))
        .contains(new ParticipantRecord("s1", "Bob", "hash-b", false));
    assertThat(repository.findParticipant("s1", "Mallory")).isEmpty();
    assertThat(repository.findOtherUsernames("s1", "Bob")).containsExactly("Alice", "Charlie");
  }

  @Test
  void duplicateUsernameInSessionIsRejectedByConstraint() {
    repository.insertSession(new PairingSessionRecord("s1", "Team", CREATED_AT, true));

    assertThatThrownBy(
            () ->
                repository.insertParticipants(
                    List.of(
                        new ParticipantRecord("s1", "Alice", "h", false),
                        new ParticipantRecord("s1", "Alice", "h", false))))
        .isInstanceOf(DataIntegrityViolationException.class);
  }
}
