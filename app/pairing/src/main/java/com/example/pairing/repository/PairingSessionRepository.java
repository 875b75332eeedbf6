/*
 * どこで: Pairing データアクセス
 * 何を: pairing_sessions と participants の登録/参照を行う
 * なぜ: セッション作成とログインで一貫した DB 操作を提供するため
 */
package com.example.pairing.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pairing.model.PairingSessionRecord;
import com.example.pairing.model.ParticipantRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "NamedParameterJdbcTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
@RequiredArgsConstructor
public class PairingSessionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public PairingSessionRecord insertSession(PairingSessionRecord session) {
    final String sql =
        """
        INSERT INTO pairing_sessions (id, name, created_at, is_active)
        VALUES (:sessionId, :name, :createdAt, :active)
        RETURNING id, name, created_at, is_active
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sessionId", session.sessionId())
            .addValue("name", session.name())
            .addValue("createdAt", toTimestamp(session.createdAt()))
            .addValue("active", session.active());
    return jdbcTemplate.queryForObject(sql, params, this::mapSession);
  }

  /** リスト順に id が採番され、その順序がロスター順になる。 */
  public void insertParticipants(List<ParticipantRecord> participants) {
    final String sql =
        """
        INSERT INTO participants (session_id, username, password_hash, has_submitted)
        VALUES (:sessionId, :username, :passwordHash, :hasSubmitted)
        """;
    final SqlParameterSource[] batch =
        participants.stream()
            .map(
                participant ->
                    new MapSqlParameterSource()
                        .addValue("sessionId", participant.sessionId())
                        .addValue("username", participant.username())
                        .addValue("passwordHash", participant.passwordHash())
                        .addValue("hasSubmitted", participant.hasSubmitted()))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  public Optional<PairingSessionRecord> findSession(String sessionId) {
    final String sql =
        """
        SELECT id, name, created_at, is_active
        FROM pairing_sessions
        WHERE id = :sessionId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("sessionId", sessionId);
    return jdbcTemplate.query(sql, params, this::mapSession).stream().findFirst();
  }

  public Optional<ParticipantRecord> findParticipant(String sessionId, String username) {
    final String sql =
        """
        SELECT session_id, username, password_hash, has_submitted
        FROM participants
        WHERE session_id = :sessionId AND username = :username
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("sessionId", sessionId).addValue("username", username);
    return jdbcTemplate.query(sql, params, this::mapParticipant).stream().findFirst();
  }

  public List<String> findOtherUsernames(String sessionId, String username) {
    final String sql =
        """
        SELECT username
        FROM participants
        WHERE session_id = :sessionId AND username <> :username
        ORDER BY id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("sessionId", sessionId).addValue("username", username);
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  private PairingSessionRecord mapSession(ResultSet rs, int rowNum) throws SQLException {
    return new PairingSessionRecord(
        rs.getString("id"),
        rs.getString("name"),
        toInstant(rs.getTimestamp("created_at")),
        rs.getBoolean("is_active"));
  }

  private ParticipantRecord mapParticipant(ResultSet rs, int rowNum) throws SQLException {
    return new ParticipantRecord(
        rs.getString("session_id"),
        rs.getString("username"),
        rs.getString("password_hash"),
        rs.getBoolean("has_submitted"));
  }
}
