package com.example.pairing.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.pairing.model.ParticipantStatus;
import com.example.pairing.model.RatingMatrix;
import com.example.pairing.model.SubmissionCounts;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class JdbcSubmissionRepository implements SubmissionRepository {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "NamedParameterJdbcTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final NamedParameterJdbcTemplate jdbcTemplate;

  public JdbcSubmissionRepository(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public boolean sessionExists(String sessionId) {
    final String sql = "SELECT COUNT(*) FROM pairing_sessions WHERE id = :sessionId";
    final Integer count =
        jdbcTemplate.queryForObject(sql, sessionParams(sessionId), Integer.class);
    return count != null && count > 0;
  }

  @Override
  public List<String> loadRoster(String sessionId) {
    final String sql =
        """
        SELECT username
        FROM participants
        WHERE session_id = :sessionId
        ORDER BY id
        """;
    return jdbcTemplate.queryForList(sql, sessionParams(sessionId), String.class);
  }

  @Override
  public RatingMatrix loadDirectedRatings(String sessionId) {
    final String sql =
        """
        SELECT rater, ratee, score
        FROM directed_ratings
        WHERE session_id = :sessionId
        ORDER BY rater, ratee
        """;
    final Map<String, Map<String, Integer>> ratings = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql,
        sessionParams(sessionId),
        rs -> {
          ratings
              .computeIfAbsent(rs.getString("rater"), ignored -> new LinkedHashMap<>())
              .put(rs.getString("ratee"), rs.getInt("score"));
        });
    return RatingMatrix.of(ratings);
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public boolean lockParticipant(String sessionId, String username) {
    // 同一参加者の提出を直列化し、フラグと評価行が部分的に見えないようにする。
    final String sql =
        """
        SELECT username
        FROM participants
        WHERE session_id = :sessionId AND username = :username
        FOR UPDATE
        """;
    final MapSqlParameterSource params = sessionParams(sessionId).addValue("username", username);
    return !jdbcTemplate.queryForList(sql, params, String.class).isEmpty();
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public void replaceRatings(
      String sessionId, String fromUser, Map<String, Integer> newRatings, Instant submittedAt) {
    final String deleteSql =
        """
        DELETE FROM directed_ratings
        WHERE session_id = :sessionId AND rater = :rater
        """;
    jdbcTemplate.update(deleteSql, sessionParams(sessionId).addValue("rater", fromUser));
    if (newRatings.isEmpty()) {
      return;
    }

    final String insertSql =
        """
        INSERT INTO directed_ratings (session_id, rater, ratee, score, submitted_at)
        VALUES (:sessionId, :rater, :ratee, :score, :submittedAt)
        """;
    final SqlParameterSource[] batch =
        newRatings.entrySet().stream()
            .map(
                entry ->
                    sessionParams(sessionId)
                        .addValue("rater", fromUser)
                        .addValue("ratee", entry.getKey())
                        .addValue("score", entry.getValue())
                        .addValue("submittedAt", toTimestamp(submittedAt)))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(insertSql, batch);
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public void markSubmitted(String sessionId, String username) {
    final String sql =
        """
        UPDATE participants
        SET has_submitted = TRUE
        WHERE session_id = :sessionId AND username = :username
        """;
    jdbcTemplate.update(sql, sessionParams(sessionId).addValue("username", username));
  }

  @Override
  public SubmissionCounts submissionCounts(String sessionId) {
    final String sql =
        """
        SELECT COUNT(*) AS total,
               COUNT(*) FILTER (WHERE has_submitted) AS submitted
        FROM participants
        WHERE session_id = :sessionId
        """;
    return jdbcTemplate.queryForObject(
        sql,
        sessionParams(sessionId),
        (rs, rowNum) -> new SubmissionCounts(rs.getInt("submitted"), rs.getInt("total")));
  }

  @Override
  public List<ParticipantStatus> participantStatuses(String sessionId) {
    final String sql =
        """
        SELECT username, has_submitted
        FROM participants
        WHERE session_id = :sessionId
        ORDER BY id
        """;
    return jdbcTemplate.query(
        sql,
        sessionParams(sessionId),
        (rs, rowNum) ->
            new ParticipantStatus(rs.getString("username"), rs.getBoolean("has_submitted")));
  }

  private MapSqlParameterSource sessionParams(String sessionId) {
    return new MapSqlParameterSource().addValue("sessionId", sessionId);
  }
}
