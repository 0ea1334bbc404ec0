package com.gt.vocab.lesson.impl;

import com.gt.vocab.exception.DaoException;
import com.gt.vocab.lesson.LessonDao;
import com.gt.vocab.lesson.model.EntryScore;
import com.gt.vocab.lesson.model.LessonSlot;
import com.gt.vocab.model.Lesson;
import com.gt.vocab.model.LessonStatus;
import com.gt.vocab.model.ScheduledWord;
import com.gt.vocab.model.WordScore;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class LessonDaoPG implements LessonDao {

    private static final String LESSON_COLUMNS =
            "id, user_id, status, current_sequence_number, current_task_id, create_instant, finish_instant";

    private static final String CREATE_LESSON_SQL =
            "INSERT INTO user_lessons (user_id, status, current_sequence_number, current_task_id, finish_instant) " +
            "VALUES (:userId, :status, :currentSequenceNumber, :currentTaskId, " +
            "CASE WHEN :status = 'FINISHED' THEN CURRENT_TIMESTAMP END)";

    private static final String CREATE_SLOT_SQL =
            "INSERT INTO evaluations (lesson_id, sequence_number, word_id, review) " +
            "VALUES (:lessonId, :sequenceNumber, :wordId, :review)";

    private static final String LOAD_LESSON_SQL =
            "SELECT " + LESSON_COLUMNS + " FROM user_lessons WHERE id = :lessonId";

    private static final String LOAD_UNFINISHED_LESSON_SQL =
            "SELECT " + LESSON_COLUMNS + " FROM user_lessons " +
            "WHERE user_id = :userId AND status <> 'FINISHED' " +
            "ORDER BY create_instant DESC, id DESC " +
            "LIMIT 1";

    private static final String LOAD_SLOTS_SQL =
            "SELECT id, sequence_number, word_id, review " +
            "FROM evaluations " +
            "WHERE lesson_id = :lessonId " +
            "ORDER BY sequence_number";

    private static final String COMPLETE_SLOT_SQL =
            "UPDATE user_lessons " +
            "SET current_sequence_number = :nextSequenceNumber, " +
            "    current_task_id = NULL, " +
            "    status = :nextStatus, " +
            "    finish_instant = CASE WHEN :nextStatus = 'FINISHED' THEN CURRENT_TIMESTAMP ELSE finish_instant END " +
            "WHERE id = :lessonId " +
            "  AND status = 'IN_PROGRESS' " +
            "  AND current_sequence_number = :expectedSequenceNumber " +
            "  AND current_task_id = :expectedTaskId";

    private static final String SET_CURRENT_TASK_SQL =
            "UPDATE user_lessons " +
            "SET current_task_id = :taskId " +
            "WHERE id = :lessonId " +
            "  AND status = 'IN_PROGRESS' " +
            "  AND current_sequence_number = :sequenceNumber " +
            "  AND current_task_id IS NULL";

    private static final String FINISH_LESSON_SQL =
            "UPDATE user_lessons " +
            "SET status = 'FINISHED', current_task_id = NULL, finish_instant = CURRENT_TIMESTAMP " +
            "WHERE id = :lessonId AND status <> 'FINISHED'";

    private static final String CREATE_HISTORY_ENTRY_SQL =
            "INSERT INTO history_entries (evaluation_id, task_id, response) " +
            "VALUES (:evaluationId, :taskId, :response)";

    private static final String CREATE_ENTRY_SCORE_SQL =
            "INSERT INTO entry_scores (history_entry_id, word_id, score) " +
            "VALUES (:historyEntryId, :wordId, :score)";

    private static final String LOAD_ENTRY_SCORES_SQL =
            "SELECT e.sequence_number, es.word_id, es.score " +
            "FROM evaluations e " +
            "JOIN history_entries he ON he.evaluation_id = e.id " +
            "JOIN entry_scores es ON es.history_entry_id = he.id " +
            "WHERE e.lesson_id = :lessonId " +
            "ORDER BY e.sequence_number, es.word_id";

    private final NamedParameterJdbcTemplate template;

    public LessonDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public long createLesson(long userId, LessonStatus status, int currentSequenceNumber, Long currentTaskId) {
        KeyHolder keyHolder = new GeneratedKeyHolder();

        template.update(CREATE_LESSON_SQL, new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("status", status.toString())
                .addValue("currentSequenceNumber", currentSequenceNumber)
                .addValue("currentTaskId", currentTaskId), keyHolder, new String[] { "id" });

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DaoException("No id generated for lesson of user " + userId);
        }

        return key.longValue();
    }

    @Override
    public void createSlots(long lessonId, List<ScheduledWord> plan) {
        SqlParameterSource[] paramsArray = plan.stream()
                .map(scheduledWord -> new MapSqlParameterSource(Map.of(
                        "lessonId", lessonId,
                        "sequenceNumber", scheduledWord.sequenceNumber(),
                        "wordId", scheduledWord.word().id(),
                        "review", scheduledWord.review())))
                .toArray(SqlParameterSource[]::new);

        template.batchUpdate(CREATE_SLOT_SQL, paramsArray);
    }

    @Override
    public Lesson loadLesson(long lessonId) {
        List<Lesson> lessons = template.query(LOAD_LESSON_SQL, Map.of("lessonId", lessonId), LessonDaoPG::getLessonFromResultSet);

        return lessons.isEmpty() ? null : lessons.get(0);
    }

    @Override
    public Lesson loadUnfinishedLesson(long userId) {
        List<Lesson> lessons = template.query(LOAD_UNFINISHED_LESSON_SQL, Map.of("userId", userId), LessonDaoPG::getLessonFromResultSet);

        return lessons.isEmpty() ? null : lessons.get(0);
    }

    @Override
    public List<LessonSlot> loadSlots(long lessonId) {
        return template.query(LOAD_SLOTS_SQL, Map.of("lessonId", lessonId), (rs, rowNum) -> new LessonSlot(
                rs.getLong("id"),
                rs.getInt("sequence_number"),
                rs.getLong("word_id"),
                rs.getBoolean("review")));
    }

    @Override
    public int completeSlot(long lessonId, int expectedSequenceNumber, long expectedTaskId, int nextSequenceNumber, LessonStatus nextStatus) {
        return template.update(COMPLETE_SLOT_SQL, Map.of(
                "lessonId", lessonId,
                "expectedSequenceNumber", expectedSequenceNumber,
                "expectedTaskId", expectedTaskId,
                "nextSequenceNumber", nextSequenceNumber,
                "nextStatus", nextStatus.toString()));
    }

    @Override
    public int setCurrentTask(long lessonId, int sequenceNumber, long taskId) {
        return template.update(SET_CURRENT_TASK_SQL, Map.of(
                "lessonId", lessonId,
                "sequenceNumber", sequenceNumber,
                "taskId", taskId));
    }

    @Override
    public int finishLesson(long lessonId) {
        return template.update(FINISH_LESSON_SQL, Map.of("lessonId", lessonId));
    }

    @Override
    public long createHistoryEntry(long evaluationId, long taskId, String response) {
        KeyHolder keyHolder = new GeneratedKeyHolder();

        template.update(CREATE_HISTORY_ENTRY_SQL, new MapSqlParameterSource()
                .addValue("evaluationId", evaluationId)
                .addValue("taskId", taskId)
                .addValue("response", response), keyHolder, new String[] { "id" });

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DaoException("No id generated for history entry of evaluation " + evaluationId);
        }

        return key.longValue();
    }

    @Override
    public void createEntryScores(long historyEntryId, List<WordScore> scores) {
        SqlParameterSource[] paramsArray = scores.stream()
                .map(wordScore -> new MapSqlParameterSource(Map.of(
                        "historyEntryId", historyEntryId,
                        "wordId", wordScore.wordId(),
                        "score", wordScore.score())))
                .toArray(SqlParameterSource[]::new);

        template.batchUpdate(CREATE_ENTRY_SCORE_SQL, paramsArray);
    }

    @Override
    public List<EntryScore> loadEntryScores(long lessonId) {
        return template.query(LOAD_ENTRY_SCORES_SQL, Map.of("lessonId", lessonId), (rs, rowNum) -> new EntryScore(
                rs.getInt("sequence_number"),
                rs.getLong("word_id"),
                rs.getInt("score")));
    }

    private static Lesson getLessonFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        long taskId = rs.getLong("current_task_id");
        Long currentTaskId = rs.wasNull() ? null : taskId;

        return new Lesson(
                rs.getLong("id"),
                rs.getLong("user_id"),
                LessonStatus.valueOf(rs.getString("status")),
                rs.getInt("current_sequence_number"),
                currentTaskId,
                toInstant(rs.getTimestamp("create_instant")),
                toInstant(rs.getTimestamp("finish_instant")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
