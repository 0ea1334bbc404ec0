package com.gt.vocab.mastery.impl;

import com.gt.vocab.mastery.MasteryDao;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.MasteryRecord;
import com.gt.vocab.model.Word;
import com.gt.vocab.model.WordScore;
import com.gt.vocab.word.impl.WordDaoPG;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class MasteryDaoPG implements MasteryDao {

    private static final String RECORD_SELECT =
            "SELECT ld.user_id, ld.score, ld.update_instant, w.id, w.word, w.pos, w.language, w.freq_rank " +
            "FROM learning_data ld JOIN words w ON w.id = ld.word_id ";

    private static final String LOAD_RECORD_SQL =
            RECORD_SELECT +
            "WHERE ld.user_id = :userId AND ld.word_id = :wordId";

    private static final String LOAD_SEEN_RECORDS_SQL =
            RECORD_SELECT +
            "WHERE ld.user_id = :userId " +
            "ORDER BY ld.update_instant ASC, ld.score ASC";

    private static final String LOAD_UNSEEN_WORDS_SQL =
            "SELECT w.id, w.word, w.pos, w.language, w.freq_rank " +
            "FROM words w " +
            "WHERE w.language = :language " +
            "AND NOT EXISTS (SELECT 1 FROM learning_data ld WHERE ld.user_id = :userId AND ld.word_id = w.id) " +
            "ORDER BY w.freq_rank ASC, w.id ASC " +
            "LIMIT :limit";

    // Single statement upsert: concurrent writers of one (user, word) row serialize on the row lock
    private static final String UPSERT_SCORE_SQL =
            "INSERT INTO learning_data (user_id, word_id, score, update_instant) " +
            "VALUES (:userId, :wordId, :score, :updateInstant) " +
            "ON CONFLICT (user_id, word_id) DO UPDATE " +
                    "SET score = :score, update_instant = :updateInstant";

    private final NamedParameterJdbcTemplate template;

    public MasteryDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public MasteryRecord loadRecord(long userId, long wordId) {
        List<MasteryRecord> records = template.query(LOAD_RECORD_SQL, Map.of("userId", userId, "wordId", wordId),
                MasteryDaoPG::getMasteryRecordFromResultSet);

        return records.isEmpty() ? null : records.get(0);
    }

    @Override
    public List<MasteryRecord> loadSeenRecords(long userId) {
        return template.query(LOAD_SEEN_RECORDS_SQL, Map.of("userId", userId), MasteryDaoPG::getMasteryRecordFromResultSet);
    }

    @Override
    public List<Word> loadUnseenWords(long userId, Language language, int limit) {
        return template.query(LOAD_UNSEEN_WORDS_SQL, Map.of(
                        "userId", userId,
                        "language", language.toString(),
                        "limit", limit),
                WordDaoPG::getWordFromResultSet);
    }

    @Override
    public void upsertScores(long userId, List<WordScore> scores) {
        Timestamp now = Timestamp.from(Instant.now());
        SqlParameterSource[] paramsArray = new SqlParameterSource[scores.size()];

        for (int index = 0; index < scores.size(); index++) {
            paramsArray[index] = new MapSqlParameterSource(Map.of(
                    "userId", userId,
                    "wordId", scores.get(index).wordId(),
                    "score", scores.get(index).score(),
                    "updateInstant", now));
        }

        template.batchUpdate(UPSERT_SCORE_SQL, paramsArray);
    }

    private static MasteryRecord getMasteryRecordFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new MasteryRecord(
                rs.getLong("user_id"),
                WordDaoPG.getWordFromResultSet(rs, rowNum),
                rs.getInt("score"),
                toInstant(rs.getTimestamp("update_instant")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
