package com.gt.vocab.word.impl;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.Word;
import com.gt.vocab.word.WordDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public class WordDaoPG implements WordDao {

    private static final Logger log = LoggerFactory.getLogger(WordDaoPG.class);

    private static final String WORD_COLUMNS = "id, word, pos, language, freq_rank";

    private static final String LOOKUP_WORD_SQL =
            "SELECT " + WORD_COLUMNS + " " +
            "FROM words " +
            "WHERE language = :language AND word = :word AND pos = :pos";

    private static final String LOAD_WORDS_SQL =
            "SELECT " + WORD_COLUMNS + " " +
            "FROM words " +
            "WHERE id IN (:wordIds)";

    private static final String LOAD_WORDS_BY_FREQUENCY_SQL =
            "SELECT " + WORD_COLUMNS + " " +
            "FROM words " +
            "WHERE language = :language " +
            "ORDER BY freq_rank ASC, id ASC";

    private static final String CREATE_WORD_SQL =
            "INSERT INTO words (word, pos, language, freq_rank) " +
            "VALUES (:word, :pos, :language, :freqRank) " +
            "ON CONFLICT (language, word, pos) DO NOTHING";

    private final NamedParameterJdbcTemplate template;

    public WordDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Word lookupWord(Language language, String word, String pos) {
        List<Word> words = template.query(LOOKUP_WORD_SQL, Map.of(
                        "language", language.toString(),
                        "word", word,
                        "pos", pos),
                WordDaoPG::getWordFromResultSet);

        return words.isEmpty() ? null : words.get(0);
    }

    @Override
    public List<Word> loadWords(Collection<Long> wordIds) {
        if (wordIds.isEmpty()) {
            return List.of();
        }

        return template.query(LOAD_WORDS_SQL, Map.of("wordIds", wordIds), WordDaoPG::getWordFromResultSet);
    }

    @Override
    public List<Word> loadWordsByFrequency(Language language) {
        return template.query(LOAD_WORDS_BY_FREQUENCY_SQL, Map.of("language", language.toString()), WordDaoPG::getWordFromResultSet);
    }

    @Override
    public int createWords(List<Word> words) {
        SqlParameterSource[] paramsArray = new SqlParameterSource[words.size()];

        for (int index = 0; index < words.size(); index++) {
            paramsArray[index] = new MapSqlParameterSource(Map.of(
                    "word", words.get(index).word(),
                    "pos", words.get(index).pos(),
                    "language", words.get(index).language().toString(),
                    "freqRank", words.get(index).frequencyRank()));
        }

        int created = Arrays.stream(template.batchUpdate(CREATE_WORD_SQL, paramsArray)).map(cnt -> Math.max(cnt, 0)).sum();
        log.debug("Inserted {} of {} words", created, words.size());

        return created;
    }

    public static Word getWordFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new Word(
                rs.getLong("id"),
                rs.getString("word"),
                rs.getString("pos"),
                Language.valueOf(rs.getString("language")),
                rs.getInt("freq_rank"));
    }
}
