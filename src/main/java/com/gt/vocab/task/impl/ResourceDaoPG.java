package com.gt.vocab.task.impl;

import com.gt.vocab.exception.DaoException;
import com.gt.vocab.model.Resource;
import com.gt.vocab.model.Word;
import com.gt.vocab.task.ResourceDao;
import com.gt.vocab.word.impl.WordDaoPG;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.util.*;

public class ResourceDaoPG implements ResourceDao {

    private static final String FIND_BY_CACHE_KEY_SQL =
            "SELECT id, resource_text, cache_key " +
            "FROM resources " +
            "WHERE cache_key = :cacheKey";

    private static final String LOAD_RESOURCES_SQL =
            "SELECT id, resource_text, cache_key " +
            "FROM resources " +
            "WHERE id IN (:resourceIds)";

    private static final String LOAD_RESOURCE_WORDS_SQL =
            "SELECT rw.resource_id, w.id, w.word, w.pos, w.language, w.freq_rank " +
            "FROM resource_words rw " +
            "JOIN words w ON w.id = rw.word_id " +
            "WHERE rw.resource_id IN (:resourceIds) " +
            "ORDER BY rw.resource_id, w.freq_rank";

    private static final String CREATE_RESOURCE_SQL =
            "INSERT INTO resources (resource_text, cache_key) " +
            "VALUES (:text, :cacheKey) " +
            "ON CONFLICT (cache_key) DO NOTHING";

    private static final String CREATE_RESOURCE_WORD_SQL =
            "INSERT INTO resource_words (resource_id, word_id) " +
            "VALUES (:resourceId, :wordId) " +
            "ON CONFLICT (resource_id, word_id) DO NOTHING";

    private final NamedParameterJdbcTemplate template;

    public ResourceDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public Resource findByCacheKey(String cacheKey) {
        List<ResourceRow> rows = template.query(FIND_BY_CACHE_KEY_SQL, Map.of("cacheKey", cacheKey),
                (rs, rowNum) -> new ResourceRow(rs.getLong("id"), rs.getString("resource_text"), rs.getString("cache_key")));

        if (rows.isEmpty()) {
            return null;
        }

        return withWords(rows).get(0);
    }

    @Override
    public Resource createResource(String text, String cacheKey, Collection<Word> words) {
        int inserted = template.update(CREATE_RESOURCE_SQL, Map.of("text", text, "cacheKey", cacheKey));

        Resource stored = findByCacheKey(cacheKey);
        if (stored == null) {
            throw new DaoException("Resource " + cacheKey + " missing after insert");
        }

        if (inserted > 0 && !words.isEmpty()) {
            SqlParameterSource[] paramsArray = words.stream()
                    .map(word -> new MapSqlParameterSource(Map.of("resourceId", stored.id(), "wordId", word.id())))
                    .toArray(SqlParameterSource[]::new);
            template.batchUpdate(CREATE_RESOURCE_WORD_SQL, paramsArray);

            return new Resource(stored.id(), stored.text(), stored.cacheKey(), List.copyOf(words));
        }

        return stored;
    }

    @Override
    public List<Resource> loadResources(Collection<Long> resourceIds) {
        if (resourceIds.isEmpty()) {
            return List.of();
        }

        List<ResourceRow> rows = template.query(LOAD_RESOURCES_SQL, Map.of("resourceIds", resourceIds),
                (rs, rowNum) -> new ResourceRow(rs.getLong("id"), rs.getString("resource_text"), rs.getString("cache_key")));

        return withWords(rows);
    }

    private List<Resource> withWords(List<ResourceRow> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<Long, List<Word>> wordsByResource = new HashMap<>();

        template.query(LOAD_RESOURCE_WORDS_SQL,
                Map.of("resourceIds", rows.stream().map(ResourceRow::id).toList()),
                rs -> {
                    wordsByResource.computeIfAbsent(rs.getLong("resource_id"), id -> new ArrayList<>())
                            .add(WordDaoPG.getWordFromResultSet(rs, 0));
                });

        return rows.stream()
                .map(row -> new Resource(row.id(), row.text(), row.cacheKey(), wordsByResource.getOrDefault(row.id(), List.of())))
                .toList();
    }

    private record ResourceRow(long id, String text, String cacheKey) { }
}
