package com.gt.vocab.task.impl;

import com.gt.vocab.exception.DaoException;
import com.gt.vocab.model.Resource;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.TemplateParameter;
import com.gt.vocab.model.Word;
import com.gt.vocab.task.TaskDao;
import com.gt.vocab.task.model.DBTask;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.util.*;

public class TaskDaoPG implements TaskDao {

    private static final String CREATE_TASK_SQL =
            "INSERT INTO tasks (template_id, prompt, answer) " +
            "VALUES (:templateId, :prompt, :answer)";

    private static final String CREATE_TASK_RESOURCE_SQL =
            "INSERT INTO task_resources (task_id, resource_id, parameter_id) " +
            "VALUES (:taskId, :resourceId, :parameterId)";

    private static final String CREATE_TASK_TARGET_WORD_SQL =
            "INSERT INTO task_target_words (task_id, word_id) " +
            "VALUES (:taskId, :wordId)";

    private static final String LOAD_TASK_SQL =
            "SELECT id, template_id, prompt, answer " +
            "FROM tasks " +
            "WHERE id = :taskId";

    private static final String LOAD_TASK_RESOURCES_SQL =
            "SELECT tp.name, tr.resource_id " +
            "FROM task_resources tr " +
            "JOIN template_parameters tp ON tp.id = tr.parameter_id " +
            "WHERE tr.task_id = :taskId " +
            "ORDER BY tp.position";

    private static final String LOAD_TASK_TARGET_WORDS_SQL =
            "SELECT word_id " +
            "FROM task_target_words " +
            "WHERE task_id = :taskId " +
            "ORDER BY word_id";

    private static final String FIND_SINGLE_WORD_TASKS_SQL =
            "SELECT t.id " +
            "FROM tasks t " +
            "JOIN task_target_words tw ON tw.task_id = t.id AND tw.word_id = :wordId " +
            "WHERE t.template_id IN (:templateIds) " +
            "AND NOT EXISTS (SELECT 1 FROM task_target_words other WHERE other.task_id = t.id AND other.word_id <> :wordId) " +
            "AND %s (" +
            "    SELECT 1 FROM history_entries he " +
            "    JOIN evaluations e ON e.id = he.evaluation_id " +
            "    JOIN user_lessons ul ON ul.id = e.lesson_id " +
            "    WHERE he.task_id = t.id AND ul.user_id = :userId) " +
            "ORDER BY t.id " +
            "LIMIT :limit";

    private final NamedParameterJdbcTemplate template;

    public TaskDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public long createTask(TemplateDef templateDef, String prompt, String answer, Map<String, Resource> resources, Collection<Word> targetWords) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        MapSqlParameterSource taskParams = new MapSqlParameterSource()
                .addValue("templateId", templateDef.id())
                .addValue("prompt", prompt)
                .addValue("answer", answer);

        template.update(CREATE_TASK_SQL, taskParams, keyHolder, new String[] {"id"});
        if (keyHolder.getKey() == null) {
            throw new DaoException("Failed to create task for template " + templateDef.id());
        }
        long taskId = keyHolder.getKey().longValue();

        List<SqlParameterSource> resourceParams = new ArrayList<>();
        for (TemplateParameter parameter : templateDef.parameters()) {
            Resource resource = resources.get(parameter.name());
            resourceParams.add(new MapSqlParameterSource(Map.of(
                    "taskId", taskId,
                    "resourceId", resource.id(),
                    "parameterId", parameter.id())));
        }
        template.batchUpdate(CREATE_TASK_RESOURCE_SQL, resourceParams.toArray(SqlParameterSource[]::new));

        SqlParameterSource[] wordParams = targetWords.stream()
                .map(word -> new MapSqlParameterSource(Map.of("taskId", taskId, "wordId", word.id())))
                .toArray(SqlParameterSource[]::new);
        template.batchUpdate(CREATE_TASK_TARGET_WORD_SQL, wordParams);

        return taskId;
    }

    @Override
    public DBTask loadTask(long taskId) {
        Map<String, Object> params = Map.of("taskId", taskId);

        List<TaskRow> rows = template.query(LOAD_TASK_SQL, params, (rs, rowNum) -> new TaskRow(
                rs.getLong("id"),
                rs.getLong("template_id"),
                rs.getString("prompt"),
                rs.getString("answer")));

        if (rows.isEmpty()) {
            return null;
        }

        Map<String, Long> resourceIdByParameter = new LinkedHashMap<>();
        template.query(LOAD_TASK_RESOURCES_SQL, params,
                rs -> { resourceIdByParameter.put(rs.getString("name"), rs.getLong("resource_id")); });

        List<Long> targetWordIds = template.queryForList(LOAD_TASK_TARGET_WORDS_SQL, params, Long.class);

        TaskRow row = rows.get(0);
        return new DBTask(row.id(), row.templateId(), row.prompt(), row.answer(), resourceIdByParameter, targetWordIds);
    }

    @Override
    public List<Long> findSingleWordTaskIds(long userId, long wordId, Collection<Long> templateIds, boolean doneByUser, int limit) {
        if (templateIds.isEmpty()) {
            return List.of();
        }

        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("wordId", wordId)
                .addValue("templateIds", templateIds)
                .addValue("limit", limit);

        String sql = String.format(FIND_SINGLE_WORD_TASKS_SQL, doneByUser ? "EXISTS" : "NOT EXISTS");
        return template.queryForList(sql, params, Long.class);
    }

    private record TaskRow(long id, long templateId, String prompt, String answer) { }
}
