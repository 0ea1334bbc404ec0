package com.gt.vocab.template.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.vocab.exception.DaoException;
import com.gt.vocab.exception.MappingException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.TaskType;
import com.gt.vocab.model.TemplateDef;
import com.gt.vocab.model.TemplateParameter;
import com.gt.vocab.template.TemplateDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;
import java.util.stream.Collectors;

public class TemplateDaoPG implements TemplateDao {

    private static final TypeReference<List<String>> EXAMPLES_TYPE = new TypeReference<>() { };

    private static final String TEMPLATE_COLUMNS = "id, task_type, template, description, examples, starting_language, target_language";

    private static final String LOAD_TEMPLATES_SQL =
            "SELECT " + TEMPLATE_COLUMNS + " " +
            "FROM templates " +
            "WHERE starting_language = :startingLanguage AND target_language = :targetLanguage " +
            "AND (:taskType = '' OR task_type = :taskType) " +
            "ORDER BY id";

    private static final String LOAD_TEMPLATE_SQL =
            "SELECT " + TEMPLATE_COLUMNS + " FROM templates WHERE id = :templateId";

    private static final String TEMPLATE_EXISTS_SQL =
            "SELECT COUNT(*) FROM templates WHERE template = :template";

    private static final String LOAD_PARAMETERS_SQL =
            "SELECT id, template_id, name, description " +
            "FROM template_parameters " +
            "WHERE template_id IN (:templateIds) " +
            "ORDER BY template_id, position";

    private static final String CREATE_TEMPLATE_SQL =
            "INSERT INTO templates (task_type, template, description, examples, starting_language, target_language) " +
            "VALUES (:taskType, :template, :description, :examples, :startingLanguage, :targetLanguage)";

    private static final String CREATE_PARAMETER_SQL =
            "INSERT INTO template_parameters (template_id, name, description, position) " +
            "VALUES (:templateId, :name, :description, :position)";

    private final NamedParameterJdbcTemplate template;
    private final ObjectMapper objectMapper;

    public TemplateDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        this.template = namedParameterJdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<TemplateDef> loadTemplates(TaskType taskType, Language startingLanguage, Language targetLanguage) {
        List<TemplateRow> rows = template.query(LOAD_TEMPLATES_SQL, Map.of(
                        "startingLanguage", startingLanguage.toString(),
                        "targetLanguage", targetLanguage.toString(),
                        "taskType", taskType == null ? "" : taskType.toString()),   // blank disables the filter
                this::getTemplateRowFromResultSet);

        return withParameters(rows);
    }

    @Override
    public TemplateDef loadTemplate(long templateId) {
        List<TemplateDef> templates = withParameters(template.query(LOAD_TEMPLATE_SQL, Map.of("templateId", templateId), this::getTemplateRowFromResultSet));

        return templates.isEmpty() ? null : templates.get(0);
    }

    @Override
    public boolean templateExists(String templateString) {
        Integer count = template.queryForObject(TEMPLATE_EXISTS_SQL, Map.of("template", templateString), Integer.class);
        return count != null && count > 0;
    }

    @Override
    public long createTemplate(TemplateDef templateDef) {
        KeyHolder keyHolder = new GeneratedKeyHolder();

        template.update(CREATE_TEMPLATE_SQL, new MapSqlParameterSource(Map.of(
                "taskType", templateDef.taskType().toString(),
                "template", templateDef.template(),
                "description", templateDef.description(),
                "examples", writeExamples(templateDef.examples()),
                "startingLanguage", templateDef.startingLanguage().toString(),
                "targetLanguage", templateDef.targetLanguage().toString())), keyHolder, new String[] { "id" });

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DaoException("No id generated for template " + templateDef.template());
        }
        long templateId = key.longValue();

        List<TemplateParameter> parameters = templateDef.parameters();
        SqlParameterSource[] paramsArray = new SqlParameterSource[parameters.size()];
        for (int index = 0; index < parameters.size(); index++) {
            paramsArray[index] = new MapSqlParameterSource(Map.of(
                    "templateId", templateId,
                    "name", parameters.get(index).name(),
                    "description", parameters.get(index).description(),
                    "position", index));
        }
        template.batchUpdate(CREATE_PARAMETER_SQL, paramsArray);

        return templateId;
    }

    private List<TemplateDef> withParameters(List<TemplateRow> rows) {
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<Long, List<TemplateParameter>> parametersByTemplate = template.query(LOAD_PARAMETERS_SQL,
                        Map.of("templateIds", rows.stream().map(TemplateRow::id).toList()),
                        (rs, rowNum) -> new ParameterRow(rs.getLong("template_id"),
                                new TemplateParameter(rs.getLong("id"), rs.getString("name"), rs.getString("description"))))
                .stream()
                .collect(Collectors.groupingBy(ParameterRow::templateId, LinkedHashMap::new,
                        Collectors.mapping(ParameterRow::parameter, Collectors.toList())));

        return rows.stream()
                .map(row -> new TemplateDef(row.id(), row.taskType(), row.template(), row.description(), row.examples(),
                        parametersByTemplate.getOrDefault(row.id(), List.of()), row.startingLanguage(), row.targetLanguage()))
                .toList();
    }

    private TemplateRow getTemplateRowFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new TemplateRow(
                rs.getLong("id"),
                TaskType.valueOf(rs.getString("task_type")),
                rs.getString("template"),
                rs.getString("description"),
                readExamples(rs.getLong("id"), rs.getString("examples")),
                Language.valueOf(rs.getString("starting_language")),
                Language.valueOf(rs.getString("target_language")));
    }

    private List<String> readExamples(long templateId, String examplesJson) {
        try {
            return objectMapper.readValue(examplesJson, EXAMPLES_TYPE);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Unreadable examples stored for template " + templateId, ex);
        }
    }

    private String writeExamples(List<String> examples) {
        try {
            return objectMapper.writeValueAsString(examples);
        } catch (JsonProcessingException ex) {
            throw new MappingException("Unable to serialize template examples", ex);
        }
    }

    private record TemplateRow(long id, TaskType taskType, String template, String description, List<String> examples,
                               Language startingLanguage, Language targetLanguage) { }

    private record ParameterRow(long templateId, TemplateParameter parameter) { }
}
