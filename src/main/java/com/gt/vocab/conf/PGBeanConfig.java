package com.gt.vocab.conf;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gt.vocab.lesson.LessonDao;
import com.gt.vocab.lesson.impl.LessonDaoPG;
import com.gt.vocab.mastery.MasteryDao;
import com.gt.vocab.mastery.impl.MasteryDaoPG;
import com.gt.vocab.task.ResourceDao;
import com.gt.vocab.task.TaskDao;
import com.gt.vocab.task.impl.ResourceDaoPG;
import com.gt.vocab.task.impl.TaskDaoPG;
import com.gt.vocab.template.TemplateDao;
import com.gt.vocab.template.impl.TemplateDaoPG;
import com.gt.vocab.user.UserDao;
import com.gt.vocab.user.impl.UserDaoPG;
import com.gt.vocab.word.WordDao;
import com.gt.vocab.word.impl.WordDaoPG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;

@Configuration
public class PGBeanConfig {

    @Bean
    public DataSource getDataSource(@Value("${vocab.datasource.postgres.url}") String url,
                                    @Value("${vocab.datasource.postgres.username}") String username,
                                    @Value("${vocab.datasource.postgres.password}") String password) {
        return new DriverManagerDataSource(url, username, password);
    }

    @Bean
    public NamedParameterJdbcTemplate getNamedParameterJdbcTemplate(DataSource dataSource) {

        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public WordDao getWordDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new WordDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public UserDao getUserDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new UserDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public MasteryDao getMasteryDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new MasteryDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public TemplateDao getTemplateDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate, ObjectMapper objectMapper) {
        return new TemplateDaoPG(namedParameterJdbcTemplate, objectMapper);
    }

    @Bean
    public ResourceDao getResourceDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new ResourceDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public TaskDao getTaskDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new TaskDaoPG(namedParameterJdbcTemplate);
    }

    @Bean
    public LessonDao getLessonDao(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        return new LessonDaoPG(namedParameterJdbcTemplate);
    }
}
