package com.gt.vocab.user.impl;

import com.gt.vocab.exception.DaoException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.LocalUser;
import com.gt.vocab.user.UserDao;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class UserDaoPG implements UserDao {

    private static final String USER_COLUMNS = "id, user_name, source_language, target_language, create_instant";

    private static final String LOAD_USER_BY_NAME_SQL =
            "SELECT " + USER_COLUMNS + " FROM users WHERE user_name = :username";

    private static final String LOAD_USER_SQL =
            "SELECT " + USER_COLUMNS + " FROM users WHERE id = :userId";

    private static final String CREATE_USER_SQL =
            "INSERT INTO users (user_name, source_language, target_language) " +
            "VALUES (:username, :sourceLanguage, :targetLanguage)";

    private final NamedParameterJdbcTemplate template;

    public UserDaoPG(NamedParameterJdbcTemplate namedParameterJdbcTemplate) {
        this.template = namedParameterJdbcTemplate;
    }

    @Override
    public LocalUser loadUserByName(String username) {
        List<LocalUser> users = template.query(LOAD_USER_BY_NAME_SQL, Map.of("username", username), UserDaoPG::getUserFromResultSet);

        return users.isEmpty() ? null : users.get(0);
    }

    @Override
    public LocalUser loadUser(long userId) {
        List<LocalUser> users = template.query(LOAD_USER_SQL, Map.of("userId", userId), UserDaoPG::getUserFromResultSet);

        return users.isEmpty() ? null : users.get(0);
    }

    @Override
    public long createUser(String username, Language sourceLanguage, Language targetLanguage) {
        KeyHolder keyHolder = new GeneratedKeyHolder();

        template.update(CREATE_USER_SQL, new MapSqlParameterSource(Map.of(
                "username", username,
                "sourceLanguage", sourceLanguage.toString(),
                "targetLanguage", targetLanguage.toString())), keyHolder, new String[] { "id" });

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new DaoException("No id generated for user " + username);
        }

        return key.longValue();
    }

    private static LocalUser getUserFromResultSet(ResultSet rs, int rowNum) throws SQLException {
        return new LocalUser(
                rs.getLong("id"),
                rs.getString("user_name"),
                Language.valueOf(rs.getString("source_language")),
                Language.valueOf(rs.getString("target_language")),
                toInstant(rs.getTimestamp("create_instant")));
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
