package com.gt.vocab.user;

import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.LocalUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final int MAX_USER_NAME_LENGTH = 20;
    private static final Pattern VALID_USER_NAME = Pattern.compile("^[A-Za-z0-9_.-]+$");

    private final UserDao userDao;

    @Autowired
    public UserService(UserDao userDao) {
        this.userDao = userDao;
    }

    public LocalUser getUser(String username) {
        LocalUser user = userDao.loadUserByName(username);

        if (user == null) {
            throw new NotFoundException("User " + username + " does not exist");
        }

        return user;
    }

    public LocalUser registerUser(String username, Language sourceLanguage, Language targetLanguage) {
        if (username == null || username.isBlank() || username.length() > MAX_USER_NAME_LENGTH || !VALID_USER_NAME.matcher(username).matches()) {
            throw new IllegalArgumentException("Invalid user name: " + username);
        }
        if (sourceLanguage == targetLanguage) {
            throw new IllegalArgumentException("Source and target language must differ");
        }
        if (userDao.loadUserByName(username) != null) {
            throw new IllegalArgumentException("User " + username + " already exists");
        }

        long userId = userDao.createUser(username, sourceLanguage, targetLanguage);
        log.info("Registered user {} studying {}", username, targetLanguage.getDisplayName());

        return userDao.loadUser(userId);
    }
}
