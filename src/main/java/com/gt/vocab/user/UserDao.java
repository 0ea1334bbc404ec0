package com.gt.vocab.user;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.LocalUser;

public interface UserDao {

    LocalUser loadUserByName(String username);

    LocalUser loadUser(long userId);

    long createUser(String username, Language sourceLanguage, Language targetLanguage);
}
