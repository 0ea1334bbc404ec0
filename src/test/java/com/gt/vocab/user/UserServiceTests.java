package com.gt.vocab.user;

import com.gt.vocab.exception.NotFoundException;
import com.gt.vocab.model.Language;
import com.gt.vocab.model.LocalUser;
import com.gt.vocab.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(SpringExtension.class)
public class UserServiceTests {

    private static final LocalUser TEST_USER = TestUtils.getTestUser();

    @Mock private UserDao userDao;

    private UserService userService;

    @BeforeEach
    public void setup() {
        userService = new UserService(userDao);
    }

    @Test
    public void testGetUser() {
        when(userDao.loadUserByName(TEST_USER.username())).thenReturn(TEST_USER);
        when(userDao.loadUserByName("nobody")).thenReturn(null);

        assertEquals(TEST_USER, userService.getUser(TEST_USER.username()));
        assertThrows(NotFoundException.class, () -> userService.getUser("nobody"));
    }

    @Test
    public void testRegisterUser() {
        when(userDao.loadUserByName(TEST_USER.username())).thenReturn(null);
        when(userDao.createUser(TEST_USER.username(), Language.English, Language.German)).thenReturn(TEST_USER.id());
        when(userDao.loadUser(TEST_USER.id())).thenReturn(TEST_USER);

        assertEquals(TEST_USER, userService.registerUser(TEST_USER.username(), Language.English, Language.German));
    }

    @Test
    public void testRegisterUser_Existing() {
        when(userDao.loadUserByName(TEST_USER.username())).thenReturn(TEST_USER);

        assertThrows(IllegalArgumentException.class, () -> userService.registerUser(TEST_USER.username(), Language.English, Language.German));
        verify(userDao, never()).createUser(anyString(), any(), any());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "has space", "waytoolongusername_123", "semi;colon"})
    public void testRegisterUser_InvalidName(String username) {
        assertThrows(IllegalArgumentException.class, () -> userService.registerUser(username, Language.English, Language.German));
        verifyNoInteractions(userDao);
    }

    @Test
    public void testRegisterUser_SameLanguages() {
        assertThrows(IllegalArgumentException.class, () -> userService.registerUser("anna", Language.German, Language.German));
        verifyNoInteractions(userDao);
    }
}
