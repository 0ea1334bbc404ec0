package com.gt.vocab.user;

import com.gt.vocab.model.Language;
import com.gt.vocab.model.LocalUser;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/rest/users")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping(consumes = "application/json", produces = "application/json")
    @ResponseStatus(HttpStatus.CREATED)
    public LocalUser registerUser(@RequestBody RegisterUserRequest request) {
        return userService.registerUser(
                request.username(),
                request.sourceLanguage() == null ? Language.English : request.sourceLanguage(),
                request.targetLanguage() == null ? Language.German : request.targetLanguage());
    }

    @GetMapping(value = "/{username}", produces = "application/json")
    public LocalUser getUser(@PathVariable("username") String username) {
        return userService.getUser(username);
    }

    private record RegisterUserRequest(String username, Language sourceLanguage, Language targetLanguage) { }
}
