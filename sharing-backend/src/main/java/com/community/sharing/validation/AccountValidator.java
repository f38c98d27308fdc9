package com.community.sharing.validation;

import com.community.sharing.dto.LoginRequest;
import com.community.sharing.dto.RegisterRequest;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

import static com.community.sharing.validation.RequestFields.*;

/**
 * 注册 / 登录请求校验
 */
@Component
public class AccountValidator {

    private static final Set<String> REGISTER_FIELDS = Set.of("username", "email", "password");
    private static final Set<String> LOGIN_FIELDS = Set.of("username", "password");

    public RegisterRequest validateRegistration(Map<String, Object> body) {
        requireBody(body);
        FieldErrors errors = new FieldErrors();
        rejectUnknown(body, REGISTER_FIELDS, errors);

        String username = string(body, "username", true, false, errors);
        checkLength("username", username, 3, 50, errors);

        String email = string(body, "email", true, false, errors);
        if (email != null && !isEmail(email)) {
            errors.reject("email", NOT_EMAIL);
        }
        checkLength("email", email, null, 255, errors);

        String password = string(body, "password", true, false, errors);
        checkLength("password", password, 6, null, errors);

        errors.throwIfAny();
        return new RegisterRequest(username, email, password);
    }

    public LoginRequest validateLogin(Map<String, Object> body) {
        requireBody(body);
        FieldErrors errors = new FieldErrors();
        rejectUnknown(body, LOGIN_FIELDS, errors);
        String username = string(body, "username", true, false, errors);
        String password = string(body, "password", true, false, errors);
        errors.throwIfAny();
        return new LoginRequest(username, password);
    }
}
