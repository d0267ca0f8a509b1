package com.ryuqq.srp.application.user;

import com.ryuqq.srp.core.exception.ValidationException;
import com.ryuqq.srp.core.model.UserRecord;
import com.ryuqq.srp.core.spi.UserValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기본 사용자 검증기.
 *
 * <p><strong>규칙 (순서대로, 첫 실패에서 중단):</strong></p>
 * <ol>
 *   <li>name: null 또는 공백만으로 구성 불가</li>
 *   <li>email: '@'와 '.'을 모두 포함해야 함</li>
 * </ol>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class DefaultUserValidator implements UserValidator {

    private static final Logger log = LoggerFactory.getLogger(DefaultUserValidator.class);

    @Override
    public void validate(UserRecord user) {
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
        log.debug("Validating user {} ({})", user.name(), user.id());

        String name = user.name();
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "User name cannot be blank.");
        }

        String email = user.email();
        if (email == null || !email.contains("@") || !email.contains(".")) {
            throw new ValidationException("email", "Invalid email format for " + email + ".");
        }

        log.debug("Validation successful for {}", user.id());
    }
}
