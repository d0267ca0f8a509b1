package com.ryuqq.srp.application.user;

import com.ryuqq.srp.core.exception.ValidationException;
import com.ryuqq.srp.core.model.UserRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultUserValidatorTest {

    private final DefaultUserValidator validator = new DefaultUserValidator();

    @ParameterizedTest
    @ValueSource(strings = {"alice@example.com", "a@b.c", "first.last@domain", "x.y@z"})
    void 이름과_이메일이_유효하면_통과(String email) {
        UserRecord user = UserRecord.create("u1", "Alice", email);

        assertThatCode(() -> validator.validate(user)).doesNotThrowAnyException();
        assertThat(validator.isValid(user)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {" ", "\t", "  \n "})
    void 빈_이름은_이메일과_무관하게_실패(String name) {
        UserRecord validEmail = UserRecord.create("u1", name, "alice@example.com");
        UserRecord invalidEmail = UserRecord.create("u2", name, "invalid");

        for (UserRecord user : new UserRecord[] {validEmail, invalidEmail}) {
            assertThatThrownBy(() -> validator.validate(user))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("name"));
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"invalid", "alice.example.com", "alice@example", "@", "."})
    void 이메일에_골뱅이나_점이_없으면_실패(String email) {
        UserRecord user = UserRecord.create("u1", "Alice", email);

        assertThatThrownBy(() -> validator.validate(user))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("Invalid email format")
            .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("email"));
        assertThat(validator.isValid(user)).isFalse();
    }

    @Test
    void null_레코드면_IllegalArgumentException() {
        assertThatThrownBy(() -> validator.validate(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
