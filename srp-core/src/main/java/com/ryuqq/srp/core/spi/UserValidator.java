package com.ryuqq.srp.core.spi;

import com.ryuqq.srp.core.exception.ValidationException;
import com.ryuqq.srp.core.model.UserRecord;

/**
 * User validation SPI.
 *
 * <p>Changes only if the business rules for a valid user change.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public interface UserValidator {

    /**
     * Validates the record, failing on the first violated rule.
     *
     * @param user the record to validate
     * @throws ValidationException if a rule is violated
     * @throws IllegalArgumentException if user is null
     */
    void validate(UserRecord user);

    /**
     * Non-throwing variant of {@link #validate(UserRecord)}.
     *
     * @param user the record to validate
     * @return true if no rule is violated
     */
    default boolean isValid(UserRecord user) {
        try {
            validate(user);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }
}
