package com.ryuqq.srp.core.spi;

import com.ryuqq.srp.core.model.UserFormat;
import com.ryuqq.srp.core.model.UserRecord;

/**
 * User presentation SPI.
 *
 * <p>Both operations are pure functions of the record. Changes only if the display
 * requirements change.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public interface UserPresenter {

    /**
     * Formats the record as a fixed-layout multi-line block.
     *
     * <pre>
     * User ID: u123
     * Name: Alice Wonderland
     * Email: alice@example.com
     * Status: Active
     * </pre>
     *
     * @param user the record to format
     * @return console text
     */
    String formatForConsole(UserRecord user);

    /**
     * Formats the same four fields as a JSON object.
     *
     * @param user the record to format
     * @return JSON text
     */
    String formatForJson(UserRecord user);

    /**
     * Dispatches to the formatter for the given format.
     *
     * @param user the record to format
     * @param format the output format
     * @return formatted text
     * @throws IllegalArgumentException if format is null
     */
    default String format(UserRecord user, UserFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        return switch (format) {
            case CONSOLE -> formatForConsole(user);
            case JSON -> formatForJson(user);
        };
    }
}
