package com.ryuqq.srp.core.spi;

import com.ryuqq.srp.core.model.UserRecord;

import java.util.Optional;

/**
 * User persistence SPI.
 *
 * <p>Stores and retrieves {@link UserRecord}s keyed by id. Changes only if the storage
 * mechanism or schema changes.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>save is an upsert: the last write for an id wins</li>
 *   <li>getById never returns two distinct records for the same id</li>
 *   <li>A miss is reported with {@link Optional#empty()}, never with an exception</li>
 * </ul>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public interface UserRepository {

    /**
     * Inserts or replaces the record stored under {@code user.id()}.
     *
     * @param user the record to store
     * @return the stored record
     * @throws IllegalArgumentException if user is null
     */
    UserRecord save(UserRecord user);

    /**
     * Looks up a record by id.
     *
     * @param userId the user id
     * @return the stored record, or empty if no record exists for the id
     * @throws IllegalArgumentException if userId is null
     */
    Optional<UserRecord> getById(String userId);

    /**
     * Returns the number of stored records.
     *
     * @return record count
     */
    int count();

    default boolean existsById(String userId) {
        return getById(userId).isPresent();
    }
}
