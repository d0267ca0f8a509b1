package com.ryuqq.srp.adapter.inmemory.user;

import com.ryuqq.srp.core.model.UserRecord;
import com.ryuqq.srp.core.spi.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link UserRepository} SPI.
 *
 * <p>Records live in a single {@link ConcurrentHashMap} owned by this instance for the
 * lifetime of the process. Each orchestrator receives its repository at construction
 * time; there is no shared static store.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>users:</strong> ConcurrentHashMap&lt;String, UserRecord&gt; - id → record (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No eviction and no size bound</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * UserRepository repository = new InMemoryUserRepository();
 * repository.save(UserRecord.create("u123", "Alice", "alice@example.com"));
 * Optional&lt;UserRecord&gt; alice = repository.getById("u123");
 * </pre>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class InMemoryUserRepository implements UserRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserRepository.class);

    /**
     * Key: user id, Value: last saved record.
     */
    private final ConcurrentHashMap<String, UserRecord> users;

    /**
     * Creates a new InMemoryUserRepository with empty storage.
     */
    public InMemoryUserRepository() {
        this.users = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Overwrites any record previously stored under the same id.</p>
     */
    @Override
    public UserRecord save(UserRecord user) {
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
        log.debug("Saving user {} ({}) to in-memory store", user.name(), user.id());
        users.put(user.id(), user);
        return user;
    }

    @Override
    public Optional<UserRecord> getById(String userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        log.debug("Finding user by ID: {}", userId);
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public int count() {
        return users.size();
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        users.clear();
    }
}
