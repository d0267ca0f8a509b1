/**
 * In-memory User repository adapter package.
 *
 * <p>Provides {@link com.ryuqq.srp.adapter.inmemory.user.InMemoryUserRepository}, the
 * process-local implementation of {@link com.ryuqq.srp.core.spi.UserRepository}
 * used by the example runner and by tests.</p>
 *
 * @see com.ryuqq.srp.core.spi.UserRepository
 * @author SRP Team
 * @since 1.0.0
 */
package com.ryuqq.srp.adapter.inmemory.user;
