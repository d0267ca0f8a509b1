package com.ryuqq.srp.application.user;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.srp.core.model.UserRecord;
import com.ryuqq.srp.core.spi.UserPresenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 기본 사용자 표현기.
 *
 * <p>JSON 직렬화는 Jackson {@link ObjectMapper}로 수행하며 필드 순서는 id, name, email, active입니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class DefaultUserPresenter implements UserPresenter {

    private static final Logger log = LoggerFactory.getLogger(DefaultUserPresenter.class);

    private final ObjectMapper objectMapper;

    public DefaultUserPresenter() {
        this(new ObjectMapper());
    }

    /**
     * 생성자.
     *
     * @param objectMapper JSON 직렬화에 사용할 ObjectMapper
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public DefaultUserPresenter(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    @Override
    public String formatForConsole(UserRecord user) {
        requireUser(user);
        log.debug("Formatting user {} for console display", user.id());
        return "User ID: " + user.id()
            + "\nName: " + user.name()
            + "\nEmail: " + user.email()
            + "\nStatus: " + (user.active() ? "Active" : "Inactive");
    }

    @Override
    public String formatForJson(UserRecord user) {
        requireUser(user);
        log.debug("Formatting user {} for JSON display", user.id());

        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", user.id());
        node.put("name", user.name());
        node.put("email", user.email());
        node.put("active", user.active());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize user " + user.id(), e);
        }
    }

    private static void requireUser(UserRecord user) {
        if (user == null) {
            throw new IllegalArgumentException("user cannot be null");
        }
    }
}
