package com.ryuqq.srp.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 여러 책임을 한 클래스에 모은 사용자 (SRP 위반 예시).
 *
 * <p>데이터 보관, 저장, 검증, 표현이 모두 이 클래스 안에 있으므로
 * 저장 방식, 검증 규칙, 출력 형식 중 어느 것이 바뀌어도 이 클래스를 수정해야 합니다.
 * 분리된 구조는 {@code com.ryuqq.srp.application.user} 패키지를 참고하세요.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class MonolithicUser {

    private static final Logger log = LoggerFactory.getLogger(MonolithicUser.class);

    private final String id;
    private String name;
    private String email;
    private boolean active;

    public MonolithicUser(String id, String name, String email) {
        this(id, name, email, true);
    }

    public MonolithicUser(String id, String name, String email, boolean active) {
        this.id = id;
        this.name = name;
        this.email = email;
        this.active = active;
    }

    // 저장 방식이 바뀌면 변경됨
    public void saveToDatabase() {
        log.info("Saving user {} ({}) to database", name, id);
        log.info("User saved to DB successfully");
    }

    // 검증 규칙이 바뀌면 변경됨
    public boolean isValid() {
        log.info("Validating user {} ({})", name, id);
        if (name == null || name.isBlank()) {
            log.warn("Validation failed: Name cannot be blank");
            return false;
        }
        if (email == null || !email.contains("@")) {
            log.warn("Validation failed: Invalid email format");
            return false;
        }
        log.info("Validation successful");
        return true;
    }

    // 출력 형식이 바뀌면 변경됨
    public String formatForDisplay() {
        log.info("Formatting user {} ({}) for display", name, id);
        return "User ID: " + id + "\nName: " + name + "\nEmail: " + email + "\nStatus: " + (active ? "Active" : "Inactive");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
