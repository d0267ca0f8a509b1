package com.ryuqq.srp.core.model;

/**
 * 사용자 데이터 레코드.
 *
 * <p>UserRecord는 데이터만 보관하며 저장, 검증, 표현 로직을 갖지 않습니다.
 * 각 책임은 {@code UserRepository}, {@code UserValidator}, {@code UserPresenter}가 담당합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 상태 변경은 새 인스턴스를 반환합니다.</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>id: null 또는 빈 문자열 불가 (생성 후 변경 불가)</li>
 *   <li>name, email: 레코드 수준에서는 검증하지 않음 (UserValidator 책임)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * UserRecord alice = UserRecord.create("u123", "Alice Wonderland", "alice@example.com");
 * UserRecord inactive = alice.withActive(false);
 * </pre>
 *
 * @param id 사용자 식별자
 * @param name 사용자 이름 (null 가능)
 * @param email 이메일 주소 (null 가능)
 * @param active 활성화 여부
 *
 * @author SRP Team
 * @since 1.0.0
 */
public record UserRecord(
    String id,
    String name,
    String email,
    boolean active
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public UserRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        // name, email은 null 허용 (검증은 UserValidator 책임)
    }

    /**
     * 활성 상태의 UserRecord 생성.
     *
     * @param id 사용자 식별자
     * @param name 사용자 이름
     * @param email 이메일 주소
     * @return 활성 상태의 UserRecord
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public static UserRecord create(String id, String name, String email) {
        return new UserRecord(id, name, email, true);
    }

    /**
     * active만 변경한 새 인스턴스 생성.
     *
     * @param active 새로운 활성화 여부
     * @return 새 UserRecord 인스턴스 (id 동일)
     */
    public UserRecord withActive(boolean active) {
        return new UserRecord(this.id, this.name, this.email, active);
    }

    /**
     * 활성화된 새 인스턴스 생성.
     *
     * @return active=true인 UserRecord
     */
    public UserRecord activate() {
        return withActive(true);
    }
}
