package com.ryuqq.srp.core.exception;

/**
 * 식별자에 해당하는 레코드가 없는 경우.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class NotFoundException extends SrpException {

    private final String resource;
    private final String id;

    /**
     * 생성자.
     *
     * @param resource 리소스 이름 (예: User)
     * @param id 조회한 식별자
     */
    public NotFoundException(String resource, String id) {
        super(SrpErrorCode.NOT_FOUND, resource, id);
        this.resource = resource;
        this.id = id;
    }

    /**
     * User 리소스용 NotFoundException 생성.
     *
     * @param userId 사용자 식별자
     * @return NotFoundException
     */
    public static NotFoundException user(String userId) {
        return new NotFoundException("User", userId);
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
