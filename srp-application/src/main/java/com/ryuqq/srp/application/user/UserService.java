package com.ryuqq.srp.application.user;

import com.ryuqq.srp.core.exception.NotFoundException;
import com.ryuqq.srp.core.exception.UnsupportedFormatException;
import com.ryuqq.srp.core.exception.ValidationException;
import com.ryuqq.srp.core.model.UserFormat;
import com.ryuqq.srp.core.model.UserRecord;
import com.ryuqq.srp.core.spi.UserPresenter;
import com.ryuqq.srp.core.spi.UserRepository;
import com.ryuqq.srp.core.spi.UserValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 사용자 워크플로 조정자.
 *
 * <p>사용자 생명주기(생성, 조회 및 표현, 활성화)의 단계만 결정하고,
 * 실제 작업은 협력 객체에게 위임합니다.</p>
 *
 * <p><strong>워크플로:</strong></p>
 * <pre>
 * createUser:              build(active) → validate → save
 * getFormattedUserDetails: getById → format
 * activateUser:            getById → activate → save
 * </pre>
 *
 * <p>재시도는 없으며, 첫 번째 실패가 워크플로를 중단하고 호출자에게 전파됩니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final UserValidator userValidator;
    private final UserPresenter userPresenter;

    /**
     * 생성자.
     *
     * @param userRepository 저장소
     * @param userValidator 검증기
     * @param userPresenter 표현기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public UserService(UserRepository userRepository, UserValidator userValidator, UserPresenter userPresenter) {
        if (userRepository == null) {
            throw new IllegalArgumentException("userRepository cannot be null");
        }
        if (userValidator == null) {
            throw new IllegalArgumentException("userValidator cannot be null");
        }
        if (userPresenter == null) {
            throw new IllegalArgumentException("userPresenter cannot be null");
        }
        this.userRepository = userRepository;
        this.userValidator = userValidator;
        this.userPresenter = userPresenter;
    }

    /**
     * 사용자 생성.
     *
     * @param id 사용자 식별자
     * @param name 이름
     * @param email 이메일
     * @return 저장된 사용자 (active=true)
     * @throws ValidationException 이름 또는 이메일이 규칙을 위반한 경우
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public UserRecord createUser(String id, String name, String email) {
        UserRecord newUser = UserRecord.create(id, name, email);

        // 1. 검증 (실패 시 즉시 중단)
        userValidator.validate(newUser);

        // 2. 저장
        UserRecord saved = userRepository.save(newUser);
        log.info("User created: {}", saved.id());
        return saved;
    }

    /**
     * 지정 형식으로 사용자 정보 조회.
     *
     * @param userId 사용자 식별자
     * @param format 출력 형식
     * @return 형식화된 문자열
     * @throws NotFoundException 사용자가 없는 경우
     * @throws IllegalArgumentException format이 null인 경우
     */
    public String getFormattedUserDetails(String userId, UserFormat format) {
        UserRecord user = findExisting(userId);
        return userPresenter.format(user, format);
    }

    /**
     * 형식 태그로 사용자 정보 조회.
     *
     * <p>조회가 먼저 수행되므로 사용자가 없으면 태그와 무관하게 {@link NotFoundException}이 발생합니다.</p>
     *
     * @param userId 사용자 식별자
     * @param formatTag 형식 태그 (console, json)
     * @return 형식화된 문자열
     * @throws NotFoundException 사용자가 없는 경우
     * @throws UnsupportedFormatException 지원하지 않는 태그인 경우
     */
    public String getFormattedUserDetails(String userId, String formatTag) {
        UserRecord user = findExisting(userId);
        return userPresenter.format(user, UserFormat.fromTag(formatTag));
    }

    /**
     * 콘솔 형식으로 사용자 정보 조회.
     *
     * @param userId 사용자 식별자
     * @return 콘솔 형식 문자열
     * @throws NotFoundException 사용자가 없는 경우
     */
    public String getFormattedUserDetails(String userId) {
        return getFormattedUserDetails(userId, UserFormat.CONSOLE);
    }

    /**
     * 사용자 활성화 (멱등).
     *
     * @param userId 사용자 식별자
     * @return 갱신 후 저장된 사용자
     * @throws NotFoundException 사용자가 없는 경우
     */
    public UserRecord activateUser(String userId) {
        UserRecord user = findExisting(userId);
        UserRecord saved = userRepository.save(user.activate());
        log.info("User activated: {} (was active: {})", saved.id(), user.active());
        return saved;
    }

    private UserRecord findExisting(String userId) {
        if (userId == null) {
            throw new IllegalArgumentException("userId cannot be null");
        }
        return userRepository.getById(userId)
            .orElseThrow(() -> NotFoundException.user(userId));
    }
}
