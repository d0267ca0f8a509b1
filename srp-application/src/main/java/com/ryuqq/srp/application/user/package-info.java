/**
 * User workflow - 사용자 생성, 조회 및 표현, 활성화.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.srp.application.user.UserService} - 워크플로 조정자</li>
 *   <li>{@link com.ryuqq.srp.application.user.DefaultUserValidator} - 이름 / 이메일 규칙</li>
 *   <li>{@link com.ryuqq.srp.application.user.DefaultUserPresenter} - 콘솔 / JSON 표현</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>단일 책임:</strong> 각 클래스는 하나의 변경 이유만 가짐</li>
 *   <li><strong>의존성 역전:</strong> UserService는 core.spi 인터페이스에만 의존</li>
 *   <li><strong>즉시 실패:</strong> 재시도 없이 첫 실패를 호출자에게 전파</li>
 * </ul>
 *
 * @author SRP Team
 * @since 1.0.0
 */
package com.ryuqq.srp.application.user;
