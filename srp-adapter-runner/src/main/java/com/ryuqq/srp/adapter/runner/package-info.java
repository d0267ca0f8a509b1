/**
 * Example runner - SRP 위반 예시와 분리된 예시를 순서대로 실행하는 진입점.
 *
 * <ul>
 *   <li>{@link com.ryuqq.srp.adapter.runner.SrpExampleRunner} - main 진입점</li>
 *   <li>{@link com.ryuqq.srp.adapter.runner.MonolithicUser} - 모든 책임을 가진 사용자 (비교용)</li>
 * </ul>
 *
 * @author SRP Team
 * @since 1.0.0
 */
package com.ryuqq.srp.adapter.runner;
