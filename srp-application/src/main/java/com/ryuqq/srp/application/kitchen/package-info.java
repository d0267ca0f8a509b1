/**
 * Kitchen workflow - 직원별 단일 업무와 이를 순서대로 호출하는 KitchenManager.
 *
 * @author SRP Team
 * @since 1.0.0
 */
package com.ryuqq.srp.application.kitchen;
