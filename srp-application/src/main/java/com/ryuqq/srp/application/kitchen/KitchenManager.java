package com.ryuqq.srp.application.kitchen;

/**
 * 주방 업무 조정자.
 *
 * <p>각 직원이 자기 업무 하나만 수행하고, KitchenManager는 순서만 결정합니다.</p>
 *
 * <pre>
 * chef.prepareFood() → waiter.serveCustomers() → dishwasher.washDishes()
 * </pre>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class KitchenManager {

    private final Chef chef;
    private final Waiter waiter;
    private final Dishwasher dishwasher;

    public KitchenManager() {
        this(new Chef(), new Waiter(), new Dishwasher());
    }

    /**
     * 생성자.
     *
     * @param chef 요리 담당
     * @param waiter 서빙 담당
     * @param dishwasher 설거지 담당
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public KitchenManager(Chef chef, Waiter waiter, Dishwasher dishwasher) {
        if (chef == null) {
            throw new IllegalArgumentException("chef cannot be null");
        }
        if (waiter == null) {
            throw new IllegalArgumentException("waiter cannot be null");
        }
        if (dishwasher == null) {
            throw new IllegalArgumentException("dishwasher cannot be null");
        }
        this.chef = chef;
        this.waiter = waiter;
        this.dishwasher = dishwasher;
    }

    public void run() {
        chef.prepareFood();
        waiter.serveCustomers();
        dishwasher.washDishes();
    }
}
