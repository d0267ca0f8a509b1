package com.ryuqq.srp.application.kitchen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;

@ExtendWith(MockitoExtension.class)
class KitchenManagerTest {

    @Mock
    private Chef chef;

    @Mock
    private Waiter waiter;

    @Mock
    private Dishwasher dishwasher;

    @Test
    void run_요리_서빙_설거지_순서() {
        KitchenManager manager = new KitchenManager(chef, waiter, dishwasher);

        manager.run();

        InOrder inOrder = inOrder(chef, waiter, dishwasher);
        inOrder.verify(chef).prepareFood();
        inOrder.verify(waiter).serveCustomers();
        inOrder.verify(dishwasher).washDishes();
        inOrder.verifyNoMoreInteractions();
    }

    @Test
    void 기본_직원으로_실행() {
        assertThatCode(() -> new KitchenManager().run()).doesNotThrowAnyException();
    }

    @Test
    void 생성자_null_의존성이면_예외() {
        assertThatThrownBy(() -> new KitchenManager(null, waiter, dishwasher))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("chef");
    }
}
