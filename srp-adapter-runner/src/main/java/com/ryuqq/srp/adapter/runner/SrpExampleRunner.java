package com.ryuqq.srp.adapter.runner;

import com.ryuqq.srp.adapter.inmemory.user.InMemoryUserRepository;
import com.ryuqq.srp.application.invoice.InvoiceManager;
import com.ryuqq.srp.application.kitchen.KitchenManager;
import com.ryuqq.srp.application.user.DefaultUserPresenter;
import com.ryuqq.srp.application.user.DefaultUserValidator;
import com.ryuqq.srp.application.user.UserService;
import com.ryuqq.srp.core.model.InvoiceFormat;
import com.ryuqq.srp.core.model.InvoiceRecord;
import com.ryuqq.srp.core.model.UserFormat;
import com.ryuqq.srp.core.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * 예제 실행기.
 *
 * <p>SRP 위반 예시를 먼저 실행한 뒤 분리된 예시, 청구서 예시, 주방 예시를 차례로 실행합니다.</p>
 *
 * <p><strong>실행 순서:</strong></p>
 * <ol>
 *   <li>Bad: MonolithicUser가 스스로 검증, 저장, 표현</li>
 *   <li>Good: UserService가 저장소, 검증기, 표현기에 위임</li>
 *   <li>Invoice: 400.0을 HTML과 PDF로 처리</li>
 *   <li>Kitchen: 요리 → 서빙 → 설거지</li>
 * </ol>
 *
 * <p>각 워크플로는 최상위에서 예외를 잡아 메시지를 출력하므로, 한 워크플로의 실패가
 * 다음 워크플로 실행을 막지 않습니다.</p>
 *
 * @author SRP Team
 * @since 1.0.0
 */
public final class SrpExampleRunner {

    private static final Logger log = LoggerFactory.getLogger(SrpExampleRunner.class);

    private final PrintStream out;

    /**
     * 생성자.
     *
     * @param out 결과 출력 대상
     * @throws IllegalArgumentException out이 null인 경우
     */
    public SrpExampleRunner(PrintStream out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.out = out;
    }

    public static void main(String[] args) {
        new SrpExampleRunner(System.out).runAll();
    }

    public void runAll() {
        runBadUserExample();
        runGoodUserExample();
        runInvoiceExample();
        runKitchenExample();
    }

    public void runBadUserExample() {
        out.println("--- Bad SRP Example ---");
        MonolithicUser badUser = new MonolithicUser("u123", "Alice Smith", "alice@example.com");

        if (badUser.isValid()) {
            badUser.saveToDatabase();
        } else {
            out.println("User is invalid, cannot save.");
        }

        out.println();
        out.println("Displaying user info:");
        out.println(badUser.formatForDisplay());
    }

    public void runGoodUserExample() {
        out.println();
        out.println("--- Good SRP Example ---");

        UserService userService = new UserService(
            new InMemoryUserRepository(),
            new DefaultUserValidator(),
            new DefaultUserPresenter()
        );

        try {
            UserRecord alice = userService.createUser("u123", "Alice Wonderland", "alice@example.com");
            out.println("Created: " + alice.name());

            UserRecord bob = userService.createUser("u124", "Bob The Builder", "bob@example.net");
            out.println("Created: " + bob.name());

            out.println();
            out.println("Formatted for console:");
            out.println(userService.getFormattedUserDetails("u123"));
            out.println();
            out.println("Formatted for JSON:");
            out.println(userService.getFormattedUserDetails("u124", UserFormat.JSON));

            try {
                userService.createUser("u125", "", "invalid");
            } catch (RuntimeException e) {
                out.println();
                out.println("Error creating user: " + e.getMessage());
            }

            UserRecord updatedBob = userService.activateUser("u124");
            out.println();
            out.println("Updated Bob: " + updatedBob.name() + " (Active: " + updatedBob.active() + ")");
        } catch (RuntimeException e) {
            log.error("Good SRP example aborted", e);
            out.println("An unexpected error occurred: " + e.getMessage());
        }
    }

    public void runInvoiceExample() {
        out.println();
        out.println("--- Invoice Manager SRP Example ---");
        InvoiceManager manager = InvoiceManager.withDefaults();
        InvoiceRecord rawOrderData = InvoiceRecord.of(400.0);

        try {
            manager.processInvoice(rawOrderData, "java.customer@example.com", InvoiceFormat.HTML);
            manager.processInvoice(rawOrderData, "another.java.customer@example.com", InvoiceFormat.PDF);
            out.println("Invoices processed.");
        } catch (RuntimeException e) {
            log.error("Invoice example aborted", e);
            out.println("An unexpected error occurred: " + e.getMessage());
        }
    }

    public void runKitchenExample() {
        out.println();
        out.println("--- Kitchen Manager SRP Example ---");
        try {
            new KitchenManager().run();
            out.println("Kitchen shift finished.");
        } catch (RuntimeException e) {
            log.error("Kitchen example aborted", e);
            out.println("An unexpected error occurred: " + e.getMessage());
        }
    }
}
