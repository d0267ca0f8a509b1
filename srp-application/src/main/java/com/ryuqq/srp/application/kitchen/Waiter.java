package com.ryuqq.srp.application.kitchen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 서빙 담당.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class Waiter {

    private static final Logger log = LoggerFactory.getLogger(Waiter.class);

    public void serveCustomers() {
        log.info("Waiter is serving customers");
    }
}
