package com.ryuqq.srp.application.kitchen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 요리 담당.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class Chef {

    private static final Logger log = LoggerFactory.getLogger(Chef.class);

    public void prepareFood() {
        log.info("Chef is preparing food");
    }
}
