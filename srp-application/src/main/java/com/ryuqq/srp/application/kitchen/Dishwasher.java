package com.ryuqq.srp.application.kitchen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 설거지 담당.
 *
 * @author SRP Team
 * @since 1.0.0
 */
public class Dishwasher {

    private static final Logger log = LoggerFactory.getLogger(Dishwasher.class);

    public void washDishes() {
        log.info("Dishwasher is washing dishes");
    }
}
