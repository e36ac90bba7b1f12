package com.aporkolab.demo.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Order Consumer - demonstrates bounded retry and dead-letter routing.
 *
 * Flow:
 * 1. Poll order events from the "orders" topic
 * 2. Validate the payload (malformed or non-positive amount goes straight to orders.dlt)
 * 3. Book the order (inventory outages are retried with exponential backoff)
 * 4. Commit the offset once the order is booked or dead-lettered
 */
@SpringBootApplication
@EnableConfigurationProperties(OrderConsumerProperties.class)
public class OrderConsumerApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderConsumerApplication.class, args);
    }
}
