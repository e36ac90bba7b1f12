package com.aporkolab.demo.order;

import java.util.HashSet;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "demo.orders")
public class OrderConsumerProperties {

    /** Articles whose inventory is treated as unreachable, to demonstrate retries. */
    private volatile Set<String> unavailableArticles = new HashSet<>();

    public Set<String> getUnavailableArticles() {
        return unavailableArticles;
    }

    public void setUnavailableArticles(Set<String> unavailableArticles) {
        this.unavailableArticles = unavailableArticles;
    }
}
