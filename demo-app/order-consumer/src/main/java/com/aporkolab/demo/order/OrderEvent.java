package com.aporkolab.demo.order;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderEvent(String orderId, String articleId, BigDecimal amount) {}
