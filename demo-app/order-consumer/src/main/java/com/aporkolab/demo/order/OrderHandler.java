package com.aporkolab.demo.order;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.aporkolab.redelivery.core.Message;
import com.aporkolab.redelivery.core.MessageHandler;
import com.aporkolab.redelivery.exception.TransientProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Books validated orders. Redelivered orders are booked once.
 */
@Component
public class OrderHandler implements MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(OrderHandler.class);

    private final ObjectMapper objectMapper;
    private final OrderConsumerProperties properties;
    private final Map<String, OrderEvent> bookedOrders = new ConcurrentHashMap<>();

    public OrderHandler(ObjectMapper objectMapper, OrderConsumerProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void handle(Message message) throws IOException {
        OrderEvent order = objectMapper.readValue(message.value(), OrderEvent.class);

        if (properties.getUnavailableArticles().contains(order.articleId())) {
            throw TransientProcessingException.dependencyUnavailable("inventory",
                    new IllegalStateException("no stock information for article " + order.articleId()));
        }

        OrderEvent previous = bookedOrders.putIfAbsent(order.orderId(), order);
        if (previous != null) {
            log.debug("Order {} already booked, skipping redelivery", order.orderId());
            return;
        }
        log.info("Booked order {} for article {} (amount {})", order.orderId(), order.articleId(), order.amount());
    }

    public Map<String, OrderEvent> getBookedOrders() {
        return Map.copyOf(bookedOrders);
    }
}
