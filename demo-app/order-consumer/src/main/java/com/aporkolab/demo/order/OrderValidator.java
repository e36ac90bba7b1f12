package com.aporkolab.demo.order;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.aporkolab.redelivery.core.Message;
import com.aporkolab.redelivery.core.MessageValidator;
import com.aporkolab.redelivery.exception.ValidationException;
import com.aporkolab.redelivery.exception.ValidationException.FieldError;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Rejects order events that no amount of retrying could fix.
 */
@Component
public class OrderValidator implements MessageValidator {

    private final ObjectMapper objectMapper;

    public OrderValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void validate(Message message) throws ValidationException {
        OrderEvent order = parse(message);

        List<FieldError> errors = new ArrayList<>();
        if (order.orderId() == null || order.orderId().isBlank()) {
            errors.add(new FieldError("orderId", "is required"));
        }
        if (order.articleId() == null || order.articleId().isBlank()) {
            errors.add(new FieldError("articleId", "is required"));
        }
        if (order.amount() == null) {
            errors.add(new FieldError("amount", "is required"));
        } else if (order.amount().compareTo(BigDecimal.ZERO) <= 0) {
            errors.add(new FieldError("amount", "must be positive but was " + order.amount().toPlainString()));
        }

        if (errors.size() == 1) {
            FieldError error = errors.get(0);
            throw new ValidationException(error.field(), error.message());
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    OrderEvent parse(Message message) throws ValidationException {
        if (message.value() == null || message.value().length == 0) {
            throw new ValidationException("payload", "is empty");
        }
        try {
            OrderEvent order = objectMapper.readValue(message.value(), OrderEvent.class);
            if (order == null) {
                throw new ValidationException("payload", "is null");
            }
            return order;
        } catch (IOException e) {
            throw new ValidationException("Payload is not a valid order event: " + e.getMessage(), e);
        }
    }
}
