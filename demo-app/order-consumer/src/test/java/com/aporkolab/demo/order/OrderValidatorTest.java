package com.aporkolab.demo.order;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.aporkolab.redelivery.core.Message;
import com.aporkolab.redelivery.exception.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;

class OrderValidatorTest {

    private final OrderValidator validator = new OrderValidator(new ObjectMapper());

    private static Message order(String json) {
        return Message.builder()
                .sourceTopic("orders")
                .value(json == null ? null : json.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    @Nested
    @DisplayName("Valid orders")
    class Valid {

        @Test
        @DisplayName("should accept a positive amount")
        void positiveAmount() {
            assertThatCode(() -> validator.validate(order("{\"orderId\":\"U1\",\"articleId\":\"A1\",\"amount\":1}")))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should ignore unknown fields")
        void unknownFields() {
            assertThatCode(() -> validator.validate(order(
                    "{\"orderId\":\"U3\",\"articleId\":\"A3\",\"amount\":9.99,\"channel\":\"web\"}")))
                    .doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Invalid orders")
    class Invalid {

        @Test
        @DisplayName("should reject a negative amount")
        void negativeAmount() {
            assertThatThrownBy(() -> validator.validate(order("{\"orderId\":\"U2\",\"articleId\":\"A2\",\"amount\":-2}")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("amount")
                    .hasMessageContaining("-2");
        }

        @Test
        @DisplayName("should reject a zero amount")
        void zeroAmount() {
            assertThatThrownBy(() -> validator.validate(order("{\"orderId\":\"U4\",\"articleId\":\"A4\",\"amount\":0}")))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should collect every missing field")
        void missingFields() {
            ValidationException error = catchValidation(order("{\"amount\":5}"));

            assertThat(error.getErrors())
                    .extracting(ValidationException.FieldError::field)
                    .containsExactly("orderId", "articleId");
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void malformedJson() {
            assertThatThrownBy(() -> validator.validate(order("{not json")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("not a valid order event");
        }

        @Test
        @DisplayName("should reject an empty payload")
        void emptyPayload() {
            assertThatThrownBy(() -> validator.validate(order(null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("payload");
        }
    }

    private ValidationException catchValidation(Message message) {
        try {
            validator.validate(message);
        } catch (ValidationException e) {
            return e;
        }
        throw new AssertionError("expected a validation failure");
    }
}
