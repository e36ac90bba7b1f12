package com.aporkolab.redelivery.core;

import com.aporkolab.redelivery.exception.ValidationException;

/**
 * Pre-handler validation step. A failure is terminal and goes straight to the dead-letter topic.
 */
@FunctionalInterface
public interface MessageValidator {

    MessageValidator NONE = message -> { };

    void validate(Message message) throws ValidationException;
}
