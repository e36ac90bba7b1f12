package com.aporkolab.redelivery.core;

/**
 * Application callback that processes one message.
 * Any exception it throws is classified and either retried or dead-lettered; it never escapes the coordinator.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Message message) throws Exception;
}
