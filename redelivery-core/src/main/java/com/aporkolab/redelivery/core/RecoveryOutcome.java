package com.aporkolab.redelivery.core;

import java.util.Optional;

/**
 * Final disposition of one message.
 *
 * @param messageId        {@code topic-partition@offset}
 * @param state            SUCCEEDED, DEAD_LETTERED or ABANDONED
 * @param attempts         handler invocations made
 * @param deadLetterRecord the record written to the dead-letter topic, or null
 */
public record RecoveryOutcome(
        String messageId,
        RecoveryState state,
        int attempts,
        DeadLetterRecord deadLetterRecord
) {

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Optional<DeadLetterRecord> deadLetter() {
        return Optional.ofNullable(deadLetterRecord);
    }

    static RecoveryOutcome succeeded(Message message, int attempts) {
        return new RecoveryOutcome(message.messageId(), RecoveryState.SUCCEEDED, attempts, null);
    }

    static RecoveryOutcome deadLettered(DeadLetterRecord record) {
        return new RecoveryOutcome(record.original().messageId(), RecoveryState.DEAD_LETTERED,
                record.attemptCount(), record);
    }

    static RecoveryOutcome abandoned(Message message, int attempts) {
        return new RecoveryOutcome(message.messageId(), RecoveryState.ABANDONED, attempts, null);
    }
}
