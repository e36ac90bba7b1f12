package com.aporkolab.redelivery.core;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.redelivery.exception.ConfigurationException;
import com.aporkolab.redelivery.exception.ValidationException;

/**
 * Decides whether a failure is worth retrying.
 *
 * Error kinds marked non-retryable at startup are terminal, together with their
 * subclasses. {@link ValidationException} is always terminal. The cause chain is
 * inspected, so a terminal error wrapped by a framework exception stays terminal.
 * Everything else is retryable.
 */
public class ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(ErrorClassifier.class);

    private final Set<Class<? extends Throwable>> nonRetryable;

    private ErrorClassifier(Set<Class<? extends Throwable>> nonRetryable) {
        this.nonRetryable = Collections.unmodifiableSet(nonRetryable);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Classifier where only validation failures are terminal.
     */
    public static ErrorClassifier defaults() {
        return builder().build();
    }

    public Classification classify(Throwable error) {
        if (error == null) {
            return Classification.RETRYABLE;
        }

        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && seen.add(current)) {
            for (Class<? extends Throwable> kind : nonRetryable) {
                if (kind.isInstance(current)) {
                    log.debug("Classified {} as TERMINAL (matched {})", error.getClass().getName(), kind.getName());
                    return Classification.TERMINAL;
                }
            }
            current = current.getCause();
        }
        return Classification.RETRYABLE;
    }

    public boolean isRetryable(Throwable error) {
        return classify(error) == Classification.RETRYABLE;
    }

    public Set<Class<? extends Throwable>> getNonRetryableKinds() {
        return nonRetryable;
    }

    public static class Builder {
        private final Set<Class<? extends Throwable>> nonRetryable = new LinkedHashSet<>(List.of(ValidationException.class));

        @SafeVarargs
        public final Builder nonRetryable(Class<? extends Throwable>... kinds) {
            for (Class<? extends Throwable> kind : kinds) {
                nonRetryable.add(kind);
            }
            return this;
        }

        /**
         * Adds error kinds given as fully-qualified class names, as they appear in configuration.
         *
         * @throws ConfigurationException if a name does not resolve to a Throwable type
         */
        public Builder nonRetryableKinds(Collection<String> classNames) {
            for (String className : classNames) {
                nonRetryable.add(resolve(className.trim()));
            }
            return this;
        }

        public ErrorClassifier build() {
            return new ErrorClassifier(new LinkedHashSet<>(nonRetryable));
        }

        private static Class<? extends Throwable> resolve(String className) {
            Class<?> type;
            try {
                type = Class.forName(className, false, ErrorClassifier.class.getClassLoader());
            } catch (ClassNotFoundException e) {
                throw new ConfigurationException("nonRetryableErrorKinds", "unknown error kind " + className, e);
            }
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new ConfigurationException("nonRetryableErrorKinds", className + " is not a Throwable");
            }
            return type.asSubclass(Throwable.class);
        }
    }
}
