/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.assembly;

/**
 * The token of a service account did not become available within the allowed number of attempts. The message and
 * the cause are those of the error seen in the last attempt.
 */
public class TokenWaitTimeoutException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param lastError     Error of the last lookup attempt
     */
    public TokenWaitTimeoutException(Throwable lastError) {
        super(lastError.getMessage(), lastError);
    }
}
