/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.common;

/**
 * A step of the broker provisioning failed. The message names the step and the cause is the error returned by
 * Kubernetes. Steps completed before the failure are not rolled back.
 */
public class BrokerProvisioningException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   Description of the failed step
     * @param cause     The underlying error
     */
    public BrokerProvisioningException(String message, Throwable cause) {
        super(describe(message, cause), cause);
    }

    private static String describe(String message, Throwable cause) {
        if (cause == null) {
            return message;
        } else if (cause.getMessage() != null) {
            return message + ": " + cause.getMessage();
        } else {
            return message + ": " + cause.getClass().getSimpleName();
        }
    }
}
