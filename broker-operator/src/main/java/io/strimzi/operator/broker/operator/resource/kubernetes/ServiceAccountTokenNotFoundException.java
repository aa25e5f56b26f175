/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource.kubernetes;

/**
 * The token of a service account is not available (yet). Either the service account does not exist, no token secret
 * refers to it, or the token secret has not been populated by Kubernetes.
 */
public class ServiceAccountTokenNotFoundException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Constructor
     *
     * @param message   The error message
     */
    public ServiceAccountTokenNotFoundException(String message) {
        super(message);
    }
}
