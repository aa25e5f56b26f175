/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.assembly;

import io.fabric8.kubernetes.api.model.Secret;
import io.strimzi.operator.broker.common.BackOff;
import io.strimzi.operator.broker.operator.resource.kubernetes.SecretOperator;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Waits until Kubernetes has issued the token of a service account. Token secrets are populated asynchronously by
 * the token controller, so the lookup is retried according to a {@link BackOff}. Every failed lookup is retried,
 * whatever the error. Delays use Vert.x timers, no thread is blocked while waiting.
 */
public class ServiceAccountTokenWaiter {
    private static final Logger LOGGER = LogManager.getLogger(ServiceAccountTokenWaiter.class);

    private final Vertx vertx;
    private final SecretOperator secretOperations;
    private final BackOff backOff;

    /**
     * Constructor
     *
     * @param vertx             The Vertx instance
     * @param secretOperations  Secret operator used for the lookups
     * @param backOff           Attempts and delays between them
     */
    public ServiceAccountTokenWaiter(Vertx vertx, SecretOperator secretOperations, BackOff backOff) {
        this.vertx = vertx;
        this.secretOperations = secretOperations;
        this.backOff = backOff;
    }

    /**
     * Waits for the token of a service account.
     *
     * @param serviceAccount    Name of the service account
     * @param namespace         Namespace of the service account
     *
     * @return  Future with the token secret, or failed with {@link TokenWaitTimeoutException} carrying the last lookup
     *          error once all attempts failed
     */
    public Future<Secret> waitForToken(String serviceAccount, String namespace) {
        return attempt(serviceAccount, namespace, 0);
    }

    private Future<Secret> attempt(String serviceAccount, String namespace, int attempt) {
        return secretOperations.getServiceAccountToken(namespace, serviceAccount)
                .recover(error -> {
                    if (backOff.done(attempt)) {
                        LOGGER.debug("Giving up on the token of ServiceAccount {}/{} after {} attempts", namespace, serviceAccount, attempt + 1);
                        return Future.failedFuture(new TokenWaitTimeoutException(error));
                    }

                    long delayMs = backOff.delayMs(attempt);
                    LOGGER.warn("Token of ServiceAccount {}/{} is not available (attempt {}/{}), retrying in {}ms: {}",
                            namespace, serviceAccount, attempt + 1, backOff.maxAttempts(), delayMs, error.getMessage());

                    Promise<Secret> promise = Promise.promise();
                    vertx.setTimer(delayMs, timerId -> attempt(serviceAccount, namespace, attempt + 1).onComplete(promise));
                    return promise.future();
                });
    }
}
