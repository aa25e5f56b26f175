/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.api.model.Status;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.HttpURLConnection;

/**
 * Base class for the operators which create Kubernetes resources of a single kind. The fabric8 client is blocking,
 * so every call to the API server runs on a Vert.x worker thread and the result is returned as a Future.
 *
 * <p>Creation is idempotent: a resource which already exists is reported as not created instead of as an error.
 * Updates are only supported by operators which override {@link #merge(HasMetadata, HasMetadata)}.</p>
 *
 * @param <T>   The Kubernetes resource type
 * @param <L>   The list variant of the resource type
 * @param <R>   The resource operation type
 */
public abstract class AbstractResourceOperator<T extends HasMetadata, L extends KubernetesResourceList<T>, R extends Resource<T>> {
    private static final Logger LOGGER = LogManager.getLogger(AbstractResourceOperator.class);
    private static final String REASON_ALREADY_EXISTS = "AlreadyExists";

    protected final Vertx vertx;
    protected final KubernetesClient client;
    protected final String resourceKind;

    /**
     * Constructor
     *
     * @param vertx         The Vertx instance
     * @param client        The Kubernetes client
     * @param resourceKind  The kind of resource, used in log messages
     */
    protected AbstractResourceOperator(Vertx vertx, KubernetesClient client, String resourceKind) {
        this.vertx = vertx;
        this.client = client;
        this.resourceKind = resourceKind;
    }

    /**
     * Operation on the resources of this kind. Cluster scoped kinds ignore the namespace.
     *
     * @param namespace     Namespace of the resources, or null for cluster scoped kinds
     *
     * @return  The operation
     */
    protected abstract NonNamespaceOperation<T, L, R> operation(String namespace);

    /**
     * Gets a resource.
     *
     * @param namespace     Namespace of the resource
     * @param name          Name of the resource
     *
     * @return  Future with the resource, or with null when it does not exist
     */
    public Future<T> get(String namespace, String name) {
        return vertx.executeBlocking(() -> operation(namespace).withName(name).get());
    }

    /**
     * Creates a resource. Fails when it already exists.
     *
     * @param namespace     Namespace of the resource
     * @param desired       Desired resource
     *
     * @return  Future with the created resource
     */
    public Future<T> create(String namespace, T desired) {
        return vertx.executeBlocking(() -> operation(namespace).resource(desired).create());
    }

    /**
     * Creates a resource unless one with the same name already exists. An existing resource is left untouched.
     *
     * @param namespace     Namespace of the resource
     * @param desired       Desired resource
     *
     * @return  Future with true when the resource was created and false when it already existed. Any other error
     *          from the API server fails the future.
     */
    public Future<Boolean> createOrIgnoreExists(String namespace, T desired) {
        String name = desired.getMetadata().getName();

        return create(namespace, desired)
                .map(created -> {
                    LOGGER.debug("{} {} created", resourceKind, describe(namespace, name));
                    return true;
                })
                .recover(error -> {
                    if (isAlreadyExists(error)) {
                        LOGGER.debug("{} {} already exists", resourceKind, describe(namespace, name));
                        return Future.succeededFuture(false);
                    }

                    return Future.failedFuture(error);
                });
    }

    /**
     * Creates a resource or, when it already exists, overwrites the part of it managed by this operator with the
     * desired state. There is no version check, concurrent updates are last-writer-wins.
     *
     * @param namespace     Namespace of the resource
     * @param desired       Desired resource
     *
     * @return  Future with true when the resource was created and false when an existing one was updated
     */
    public Future<Boolean> createOrUpdate(String namespace, T desired) {
        String name = desired.getMetadata().getName();

        return get(namespace, name)
                .compose(current -> {
                    if (current == null) {
                        // Someone else may create it in between, in which case we update theirs
                        return createOrIgnoreExists(namespace, desired)
                                .compose(created -> created ? Future.succeededFuture(true) : update(namespace, desired).map(false));
                    } else {
                        return update(namespace, desired).map(false);
                    }
                });
    }

    private Future<T> update(String namespace, T desired) {
        String name = desired.getMetadata().getName();

        return vertx.executeBlocking(() -> operation(namespace).withName(name).edit(current -> merge(current, desired)))
                .onSuccess(updated -> LOGGER.debug("{} {} updated", resourceKind, describe(namespace, name)));
    }

    /**
     * Applies the desired state onto the current resource.
     *
     * @param current   Resource as stored in Kubernetes
     * @param desired   Desired resource
     *
     * @return  The resource to store
     */
    protected T merge(T current, T desired) {
        throw new UnsupportedOperationException(resourceKind + " resources are not updated by this operator");
    }

    /**
     * Checks whether an error returned by a create call means that the resource already exists. Kubernetes answers
     * a create of an existing resource with HTTP 409 and the AlreadyExists reason. A 409 with another reason (for
     * example an optimistic locking Conflict) is a real failure. A 409 without any status reason is treated as
     * already existing.
     *
     * @param error     Error returned by the create call
     *
     * @return  True if the resource already exists
     */
    static boolean isAlreadyExists(Throwable error) {
        if (error instanceof KubernetesClientException
                && ((KubernetesClientException) error).getCode() == HttpURLConnection.HTTP_CONFLICT) {
            Status status = ((KubernetesClientException) error).getStatus();
            String reason = status != null ? status.getReason() : null;
            return reason == null || REASON_ALREADY_EXISTS.equals(reason);
        } else {
            return false;
        }
    }

    private static String describe(String namespace, String name) {
        return namespace != null ? namespace + "/" + name : name;
    }
}
