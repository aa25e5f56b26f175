/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.vertx.core.Vertx;

/**
 * Operator for {@code Namespace}s
 */
public class NamespaceOperator extends AbstractResourceOperator<Namespace, NamespaceList, Resource<Namespace>> {
    /**
     * Constructor
     *
     * @param vertx     The Vertx instance
     * @param client    The Kubernetes client
     */
    public NamespaceOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, "Namespace");
    }

    @Override
    protected NonNamespaceOperation<Namespace, NamespaceList, Resource<Namespace>> operation(String namespace) {
        return client.namespaces();
    }
}
