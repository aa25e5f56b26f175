/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.ServiceAccountResource;
import io.vertx.core.Vertx;

/**
 * Operator for {@code ServiceAccount}s
 */
public class ServiceAccountOperator extends AbstractResourceOperator<ServiceAccount, ServiceAccountList, ServiceAccountResource> {
    /**
     * Constructor
     *
     * @param vertx     The Vertx instance
     * @param client    The Kubernetes client
     */
    public ServiceAccountOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, "ServiceAccount");
    }

    @Override
    protected NonNamespaceOperation<ServiceAccount, ServiceAccountList, ServiceAccountResource> operation(String namespace) {
        return client.serviceAccounts().inNamespace(namespace);
    }
}
