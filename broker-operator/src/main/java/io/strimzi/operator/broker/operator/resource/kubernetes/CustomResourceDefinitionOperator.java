/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionBuilder;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.strimzi.operator.broker.operator.resource.CrdUpdater;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Operator for {@code CustomResourceDefinition}s. Updating a CRD replaces its spec.
 */
public class CustomResourceDefinitionOperator
        extends AbstractResourceOperator<CustomResourceDefinition, CustomResourceDefinitionList, Resource<CustomResourceDefinition>>
        implements CrdUpdater {
    /**
     * Constructor
     *
     * @param vertx     The Vertx instance
     * @param client    The Kubernetes client
     */
    public CustomResourceDefinitionOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, "CustomResourceDefinition");
    }

    @Override
    protected NonNamespaceOperation<CustomResourceDefinition, CustomResourceDefinitionList, Resource<CustomResourceDefinition>> operation(String namespace) {
        return client.apiextensions().v1().customResourceDefinitions();
    }

    @Override
    protected CustomResourceDefinition merge(CustomResourceDefinition current, CustomResourceDefinition desired) {
        return new CustomResourceDefinitionBuilder(current)
                .editMetadata()
                    .addToLabels(desired.getMetadata().getLabels())
                .endMetadata()
                .withSpec(desired.getSpec())
                .build();
    }

    @Override
    public Future<Boolean> createOrUpdate(CustomResourceDefinition crd) {
        return createOrUpdate(null, crd);
    }
}
