/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.rbac.Role;
import io.fabric8.kubernetes.api.model.rbac.RoleBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.vertx.core.Vertx;

/**
 * Operator for {@code Role}s. Updating a role replaces its rules with the desired ones, so rules removed from the
 * desired role are removed from the stored one as well.
 */
public class RoleOperator extends AbstractResourceOperator<Role, RoleList, Resource<Role>> {
    /**
     * Constructor
     *
     * @param vertx     The Vertx instance
     * @param client    The Kubernetes client
     */
    public RoleOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, "Role");
    }

    @Override
    protected NonNamespaceOperation<Role, RoleList, Resource<Role>> operation(String namespace) {
        return client.rbac().roles().inNamespace(namespace);
    }

    @Override
    protected Role merge(Role current, Role desired) {
        return new RoleBuilder(current)
                .editMetadata()
                    .addToLabels(desired.getMetadata().getLabels())
                .endMetadata()
                .withRules(desired.getRules())
                .build();
    }
}
