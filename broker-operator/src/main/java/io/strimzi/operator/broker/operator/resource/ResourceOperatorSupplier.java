/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.strimzi.operator.broker.operator.resource.kubernetes.CustomResourceDefinitionOperator;
import io.strimzi.operator.broker.operator.resource.kubernetes.NamespaceOperator;
import io.strimzi.operator.broker.operator.resource.kubernetes.RoleBindingOperator;
import io.strimzi.operator.broker.operator.resource.kubernetes.RoleOperator;
import io.strimzi.operator.broker.operator.resource.kubernetes.SecretOperator;
import io.strimzi.operator.broker.operator.resource.kubernetes.ServiceAccountOperator;
import io.vertx.core.Vertx;

/**
 * Class holding the resource operators used to provision the broker.
 *
 * <pre>{@code
 * ResourceOperatorSupplier supplier = new ResourceOperatorSupplier(vertx, client);
 * supplier.serviceAccountOperations.createOrIgnoreExists(namespace, serviceAccount);
 * }</pre>
 */
public class ResourceOperatorSupplier {
    /**
     * Namespace operator
     */
    public final NamespaceOperator namespaceOperations;

    /**
     * Service Account operator
     */
    public final ServiceAccountOperator serviceAccountOperations;

    /**
     * Role operator
     */
    public final RoleOperator roleOperations;

    /**
     * Role Binding operator
     */
    public final RoleBindingOperator roleBindingOperations;

    /**
     * Secret operator
     */
    public final SecretOperator secretOperations;

    /**
     * Custom Resource Definition operator
     */
    public final CustomResourceDefinitionOperator crdOperations;

    /**
     * Constructor
     *
     * @param vertx     Vert.x instance
     * @param client    Kubernetes client of the broker cluster
     */
    public ResourceOperatorSupplier(Vertx vertx, KubernetesClient client) {
        this(new NamespaceOperator(vertx, client),
                new ServiceAccountOperator(vertx, client),
                new RoleOperator(vertx, client),
                new RoleBindingOperator(vertx, client),
                new SecretOperator(vertx, client),
                new CustomResourceDefinitionOperator(vertx, client));
    }

    /**
     * Constructor
     *
     * @param namespaceOperations       Namespace operator
     * @param serviceAccountOperations  Service Account operator
     * @param roleOperations            Role operator
     * @param roleBindingOperations     Role Binding operator
     * @param secretOperations          Secret operator
     * @param crdOperations             Custom Resource Definition operator
     */
    public ResourceOperatorSupplier(NamespaceOperator namespaceOperations,
                                    ServiceAccountOperator serviceAccountOperations,
                                    RoleOperator roleOperations,
                                    RoleBindingOperator roleBindingOperations,
                                    SecretOperator secretOperations,
                                    CustomResourceDefinitionOperator crdOperations) {
        this.namespaceOperations = namespaceOperations;
        this.serviceAccountOperations = serviceAccountOperations;
        this.roleOperations = roleOperations;
        this.roleBindingOperations = roleBindingOperations;
        this.secretOperations = secretOperations;
        this.crdOperations = crdOperations;
    }
}
