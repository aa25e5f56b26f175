/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.model;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.rbac.PolicyRule;
import io.fabric8.kubernetes.api.model.rbac.PolicyRuleBuilder;
import io.fabric8.kubernetes.api.model.rbac.Role;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBuilder;
import io.strimzi.api.broker.model.connectivity.Cluster;
import io.strimzi.api.broker.model.connectivity.Endpoint;
import io.strimzi.api.broker.model.multicluster.ServiceExport;
import io.strimzi.operator.common.model.Labels;

import java.util.List;
import java.util.Map;

/**
 * Desired state of the resources which make up the broker. Everything here is side-effect free, the names passed in
 * are used as they are.
 */
public class BrokerResources {
    /**
     * Label marking resources created by the broker operator
     */
    public static final String MANAGED_BY_LABEL = Labels.KUBERNETES_MANAGED_BY_LABEL;

    /**
     * Label grouping all broker resources
     */
    public static final String PART_OF_LABEL = Labels.KUBERNETES_PART_OF_LABEL;

    /**
     * Labels set on every resource the broker operator creates
     */
    public static final Map<String, String> LABELS = Labels.fromMap(Map.of(
            MANAGED_BY_LABEL, "strimzi-broker-operator",
            PART_OF_LABEL, "strimzi-broker"
    )).toMap();

    private static final String CORE_API_GROUP = "";
    private static final String RBAC_API_GROUP = "rbac.authorization.k8s.io";
    private static final String DISCOVERY_API_GROUP = "discovery.k8s.io";

    private static final List<String> ENDPOINT_SLICES = List.of("endpointslices", "endpointslices/restricted");
    private static final List<String> ALL_VERBS = List.of("create", "get", "list", "watch", "patch", "update", "delete");

    private BrokerResources() {
        // Static methods only
    }

    /**
     * @param name  Name of the broker namespace
     *
     * @return  The broker namespace
     */
    public static Namespace namespace(String name) {
        return new NamespaceBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withLabels(LABELS)
                .endMetadata()
                .build();
    }

    /**
     * @param name          Name of the service account
     * @param namespace     Broker namespace
     *
     * @return  A broker service account
     */
    public static ServiceAccount serviceAccount(String name, String namespace) {
        return new ServiceAccountBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(LABELS)
                .endMetadata()
                .build();
    }

    /**
     * Role used to administer the broker: register clusters, manage their service accounts and bindings, and read
     * everything the clusters publish.
     *
     * @param name          Name of the role
     * @param namespace     Broker namespace
     *
     * @return  The broker admin role
     */
    public static Role adminRole(String name, String namespace) {
        return role(name, namespace, List.of(
                rule(Cluster.GROUP, List.of(Cluster.RESOURCE_PLURAL, Endpoint.RESOURCE_PLURAL), ALL_VERBS),
                rule(ServiceExport.GROUP, List.of("*"), List.of("create", "get", "list", "update", "delete", "watch")),
                rule(CORE_API_GROUP, List.of("serviceaccounts", "secrets", "configmaps"), List.of("create", "get", "list", "update", "delete")),
                rule(RBAC_API_GROUP, List.of("rolebindings"), List.of("create", "get", "list", "delete")),
                rule(DISCOVERY_API_GROUP, ENDPOINT_SLICES, List.of("get", "list"))
        ));
    }

    /**
     * Role granted to every registering cluster. It lets the cluster publish and sync its own connectivity and
     * service discovery records, but only read secrets.
     *
     * @param name          Name of the role
     * @param namespace     Broker namespace
     *
     * @return  The broker cluster role
     */
    public static Role clusterRole(String name, String namespace) {
        return role(name, namespace, List.of(
                rule(Cluster.GROUP, List.of(Cluster.RESOURCE_PLURAL, Endpoint.RESOURCE_PLURAL), ALL_VERBS),
                rule(ServiceExport.GROUP, List.of("*"), ALL_VERBS),
                rule(CORE_API_GROUP, List.of("secrets"), List.of("get", "list")),
                rule(DISCOVERY_API_GROUP, ENDPOINT_SLICES, ALL_VERBS)
        ));
    }

    /**
     * Binds a service account to a role. The binding is named {@code <service-account>-<role>}, so there is one
     * binding per pair while a role can be referenced by many bindings.
     *
     * @param serviceAccount    Name of the service account
     * @param role              Name of the role
     * @param namespace         Broker namespace
     *
     * @return  The role binding
     */
    public static RoleBinding roleBinding(String serviceAccount, String role, String namespace) {
        return new RoleBindingBuilder()
                .withNewMetadata()
                    .withName(serviceAccount + "-" + role)
                    .withNamespace(namespace)
                    .withLabels(LABELS)
                .endMetadata()
                .withNewRoleRef()
                    .withApiGroup(RBAC_API_GROUP)
                    .withKind("Role")
                    .withName(role)
                .endRoleRef()
                .addNewSubject()
                    .withKind("ServiceAccount")
                    .withName(serviceAccount)
                    .withNamespace(namespace)
                .endSubject()
                .build();
    }

    private static Role role(String name, String namespace, List<PolicyRule> rules) {
        return new RoleBuilder()
                .withNewMetadata()
                    .withName(name)
                    .withNamespace(namespace)
                    .withLabels(LABELS)
                .endMetadata()
                .withRules(rules)
                .build();
    }

    private static PolicyRule rule(String apiGroup, List<String> resources, List<String> verbs) {
        return new PolicyRuleBuilder()
                .withApiGroups(apiGroup)
                .withResources(resources)
                .withVerbs(verbs)
                .build();
    }
}
