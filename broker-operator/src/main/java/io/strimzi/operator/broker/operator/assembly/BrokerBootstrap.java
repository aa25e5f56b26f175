/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.assembly;

import io.fabric8.kubernetes.api.model.Secret;
import io.strimzi.operator.broker.BrokerNames;
import io.strimzi.operator.broker.common.BrokerProvisioningException;
import io.strimzi.operator.broker.components.ComponentPrerequisites;
import io.strimzi.operator.broker.model.BrokerResources;
import io.strimzi.operator.broker.operator.resource.ResourceOperatorSupplier;
import io.vertx.core.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Provisions the broker: the namespace shared by all registering clusters, the admin and cluster service accounts,
 * their roles and bindings, and optionally the CRDs needed by the requested components.
 *
 * <p>Steps run one after another and the first failure aborts the remaining ones. The failure is reported as a
 * {@link BrokerProvisioningException} naming the step. Resources created before the failure are kept. Every step is
 * idempotent, so calling the same operation again completes the provisioning. Roles are overwritten with the desired
 * rules without any version check, so concurrent bootstraps with different role definitions end with the rules of
 * whichever wrote last.</p>
 */
public class BrokerBootstrap {
    private static final Logger LOGGER = LogManager.getLogger(BrokerBootstrap.class);

    private final ResourceOperatorSupplier supplier;
    private final ComponentPrerequisites prerequisites;
    private final ServiceAccountTokenWaiter tokenWaiter;
    private final BrokerNames names;

    /**
     * Constructor
     *
     * @param supplier          Resource operators for the broker cluster
     * @param prerequisites     Schema prerequisites of the broker components
     * @param tokenWaiter       Used to wait for service account tokens
     * @param names             Names of the broker service accounts and roles
     */
    public BrokerBootstrap(ResourceOperatorSupplier supplier, ComponentPrerequisites prerequisites, ServiceAccountTokenWaiter tokenWaiter, BrokerNames names) {
        this.supplier = supplier;
        this.prerequisites = prerequisites;
        this.tokenWaiter = tokenWaiter;
        this.names = names;
    }

    /**
     * Makes sure the broker exists in the given namespace.
     *
     * @param components    Tags of the components which will use the broker
     * @param installCrds   Whether the CRDs of the components should be installed
     * @param namespace     Broker namespace
     *
     * @return  Future with the token secret of the broker admin service account. It fails with a
     *          {@link BrokerProvisioningException} when a provisioning step fails and with a
     *          {@link TokenWaitTimeoutException} when the admin token does not become available.
     */
    public Future<Secret> ensureBroker(Collection<String> components, boolean installCrds, String namespace) {
        LOGGER.info("Ensuring broker in namespace {} for components {}", namespace, components);

        Future<Void> crds = installCrds
                ? prerequisites.ensurePrerequisites(components, supplier.crdOperations)
                : Future.succeededFuture();

        return crds
                .compose(i -> step("Error creating the broker namespace",
                        () -> supplier.namespaceOperations.createOrIgnoreExists(null, BrokerResources.namespace(namespace))))
                .compose(created -> {
                    logOutcome("Namespace", namespace, created);
                    return step("Error creating the broker admin service account",
                            () -> supplier.serviceAccountOperations.createOrIgnoreExists(namespace, BrokerResources.serviceAccount(names.adminServiceAccount(), namespace)));
                })
                .compose(created -> {
                    logOutcome("ServiceAccount", names.adminServiceAccount(), created);
                    return step("Error creating the broker admin role",
                            () -> supplier.roleOperations.createOrUpdate(namespace, BrokerResources.adminRole(names.adminRole(), namespace)));
                })
                .compose(created -> {
                    logRoleOutcome(names.adminRole(), created);
                    return bind("Error creating the broker admin role binding", names.adminServiceAccount(), names.adminRole(), namespace);
                })
                .compose(i -> step("Error creating the default broker service account",
                        () -> supplier.serviceAccountOperations.createOrIgnoreExists(namespace, BrokerResources.serviceAccount(names.defaultClusterServiceAccount(), namespace))))
                .compose(created -> {
                    logOutcome("ServiceAccount", names.defaultClusterServiceAccount(), created);
                    return step("Error creating the broker cluster role",
                            () -> supplier.roleOperations.createOrUpdate(namespace, BrokerResources.clusterRole(names.clusterRole(), namespace)));
                })
                .compose(created -> {
                    logRoleOutcome(names.clusterRole(), created);
                    return bind("Error creating the default broker role binding", names.defaultClusterServiceAccount(), names.clusterRole(), namespace);
                })
                .compose(i -> tokenWaiter.waitForToken(names.adminServiceAccount(), namespace))
                .onSuccess(token -> LOGGER.info("Broker in namespace {} is ready", namespace));
    }

    /**
     * Provisions the service account of a newly registering cluster and binds it to the cluster role. The broker has
     * to exist already.
     *
     * @param clusterId     ID of the registering cluster
     * @param namespace     Broker namespace
     *
     * @return  Future with the token secret of the cluster's service account. A missing or blank cluster ID fails the
     *          future with IllegalArgumentException.
     */
    public Future<Secret> provisionCluster(String clusterId, String namespace) {
        if (clusterId == null || clusterId.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("Cluster ID must not be empty"));
        }

        String serviceAccount = clusterServiceAccountName(clusterId);
        LOGGER.info("Provisioning service account {} for cluster {} in namespace {}", serviceAccount, clusterId, namespace);

        return step("Error creating the cluster service account",
                    () -> supplier.serviceAccountOperations.createOrIgnoreExists(namespace, BrokerResources.serviceAccount(serviceAccount, namespace)))
                .compose(created -> {
                    logOutcome("ServiceAccount", serviceAccount, created);
                    return bind("Error binding the cluster service account to the cluster role", serviceAccount, names.clusterRole(), namespace);
                })
                .compose(i -> step("Error getting the cluster service account token",
                        () -> tokenWaiter.waitForToken(serviceAccount, namespace)))
                .onSuccess(token -> LOGGER.info("Cluster {} can use the broker with the token from Secret {}", clusterId, token.getMetadata().getName()));
    }

    /**
     * @param clusterId     ID of the registering cluster
     *
     * @return  Name of the service account of the cluster
     */
    public String clusterServiceAccountName(String clusterId) {
        return names.clusterServiceAccount(clusterId);
    }

    private Future<Void> bind(String description, String serviceAccount, String role, String namespace) {
        return step(description,
                    () -> supplier.roleBindingOperations.createOrIgnoreExists(namespace, BrokerResources.roleBinding(serviceAccount, role, namespace)))
                .map(created -> {
                    logOutcome("RoleBinding", serviceAccount + "-" + role, created);
                    return null;
                });
    }

    private static <T> Future<T> step(String description, Supplier<Future<T>> step) {
        return step.get()
                .recover(error -> Future.failedFuture(new BrokerProvisioningException(description, error)));
    }

    private static void logOutcome(String kind, String name, boolean created) {
        if (created) {
            LOGGER.info("{} {} created", kind, name);
        } else {
            LOGGER.info("{} {} already exists", kind, name);
        }
    }

    private static void logRoleOutcome(String name, boolean created) {
        LOGGER.info("Role {} {}", name, created ? "created" : "updated");
    }
}
