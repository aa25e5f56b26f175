/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.model;

import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.rbac.PolicyRule;
import io.fabric8.kubernetes.api.model.rbac.Role;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

public class BrokerResourcesTest {
    private static final String NAMESPACE = "broker-ns";

    @Test
    public void testNamespace() {
        assertThat(BrokerResources.namespace(NAMESPACE).getMetadata().getName(), is(NAMESPACE));
        assertThat(BrokerResources.namespace(NAMESPACE).getMetadata().getLabels(), is(BrokerResources.LABELS));
    }

    @Test
    public void testLabelsUseRecommendedKubernetesKeys() {
        assertThat(BrokerResources.LABELS, is(Map.of(
                "app.kubernetes.io/managed-by", "strimzi-broker-operator",
                "app.kubernetes.io/part-of", "strimzi-broker")));
    }

    @Test
    public void testServiceAccount() {
        ServiceAccount sa = BrokerResources.serviceAccount("broker-admin", NAMESPACE);

        assertThat(sa.getMetadata().getName(), is("broker-admin"));
        assertThat(sa.getMetadata().getNamespace(), is(NAMESPACE));
        assertThat(sa.getMetadata().getLabels().get(BrokerResources.MANAGED_BY_LABEL), is("strimzi-broker-operator"));
    }

    @Test
    public void testAdminRoleCanManageClusterServiceAccounts() {
        Role role = BrokerResources.adminRole("broker-admin", NAMESPACE);

        assertThat(role.getMetadata().getName(), is("broker-admin"));
        assertThat(role.getMetadata().getNamespace(), is(NAMESPACE));

        PolicyRule core = ruleFor(role, "");
        assertThat(core.getResources(), hasItems("serviceaccounts", "secrets", "configmaps"));
        assertThat(core.getVerbs(), hasItems("create", "delete"));

        PolicyRule rbac = ruleFor(role, "rbac.authorization.k8s.io");
        assertThat(rbac.getResources(), is(List.of("rolebindings")));
        assertThat(rbac.getVerbs(), hasItem("create"));
    }

    @Test
    public void testClusterRoleOnlyReadsSecrets() {
        Role role = BrokerResources.clusterRole("broker-cluster", NAMESPACE);

        PolicyRule core = ruleFor(role, "");
        assertThat(core.getResources(), is(List.of("secrets")));
        assertThat(core.getVerbs(), is(List.of("get", "list")));

        PolicyRule submariner = ruleFor(role, "submariner.io");
        assertThat(submariner.getResources(), hasItems("clusters", "endpoints"));
        assertThat(submariner.getVerbs(), hasItems("create", "update", "delete", "watch"));

        PolicyRule discovery = ruleFor(role, "discovery.k8s.io");
        assertThat(discovery.getResources(), hasItem("endpointslices"));
        assertThat(discovery.getVerbs(), hasItem("create"));
    }

    @Test
    public void testRoleBinding() {
        RoleBinding binding = BrokerResources.roleBinding("cluster-east", "broker-cluster", NAMESPACE);

        assertThat(binding.getMetadata().getName(), is("cluster-east-broker-cluster"));
        assertThat(binding.getMetadata().getNamespace(), is(NAMESPACE));
        assertThat(binding.getRoleRef().getKind(), is("Role"));
        assertThat(binding.getRoleRef().getApiGroup(), is("rbac.authorization.k8s.io"));
        assertThat(binding.getRoleRef().getName(), is("broker-cluster"));
        assertThat(binding.getSubjects().size(), is(1));
        assertThat(binding.getSubjects().get(0).getKind(), is("ServiceAccount"));
        assertThat(binding.getSubjects().get(0).getName(), is("cluster-east"));
        assertThat(binding.getSubjects().get(0).getNamespace(), is(NAMESPACE));
    }

    @Test
    public void testBindingsOfDifferentPairsHaveDifferentNames() {
        assertThat(BrokerResources.roleBinding("cluster-east", "broker-cluster", NAMESPACE).getMetadata().getName(),
                is(not(BrokerResources.roleBinding("cluster-west", "broker-cluster", NAMESPACE).getMetadata().getName())));
    }

    private static PolicyRule ruleFor(Role role, String apiGroup) {
        return role.getRules().stream()
                .filter(rule -> rule.getApiGroups().contains(apiGroup))
                .findFirst()
                .orElseThrow();
    }
}
