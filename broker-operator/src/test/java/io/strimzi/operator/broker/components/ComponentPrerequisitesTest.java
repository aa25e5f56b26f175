/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.components;

import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.strimzi.api.broker.model.connectivity.Cluster;
import io.strimzi.api.broker.model.connectivity.Endpoint;
import io.strimzi.api.broker.model.connectivity.Gateway;
import io.strimzi.api.broker.model.multicluster.ServiceExport;
import io.strimzi.api.broker.model.multicluster.ServiceImport;
import io.strimzi.operator.broker.common.BrokerProvisioningException;
import io.strimzi.operator.broker.operator.resource.CrdUpdater;
import io.vertx.core.Future;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

@ExtendWith(VertxExtension.class)
public class ComponentPrerequisitesTest {
    private final List<String> installed = new ArrayList<>();
    private final CrdUpdater recordingUpdater = crd -> {
        installed.add(crd.getMetadata().getName());
        return Future.succeededFuture(true);
    };

    @Test
    public void testConnectivity(VertxTestContext context) {
        ComponentPrerequisites.withDefaults().ensurePrerequisites(List.of("connectivity"), recordingUpdater)
                .onComplete(context.succeeding(i -> context.verify(() -> {
                    assertThat(installed, is(List.of(Cluster.CRD_NAME, Endpoint.CRD_NAME, Gateway.CRD_NAME)));
                    context.completeNow();
                })));
    }

    @Test
    public void testSharedPrerequisiteRunsOnce(VertxTestContext context) {
        ComponentPrerequisites.withDefaults().ensurePrerequisites(List.of("service-discovery", "globalnet"), recordingUpdater)
                .onComplete(context.succeeding(i -> context.verify(() -> {
                    assertThat(installed, is(List.of(ServiceExport.CRD_NAME, ServiceImport.CRD_NAME)));
                    context.completeNow();
                })));
    }

    @Test
    public void testGlobalnetAloneInstallsServiceDiscoveryCrds(VertxTestContext context) {
        ComponentPrerequisites.withDefaults().ensurePrerequisites(List.of("globalnet"), recordingUpdater)
                .onComplete(context.succeeding(i -> context.verify(() -> {
                    assertThat(installed, is(List.of(ServiceExport.CRD_NAME, ServiceImport.CRD_NAME)));
                    context.completeNow();
                })));
    }

    @Test
    public void testUnknownComponentsAreSkipped(VertxTestContext context) {
        ComponentPrerequisites.withDefaults().ensurePrerequisites(List.of("lighthouse", "connectivity", ""), recordingUpdater)
                .onComplete(context.succeeding(i -> context.verify(() -> {
                    assertThat(installed, is(List.of(Cluster.CRD_NAME, Endpoint.CRD_NAME, Gateway.CRD_NAME)));
                    context.completeNow();
                })));
    }

    @Test
    public void testComponentWithoutRegistrationIsSkipped(VertxTestContext context) {
        new ComponentPrerequisites().ensurePrerequisites(List.of("connectivity", "globalnet"), recordingUpdater)
                .onComplete(context.succeeding(i -> context.verify(() -> {
                    assertThat(installed, is(List.of()));
                    context.completeNow();
                })));
    }

    @Test
    public void testRegistrationReplacesDefault(VertxTestContext context) {
        AtomicInteger calls = new AtomicInteger();
        SchemaPrerequisite custom = updater -> {
            calls.incrementAndGet();
            return Future.succeededFuture();
        };

        ComponentPrerequisites prerequisites = ComponentPrerequisites.withDefaults()
                .register(BrokerComponent.GLOBALNET, custom);

        assertThat(prerequisites.get(BrokerComponent.GLOBALNET).orElseThrow(), is(sameInstance(custom)));

        prerequisites.ensurePrerequisites(List.of("globalnet"), recordingUpdater)
                .onComplete(context.succeeding(i -> context.verify(() -> {
                    assertThat(calls.get(), is(1));
                    assertThat(installed, is(List.of()));
                    context.completeNow();
                })));
    }

    @Test
    public void testFailureNamesTheComponent(VertxTestContext context) {
        RuntimeException boom = new RuntimeException("boom");
        List<String> attempted = new ArrayList<>();
        CrdUpdater failingUpdater = crd -> {
            attempted.add(crd.getMetadata().getName());
            return Future.failedFuture(boom);
        };

        ComponentPrerequisites.withDefaults().ensurePrerequisites(List.of("connectivity", "service-discovery"), failingUpdater)
                .onComplete(context.failing(error -> context.verify(() -> {
                    assertThat(error, instanceOf(BrokerProvisioningException.class));
                    assertThat(error.getMessage(), is("Error setting up the connectivity requirements: boom"));
                    assertThat(error.getCause(), is(sameInstance(boom)));
                    // Stops at the first CRD
                    assertThat(attempted, is(List.of(Cluster.CRD_NAME)));
                    context.completeNow();
                })));
    }

    @Test
    public void testCrdSchemaPrerequisite(VertxTestContext context) {
        List<CustomResourceDefinition> crds = new CrdSchemaPrerequisite(List.of()).crds();
        assertThat(crds.size(), is(0));

        new CrdSchemaPrerequisite(List.of()).ensure(recordingUpdater)
                .onComplete(context.succeeding(i -> context.verify(() -> {
                    assertThat(installed, is(List.of()));
                    context.completeNow();
                })));
    }
}
