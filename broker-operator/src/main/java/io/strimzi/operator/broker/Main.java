/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.strimzi.operator.broker.components.ComponentPrerequisites;
import io.strimzi.operator.broker.operator.assembly.BrokerBootstrap;
import io.strimzi.operator.broker.operator.assembly.ServiceAccountTokenWaiter;
import io.strimzi.operator.broker.operator.resource.ResourceOperatorSupplier;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The main class used to provision the broker and the service accounts of the configured clusters
 */
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class.getName());

    /**
     * The main method used to run the Broker Operator
     *
     * @param args  The command line arguments
     */
    public static void main(String[] args) {
        final String version = Main.class.getPackage().getImplementationVersion();
        LOGGER.info("BrokerOperator {} is starting", version);
        BrokerOperatorConfig config = BrokerOperatorConfig.fromMap(System.getenv());
        LOGGER.info("Broker Operator configuration is {}", config);

        Vertx vertx = Vertx.vertx();
        KubernetesClient client = new KubernetesClientBuilder().build();

        ResourceOperatorSupplier supplier = new ResourceOperatorSupplier(vertx, client);
        BrokerBootstrap bootstrap = new BrokerBootstrap(
                supplier,
                ComponentPrerequisites.withDefaults(),
                new ServiceAccountTokenWaiter(vertx, supplier.secretOperations, config.backOff()),
                BrokerNames.DEFAULT
        );

        run(bootstrap, config)
                .onComplete(res -> {
                    int status = 0;

                    if (res.failed()) {
                        LOGGER.error("Failed to provision the broker in namespace {}", config.getNamespace(), res.cause());
                        status = 1;
                    } else {
                        LOGGER.info("Broker in namespace {} was provisioned", config.getNamespace());
                    }

                    shutdown(vertx, client, status);
                });
    }

    /* test */ static Future<Void> run(BrokerBootstrap bootstrap, BrokerOperatorConfig config) {
        Future<Secret> result = bootstrap.ensureBroker(config.getComponents(), config.isInstallCrds(), config.getNamespace());

        for (String clusterId : config.getClusterIds()) {
            result = result.compose(i -> bootstrap.provisionCluster(clusterId, config.getNamespace()));
        }

        return result.mapEmpty();
    }

    private static void shutdown(Vertx vertx, KubernetesClient client, int status) {
        client.close();
        vertx.close()
                .onComplete(i -> System.exit(status));
    }
}
