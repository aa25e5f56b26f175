/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.components;

import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.strimzi.operator.broker.operator.resource.CrdUpdater;
import io.vertx.core.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Creates or updates a fixed list of CRDs, one after another.
 */
public class CrdSchemaPrerequisite implements SchemaPrerequisite {
    private static final Logger LOGGER = LogManager.getLogger(CrdSchemaPrerequisite.class);

    private final List<CustomResourceDefinition> crds;

    /**
     * Constructor
     *
     * @param crds  CRDs to install
     */
    public CrdSchemaPrerequisite(List<CustomResourceDefinition> crds) {
        this.crds = List.copyOf(crds);
    }

    @Override
    public Future<Void> ensure(CrdUpdater crdUpdater) {
        Future<Void> result = Future.succeededFuture();

        for (CustomResourceDefinition crd : crds) {
            String name = crd.getMetadata().getName();

            result = result
                    .compose(i -> crdUpdater.createOrUpdate(crd))
                    .map(created -> {
                        LOGGER.info("CustomResourceDefinition {} {}", name, created ? "created" : "updated");
                        return null;
                    });
        }

        return result;
    }

    /**
     * @return  The CRDs installed by this prerequisite
     */
    public List<CustomResourceDefinition> crds() {
        return crds;
    }
}
