/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource;

import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.vertx.core.Future;

/**
 * Installs custom resource definitions.
 */
public interface CrdUpdater {
    /**
     * Creates the CRD, or replaces the spec of an existing CRD with the same name.
     *
     * @param crd   Desired CRD
     *
     * @return  Future with true when the CRD was created and false when it was updated
     */
    Future<Boolean> createOrUpdate(CustomResourceDefinition crd);
}
