/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.components;

import io.strimzi.operator.broker.operator.resource.CrdUpdater;
import io.vertx.core.Future;

/**
 * Installs the resource schemas a component needs in the broker cluster before its own installer runs. Must be
 * idempotent.
 */
@FunctionalInterface
public interface SchemaPrerequisite {
    /**
     * @param crdUpdater    Used to install the CRDs
     *
     * @return  Future which completes when the schemas are installed
     */
    Future<Void> ensure(CrdUpdater crdUpdater);
}
