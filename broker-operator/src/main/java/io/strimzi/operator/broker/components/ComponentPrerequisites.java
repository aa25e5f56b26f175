/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.components;

import io.strimzi.operator.broker.common.BrokerProvisioningException;
import io.strimzi.operator.broker.model.BrokerCrds;
import io.strimzi.operator.broker.operator.resource.CrdUpdater;
import io.vertx.core.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of the schema prerequisites of the broker components.
 *
 * <p>Components are requested by their tags. Tags which do not name a known component, and components without a
 * registered prerequisite, are skipped with a warning so that callers can pass tags of components which need nothing
 * from the broker. Several components can share one prerequisite; it then runs only once per call.</p>
 *
 * <pre>{@code
 * ComponentPrerequisites prerequisites = ComponentPrerequisites.withDefaults()
 *     .register(BrokerComponent.GLOBALNET, myGlobalnetPrerequisite);
 * }</pre>
 */
public class ComponentPrerequisites {
    private static final Logger LOGGER = LogManager.getLogger(ComponentPrerequisites.class);

    private final Map<BrokerComponent, SchemaPrerequisite> prerequisites = new EnumMap<>(BrokerComponent.class);

    /**
     * Creates a registry with the built-in prerequisites: connectivity needs the connectivity CRDs, service discovery
     * and Globalnet both need the service discovery CRDs.
     *
     * @return  The registry
     */
    public static ComponentPrerequisites withDefaults() {
        SchemaPrerequisite serviceDiscovery = new CrdSchemaPrerequisite(BrokerCrds.serviceDiscovery());

        return new ComponentPrerequisites()
                .register(BrokerComponent.CONNECTIVITY, new CrdSchemaPrerequisite(BrokerCrds.connectivity()))
                .register(BrokerComponent.SERVICE_DISCOVERY, serviceDiscovery)
                .register(BrokerComponent.GLOBALNET, serviceDiscovery);
    }

    /**
     * Registers the prerequisite of a component, replacing any previously registered one.
     *
     * @param component     The component
     * @param prerequisite  Its prerequisite
     *
     * @return  This registry
     */
    public ComponentPrerequisites register(BrokerComponent component, SchemaPrerequisite prerequisite) {
        prerequisites.put(component, prerequisite);
        return this;
    }

    /**
     * @param component     The component
     *
     * @return  The prerequisite registered for the component, if any
     */
    public Optional<SchemaPrerequisite> get(BrokerComponent component) {
        return Optional.ofNullable(prerequisites.get(component));
    }

    /**
     * Runs the prerequisites of the requested components in the order of the tags. Stops at the first failure.
     *
     * @param componentTags     Tags of the requested components
     * @param crdUpdater        Used to install the CRDs
     *
     * @return  Future which completes when all prerequisites are installed, or fails with a
     *          {@link BrokerProvisioningException} naming the component whose prerequisites failed
     */
    public Future<Void> ensurePrerequisites(Collection<String> componentTags, CrdUpdater crdUpdater) {
        Set<SchemaPrerequisite> done = Collections.newSetFromMap(new IdentityHashMap<>());
        Future<Void> result = Future.succeededFuture();

        for (String tag : componentTags) {
            Optional<BrokerComponent> component = BrokerComponent.fromTag(tag);

            if (component.isEmpty()) {
                LOGGER.warn("Unknown component {}, no broker prerequisites will be installed for it", tag);
                continue;
            }

            SchemaPrerequisite prerequisite = prerequisites.get(component.get());

            if (prerequisite == null) {
                LOGGER.debug("Component {} has no broker prerequisites", tag);
            } else if (done.add(prerequisite)) {
                result = result.compose(i -> {
                    LOGGER.info("Setting up the {} requirements", component.get().tag());

                    return prerequisite.ensure(crdUpdater)
                            .recover(error -> Future.failedFuture(
                                    new BrokerProvisioningException("Error setting up the " + component.get().tag() + " requirements", error)));
                });
            }
        }

        return result;
    }
}
