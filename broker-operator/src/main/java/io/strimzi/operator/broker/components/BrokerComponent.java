/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.components;

import java.util.Locale;
import java.util.Optional;

/**
 * Optional features which registered clusters can use through the broker.
 */
public enum BrokerComponent {
    CONNECTIVITY("connectivity"),
    SERVICE_DISCOVERY("service-discovery"),
    GLOBALNET("globalnet");

    private final String tag;

    BrokerComponent(String tag) {
        this.tag = tag;
    }

    /**
     * @return  The tag used for this component in the configuration
     */
    public String tag() {
        return tag;
    }

    /**
     * Finds the component with the given tag. The tag is matched case-insensitively.
     *
     * @param tag   Component tag
     *
     * @return  The component, or empty for an unknown tag
     */
    public static Optional<BrokerComponent> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }

        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (BrokerComponent component : values()) {
            if (component.tag.equals(normalized)) {
                return Optional.of(component);
            }
        }

        return Optional.empty();
    }
}
