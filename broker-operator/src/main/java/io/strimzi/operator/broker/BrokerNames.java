/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker;

import java.util.IllegalFormatException;
import java.util.Locale;

/**
 * Well-known names of the broker service accounts and roles. The defaults are what registering clusters and tooling
 * expect, other values are mainly useful in tests.
 *
 * @param adminServiceAccount           Service account used to manage the broker
 * @param adminRole                     Role granted to the admin service account
 * @param clusterRole                   Role granted to every registering cluster
 * @param defaultClusterServiceAccount  Shared cluster service account for clusters without their own one
 * @param clusterServiceAccountFormat   Format of the per-cluster service account name, with one {@code %s} for the
 *                                      cluster ID
 */
public record BrokerNames(String adminServiceAccount,
                          String adminRole,
                          String clusterRole,
                          String defaultClusterServiceAccount,
                          String clusterServiceAccountFormat) {
    /**
     * Names used by default
     */
    public static final BrokerNames DEFAULT = new BrokerNames(
            "broker-admin",
            "broker-admin",
            "broker-cluster",
            "broker-client",
            "cluster-%s"
    );

    private static final String MARKER = "\u0000";
    private static final String SAMPLE_CLUSTER_ID = "cluster-a1";

    /**
     * Constructor
     */
    public BrokerNames {
        if (!insertsClusterIdOnce(clusterServiceAccountFormat)) {
            throw new IllegalArgumentException("clusterServiceAccountFormat must contain exactly one %s placeholder, "
                    + "but was " + clusterServiceAccountFormat);
        }
    }

    /**
     * Checks that the format can be applied to a single cluster ID and places that ID verbatim exactly once.
     */
    private static boolean insertsClusterIdOnce(String format) {
        if (format == null) {
            return false;
        }

        try {
            String marked = String.format(Locale.ROOT, format, MARKER);
            int index = marked.indexOf(MARKER);

            return index >= 0
                    && index == marked.lastIndexOf(MARKER)
                    && String.format(Locale.ROOT, format, SAMPLE_CLUSTER_ID).equals(marked.replace(MARKER, SAMPLE_CLUSTER_ID));
        } catch (IllegalFormatException e) {
            return false;
        }
    }

    /**
     * Derives the name of the service account owned by a registering cluster. The same cluster ID always gives the
     * same name and different cluster IDs give different names.
     *
     * @param clusterId     ID of the registering cluster
     *
     * @return  Name of the cluster's service account
     */
    public String clusterServiceAccount(String clusterId) {
        return String.format(Locale.ROOT, clusterServiceAccountFormat, clusterId);
    }
}
