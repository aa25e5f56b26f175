/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker;

import io.strimzi.operator.broker.common.BackOff;
import io.strimzi.operator.common.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration of the broker operator, read from environment variables.
 */
public class BrokerOperatorConfig {
    /**
     * Namespace in which the broker is provisioned
     */
    public static final String STRIMZI_BROKER_NAMESPACE = "STRIMZI_BROKER_NAMESPACE";

    /**
     * Comma separated list of components which will use the broker
     */
    public static final String STRIMZI_BROKER_COMPONENTS = "STRIMZI_BROKER_COMPONENTS";

    /**
     * Whether the CRDs of the components are installed
     */
    public static final String STRIMZI_BROKER_INSTALL_CRDS = "STRIMZI_BROKER_INSTALL_CRDS";

    /**
     * Comma separated list of clusters to provision service accounts for
     */
    public static final String STRIMZI_BROKER_CLUSTER_IDS = "STRIMZI_BROKER_CLUSTER_IDS";

    /**
     * Delay after the first failed token lookup, in milliseconds
     */
    public static final String STRIMZI_BROKER_TOKEN_WAIT_INITIAL_DELAY_MS = "STRIMZI_BROKER_TOKEN_WAIT_INITIAL_DELAY_MS";

    /**
     * Growth factor of the delay between token lookups
     */
    public static final String STRIMZI_BROKER_TOKEN_WAIT_FACTOR = "STRIMZI_BROKER_TOKEN_WAIT_FACTOR";

    /**
     * Jitter of the delay between token lookups
     */
    public static final String STRIMZI_BROKER_TOKEN_WAIT_JITTER = "STRIMZI_BROKER_TOKEN_WAIT_JITTER";

    /**
     * Default broker namespace
     */
    public static final String DEFAULT_NAMESPACE = "submariner-k8s-broker";

    /**
     * Default components
     */
    public static final List<String> DEFAULT_COMPONENTS = List.of("service-discovery", "connectivity");

    private final String namespace;
    private final List<String> components;
    private final boolean installCrds;
    private final List<String> clusterIds;
    private final long tokenWaitInitialDelayMs;
    private final double tokenWaitFactor;
    private final double tokenWaitJitter;

    /**
     * Constructor
     *
     * @param namespace                 Broker namespace
     * @param components                Components which will use the broker
     * @param installCrds               Whether the CRDs of the components are installed
     * @param clusterIds                Clusters to provision service accounts for
     * @param tokenWaitInitialDelayMs   Delay after the first failed token lookup
     * @param tokenWaitFactor           Growth factor of the delay between token lookups
     * @param tokenWaitJitter           Jitter of the delay between token lookups
     */
    public BrokerOperatorConfig(String namespace,
                                List<String> components,
                                boolean installCrds,
                                List<String> clusterIds,
                                long tokenWaitInitialDelayMs,
                                double tokenWaitFactor,
                                double tokenWaitJitter) {
        this.namespace = namespace;
        this.components = List.copyOf(components);
        this.installCrds = installCrds;
        this.clusterIds = List.copyOf(clusterIds);
        this.tokenWaitInitialDelayMs = tokenWaitInitialDelayMs;
        this.tokenWaitFactor = tokenWaitFactor;
        this.tokenWaitJitter = tokenWaitJitter;
    }

    /**
     * Loads the configuration from a map of environment variables.
     *
     * @param map   Environment variables
     *
     * @return  The configuration
     *
     * @throws InvalidConfigurationException when any of the values is invalid
     */
    public static BrokerOperatorConfig fromMap(Map<String, String> map) {
        String namespace = map.get(STRIMZI_BROKER_NAMESPACE);
        if (namespace == null || namespace.isBlank()) {
            namespace = DEFAULT_NAMESPACE;
        }

        String componentsValue = map.get(STRIMZI_BROKER_COMPONENTS);
        List<String> components = componentsValue == null ? DEFAULT_COMPONENTS : parseList(componentsValue);

        long initialDelayMs = parseLong(map, STRIMZI_BROKER_TOKEN_WAIT_INITIAL_DELAY_MS, BackOff.DEFAULT_INITIAL_DELAY_MS);
        if (initialDelayMs <= 0) {
            throw new InvalidConfigurationException(STRIMZI_BROKER_TOKEN_WAIT_INITIAL_DELAY_MS + " must be positive, was " + initialDelayMs);
        }

        double factor = parseDouble(map, STRIMZI_BROKER_TOKEN_WAIT_FACTOR, BackOff.DEFAULT_FACTOR);
        if (factor <= 1.0) {
            throw new InvalidConfigurationException(STRIMZI_BROKER_TOKEN_WAIT_FACTOR + " must be greater than 1, was " + factor);
        }

        double jitter = parseDouble(map, STRIMZI_BROKER_TOKEN_WAIT_JITTER, BackOff.DEFAULT_JITTER);
        if (jitter < 0.0) {
            throw new InvalidConfigurationException(STRIMZI_BROKER_TOKEN_WAIT_JITTER + " must not be negative, was " + jitter);
        }

        return new BrokerOperatorConfig(
                namespace.trim(),
                components,
                parseBoolean(map, STRIMZI_BROKER_INSTALL_CRDS, true),
                parseList(map.get(STRIMZI_BROKER_CLUSTER_IDS)),
                initialDelayMs,
                factor,
                jitter
        );
    }

    /* test */ static List<String> parseList(String value) {
        List<String> result = new ArrayList<>();

        if (value != null) {
            Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(item -> !item.isEmpty())
                    .forEach(result::add);
        }

        return result;
    }

    private static boolean parseBoolean(Map<String, String> map, String name, boolean defaultValue) {
        String value = map.get(name);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new InvalidConfigurationException(name + " must be true or false, was " + value);
        }
    }

    private static long parseLong(Map<String, String> map, String name, long defaultValue) {
        String value = map.get(name);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(name + " must be a number, was " + value, e);
        }
    }

    private static double parseDouble(Map<String, String> map, String name, double defaultValue) {
        String value = map.get(name);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(name + " must be a number, was " + value, e);
        }
    }

    /**
     * @return  Broker namespace
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * @return  Components which will use the broker
     */
    public List<String> getComponents() {
        return components;
    }

    /**
     * @return  Whether the CRDs of the components are installed
     */
    public boolean isInstallCrds() {
        return installCrds;
    }

    /**
     * @return  Clusters to provision service accounts for
     */
    public List<String> getClusterIds() {
        return clusterIds;
    }

    /**
     * @return  Back-off used while waiting for service account tokens
     */
    public BackOff backOff() {
        return new BackOff(tokenWaitInitialDelayMs, tokenWaitFactor, tokenWaitJitter, BackOff.DEFAULT_MAX_ATTEMPTS);
    }

    @Override
    public String toString() {
        return "BrokerOperatorConfig("
                + "namespace=" + namespace
                + ", components=" + components
                + ", installCrds=" + installCrds
                + ", clusterIds=" + clusterIds
                + ", tokenWaitInitialDelayMs=" + tokenWaitInitialDelayMs
                + ", tokenWaitFactor=" + tokenWaitFactor
                + ", tokenWaitJitter=" + tokenWaitJitter
                + ")";
    }
}
