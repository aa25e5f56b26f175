/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker;

import io.strimzi.operator.broker.common.BackOff;
import io.strimzi.operator.common.InvalidConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class BrokerOperatorConfigTest {
    @Test
    public void testDefaults() {
        BrokerOperatorConfig config = BrokerOperatorConfig.fromMap(Map.of());

        assertThat(config.getNamespace(), is("submariner-k8s-broker"));
        assertThat(config.getComponents(), is(List.of("service-discovery", "connectivity")));
        assertThat(config.isInstallCrds(), is(true));
        assertThat(config.getClusterIds(), is(List.of()));
        assertThat(config.backOff().maxAttempts(), is(BackOff.DEFAULT_MAX_ATTEMPTS));
        assertThat(config.backOff().nominalTotalDelayMs(), is(new BackOff().nominalTotalDelayMs()));
    }

    @Test
    public void testAllValues() {
        Map<String, String> env = new HashMap<>();
        env.put(BrokerOperatorConfig.STRIMZI_BROKER_NAMESPACE, "my-broker");
        env.put(BrokerOperatorConfig.STRIMZI_BROKER_COMPONENTS, " connectivity , globalnet,, ");
        env.put(BrokerOperatorConfig.STRIMZI_BROKER_INSTALL_CRDS, "FALSE");
        env.put(BrokerOperatorConfig.STRIMZI_BROKER_CLUSTER_IDS, "east,west");
        env.put(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_INITIAL_DELAY_MS, "100");
        env.put(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_FACTOR, "2");
        env.put(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_JITTER, "0");

        BrokerOperatorConfig config = BrokerOperatorConfig.fromMap(env);

        assertThat(config.getNamespace(), is("my-broker"));
        assertThat(config.getComponents(), is(List.of("connectivity", "globalnet")));
        assertThat(config.isInstallCrds(), is(false));
        assertThat(config.getClusterIds(), is(List.of("east", "west")));
        // 100 + 200 + 400 + ... + 25600
        assertThat(config.backOff().nominalTotalDelayMs(), is(51_100L));
        assertThat(config.backOff().maxTotalDelayMs(), is(51_100L));
    }

    @Test
    public void testEmptyComponentsMeansNone() {
        BrokerOperatorConfig config = BrokerOperatorConfig.fromMap(Map.of(BrokerOperatorConfig.STRIMZI_BROKER_COMPONENTS, ""));

        assertThat(config.getComponents(), is(List.of()));
    }

    @Test
    public void testInvalidBoolean() {
        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> BrokerOperatorConfig.fromMap(Map.of(BrokerOperatorConfig.STRIMZI_BROKER_INSTALL_CRDS, "yes")));

        assertThat(e.getMessage(), containsString(BrokerOperatorConfig.STRIMZI_BROKER_INSTALL_CRDS));
    }

    @Test
    public void testInvalidNumbers() {
        assertThrows(InvalidConfigurationException.class,
                () -> BrokerOperatorConfig.fromMap(Map.of(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_INITIAL_DELAY_MS, "5s")));
        assertThrows(InvalidConfigurationException.class,
                () -> BrokerOperatorConfig.fromMap(Map.of(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_INITIAL_DELAY_MS, "0")));
        assertThrows(InvalidConfigurationException.class,
                () -> BrokerOperatorConfig.fromMap(Map.of(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_FACTOR, "1.0")));
        assertThrows(InvalidConfigurationException.class,
                () -> BrokerOperatorConfig.fromMap(Map.of(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_FACTOR, "fast")));
        assertThrows(InvalidConfigurationException.class,
                () -> BrokerOperatorConfig.fromMap(Map.of(BrokerOperatorConfig.STRIMZI_BROKER_TOKEN_WAIT_JITTER, "-0.5")));
    }

    @Test
    public void testParseList() {
        assertThat(BrokerOperatorConfig.parseList(null), is(List.of()));
        assertThat(BrokerOperatorConfig.parseList(" a,b ,, c"), is(List.of("a", "b", "c")));
    }
}
