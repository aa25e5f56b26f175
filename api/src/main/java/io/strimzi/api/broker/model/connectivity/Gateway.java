/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.api.broker.model.connectivity;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Health of a cluster's gateway. Status only.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(Cluster.GROUP)
@Version(Cluster.VERSION)
@Kind(Gateway.RESOURCE_KIND)
@Plural(Gateway.RESOURCE_PLURAL)
@Singular(Gateway.RESOURCE_SINGULAR)
public class Gateway extends CustomResource<Void, GatewayStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String RESOURCE_KIND = "Gateway";
    public static final String RESOURCE_PLURAL = "gateways";
    public static final String RESOURCE_SINGULAR = "gateway";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + Cluster.GROUP;
}
