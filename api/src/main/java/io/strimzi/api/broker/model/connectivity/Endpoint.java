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
 * The tunnel endpoint of a registered cluster's active gateway.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(Cluster.GROUP)
@Version(Cluster.VERSION)
@Kind(Endpoint.RESOURCE_KIND)
@Plural(Endpoint.RESOURCE_PLURAL)
@Singular(Endpoint.RESOURCE_SINGULAR)
public class Endpoint extends CustomResource<EndpointSpec, Void> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String RESOURCE_KIND = "Endpoint";
    public static final String RESOURCE_PLURAL = "endpoints";
    public static final String RESOURCE_SINGULAR = "endpoint";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + Cluster.GROUP;
}
