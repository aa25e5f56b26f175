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
 * A cluster registered with the broker. Written by the cluster's own agent into the broker namespace and read by
 * every other cluster when it sets up connectivity.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(Cluster.GROUP)
@Version(Cluster.VERSION)
@Kind(Cluster.RESOURCE_KIND)
@Plural(Cluster.RESOURCE_PLURAL)
@Singular(Cluster.RESOURCE_SINGULAR)
public class Cluster extends CustomResource<ClusterSpec, Void> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = "submariner.io";
    public static final String VERSION = "v1";

    public static final String RESOURCE_KIND = "Cluster";
    public static final String RESOURCE_PLURAL = "clusters";
    public static final String RESOURCE_SINGULAR = "cluster";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;
}
