/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.api.broker.model.multicluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Singular;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Multi-cluster services {@code ServiceImport}, the aggregated view of a Service exported from one or more clusters.
 * Stored in the broker namespace so every registered cluster can import it.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(ServiceImport.GROUP)
@Version(ServiceImport.VERSION)
@Kind(ServiceImport.RESOURCE_KIND)
@Plural(ServiceImport.RESOURCE_PLURAL)
@Singular(ServiceImport.RESOURCE_SINGULAR)
@ShortNames(ServiceImport.SHORT_NAME)
public class ServiceImport extends CustomResource<ServiceImportSpec, ServiceImportStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = ServiceExport.GROUP;
    public static final String VERSION = ServiceExport.VERSION;

    public static final String RESOURCE_KIND = "ServiceImport";
    public static final String RESOURCE_PLURAL = "serviceimports";
    public static final String RESOURCE_SINGULAR = "serviceimport";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;
    public static final String SHORT_NAME = "svcim";
}
