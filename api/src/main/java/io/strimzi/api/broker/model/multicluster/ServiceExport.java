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
 * Multi-cluster services {@code ServiceExport}. Clusters create one of these in their own namespace to mark a Service
 * for export, and the agents mirror it through the broker namespace.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(ServiceExport.GROUP)
@Version(ServiceExport.VERSION)
@Kind(ServiceExport.RESOURCE_KIND)
@Plural(ServiceExport.RESOURCE_PLURAL)
@Singular(ServiceExport.RESOURCE_SINGULAR)
@ShortNames(ServiceExport.SHORT_NAME)
public class ServiceExport extends CustomResource<ServiceExportSpec, ServiceExportStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = "multicluster.x-k8s.io";
    public static final String VERSION = "v1alpha1";

    public static final String RESOURCE_KIND = "ServiceExport";
    public static final String RESOURCE_PLURAL = "serviceexports";
    public static final String RESOURCE_SINGULAR = "serviceexport";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;
    public static final String SHORT_NAME = "svcex";
}
