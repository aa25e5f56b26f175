/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.model;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinition;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceDefinitionBuilder;
import io.fabric8.kubernetes.api.model.apiextensions.v1.CustomResourceSubresourceStatus;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.strimzi.api.broker.model.connectivity.Cluster;
import io.strimzi.api.broker.model.connectivity.Endpoint;
import io.strimzi.api.broker.model.connectivity.Gateway;
import io.strimzi.api.broker.model.multicluster.ServiceExport;
import io.strimzi.api.broker.model.multicluster.ServiceImport;

import java.util.List;

/**
 * Custom resource definitions hosted by the broker. They are derived from the model classes in the API module and
 * use an open schema, validation is left to the controllers in the registered clusters.
 */
public class BrokerCrds {
    private BrokerCrds() {
        // Static methods only
    }

    /**
     * @return  CRDs needed by cluster connectivity
     */
    public static List<CustomResourceDefinition> connectivity() {
        return List.of(
                definitionFor(Cluster.class),
                definitionFor(Endpoint.class),
                definitionFor(Gateway.class)
        );
    }

    /**
     * @return  CRDs needed by service discovery, which Globalnet needs as well
     */
    public static List<CustomResourceDefinition> serviceDiscovery() {
        return List.of(
                definitionFor(ServiceExport.class),
                definitionFor(ServiceImport.class)
        );
    }

    /**
     * Builds the CRD of a custom resource class. Group, version, kind, plural, singular and short names come from the
     * fabric8 annotations on the class and the scope from whether it implements {@link Namespaced}.
     *
     * @param type  Custom resource class
     *
     * @return  CRD with a single served and stored version
     */
    public static CustomResourceDefinition definitionFor(Class<? extends CustomResource<?, ?>> type) {
        String group = HasMetadata.getGroup(type);
        String kind = HasMetadata.getKind(type);
        String plural = HasMetadata.getPlural(type);
        ShortNames shortNames = type.getAnnotation(ShortNames.class);

        return new CustomResourceDefinitionBuilder()
                .withNewMetadata()
                    .withName(plural + "." + group)
                    .withLabels(BrokerResources.LABELS)
                .endMetadata()
                .withNewSpec()
                    .withGroup(group)
                    .withScope(Namespaced.class.isAssignableFrom(type) ? "Namespaced" : "Cluster")
                    .withNewNames()
                        .withKind(kind)
                        .withListKind(kind + "List")
                        .withPlural(plural)
                        .withSingular(HasMetadata.getSingular(type))
                        .withShortNames(shortNames != null ? shortNames.value() : new String[0])
                    .endNames()
                    .addNewVersion()
                        .withName(HasMetadata.getVersion(type))
                        .withServed(true)
                        .withStorage(true)
                        .withNewSchema()
                            .withNewOpenAPIV3Schema()
                                .withType("object")
                                .withXKubernetesPreserveUnknownFields(true)
                            .endOpenAPIV3Schema()
                        .endSchema()
                        .withNewSubresources()
                            .withStatus(new CustomResourceSubresourceStatus())
                        .endSubresources()
                    .endVersion()
                .endSpec()
                .build();
    }
}
