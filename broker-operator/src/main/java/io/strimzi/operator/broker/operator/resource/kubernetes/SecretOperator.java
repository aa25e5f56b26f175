/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.strimzi.operator.broker.operator.resource.kubernetes;

import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretList;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.NonNamespaceOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator for {@code Secret}s
 */
public class SecretOperator extends AbstractResourceOperator<Secret, SecretList, Resource<Secret>> {
    /**
     * Type of the secrets holding service account tokens
     */
    public static final String SERVICE_ACCOUNT_TOKEN_TYPE = "kubernetes.io/service-account-token";

    /**
     * Annotation with the name of the service account a token secret belongs to
     */
    public static final String SERVICE_ACCOUNT_NAME_ANNOTATION = "kubernetes.io/service-account.name";

    /**
     * Data key of the token in a token secret
     */
    public static final String TOKEN_KEY = "token";

    /**
     * Constructor
     *
     * @param vertx     The Vertx instance
     * @param client    The Kubernetes client
     */
    public SecretOperator(Vertx vertx, KubernetesClient client) {
        super(vertx, client, "Secret");
    }

    @Override
    protected NonNamespaceOperation<Secret, SecretList, Resource<Secret>> operation(String namespace) {
        return client.secrets().inNamespace(namespace);
    }

    /**
     * Finds the populated token secret of a service account. Secrets referenced from the service account are checked
     * first, then all token secrets in the namespace annotated with the service account name.
     *
     * @param namespace             Namespace of the service account
     * @param serviceAccountName    Name of the service account
     *
     * @return  Future with the token secret. It fails with {@link ServiceAccountTokenNotFoundException} when the
     *          service account or its token does not exist or is not populated yet, and with the client error when
     *          the API server cannot be queried.
     */
    public Future<Secret> getServiceAccountToken(String namespace, String serviceAccountName) {
        return vertx.executeBlocking(() -> {
            ServiceAccount serviceAccount = client.serviceAccounts().inNamespace(namespace).withName(serviceAccountName).get();

            if (serviceAccount == null) {
                throw new ServiceAccountTokenNotFoundException("ServiceAccount " + namespace + "/" + serviceAccountName + " does not exist");
            }

            List<Secret> candidates = new ArrayList<>();

            if (serviceAccount.getSecrets() != null) {
                for (ObjectReference reference : serviceAccount.getSecrets()) {
                    Secret secret = operation(namespace).withName(reference.getName()).get();

                    if (secret != null) {
                        candidates.add(secret);
                    }
                }
            }

            candidates.addAll(operation(namespace).withField("type", SERVICE_ACCOUNT_TOKEN_TYPE).list().getItems());

            boolean unpopulated = false;
            for (Secret secret : candidates) {
                if (isTokenOf(secret, serviceAccountName)) {
                    if (secret.getData() != null && secret.getData().get(TOKEN_KEY) != null) {
                        return secret;
                    }

                    unpopulated = true;
                }
            }

            if (unpopulated) {
                throw new ServiceAccountTokenNotFoundException("Token secret of ServiceAccount " + namespace + "/" + serviceAccountName + " has not been populated yet");
            } else {
                throw new ServiceAccountTokenNotFoundException("No token secret found for ServiceAccount " + namespace + "/" + serviceAccountName);
            }
        });
    }

    private static boolean isTokenOf(Secret secret, String serviceAccountName) {
        return SERVICE_ACCOUNT_TOKEN_TYPE.equals(secret.getType())
                && secret.getMetadata().getAnnotations() != null
                && serviceAccountName.equals(secret.getMetadata().getAnnotations().get(SERVICE_ACCOUNT_NAME_ANNOTATION));
    }
}
