package com.gamewright.core.model;

import java.util.Objects;

/**
 * The provider chosen for one request. Selected by external configuration and never
 * changed while the request runs.
 *
 * @param provider   which backend to call
 * @param model      model name understood by that backend
 * @param credential API key; may be blank here, the credential gate rejects it later
 */
public record ProviderConfig(ProviderKind provider, String model, String credential) {

    public ProviderConfig {
        Objects.requireNonNull(provider, "provider");
        credential = credential == null ? "" : credential;
    }

    public boolean hasCredential() {
        return !credential.isBlank();
    }

    @Override
    public String toString() {
        // keep the key out of logs
        return "ProviderConfig[provider=%s, model=%s, credential=%s]"
                .formatted(provider.id(), model, hasCredential() ? "****" : "<none>");
    }
}
