/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A service identity registered for the current reconciliation pass. Until the provisioning layer reports the
 * materialized principal, {@link #getPrincipal()} holds the principal template, which is a symbolic reference the
 * provisioning layer fills in after the container exists.
 */
@Builder(toBuilder = true)
@Value
public class ServiceIdentity implements Comparable<ServiceIdentity> {
    @NonNull
    String service;
    @NonNull
    String shortcode;
    @NonNull
    String principal;
    boolean eager;
    boolean materialized;

    static ServiceIdentity fromDefinition(ServiceIdentityDefinition definition) {
        return ServiceIdentity.builder()
                .service(definition.getService())
                .shortcode(definition.getShortcode())
                .principal(definition.getPrincipalTemplate())
                .eager(definition.isEager())
                .materialized(false)
                .build();
    }

    @Override
    public int compareTo(ServiceIdentity other) {
        return this.shortcode.compareTo(other.shortcode);
    }
}
