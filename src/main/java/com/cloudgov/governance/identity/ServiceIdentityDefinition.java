/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Static description of a platform-managed service identity. The principal template embeds
 * {@value PrincipalTemplate#CONTAINER_NUMBER_PLACEHOLDER} wherever the container number appears in the final
 * principal.
 */
@Builder(toBuilder = true)
@Value
public class ServiceIdentityDefinition {
    @NonNull
    String service;
    @NonNull
    String shortcode;
    @NonNull
    String principalTemplate;
    // identities that must be created when the container is created instead of on first use of the service
    boolean eager;
}
