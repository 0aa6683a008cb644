/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Class which represents one row of the service identity table, keyed by shortcode in the table file.
 */
@Builder(toBuilder = true)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ServiceIdentityConfig {
    private String service;
    private String principal;
    private Boolean eager;
    private String description;
}
