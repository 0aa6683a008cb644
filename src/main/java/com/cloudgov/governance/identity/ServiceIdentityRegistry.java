/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import com.cloudgov.governance.identity.exceptions.MalformedPrincipalException;
import com.cloudgov.governance.identity.exceptions.ShortcodeTableException;
import com.cloudgov.governance.identity.exceptions.UnknownShortcodeException;
import com.cloudgov.governance.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Owns the shortcode to service identity mapping for one reconciliation pass. A registry is created per pass and
 * never shared.
 */
public class ServiceIdentityRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ServiceIdentityRegistry.class);

    private final ShortcodeTable table;
    private final String containerNumber;
    // keyed by service
    private final Map<String, ServiceIdentity> identities = new TreeMap<>();
    private final Map<String, String> shortcodeToService = new TreeMap<>();

    public ServiceIdentityRegistry(ShortcodeTable table) {
        this(table, null);
    }

    /**
     * Constructor.
     *
     * @param table           static service identity table
     * @param containerNumber numeric container identifier if the container already exists; only used to validate
     *                        materialized principals
     */
    public ServiceIdentityRegistry(ShortcodeTable table, String containerNumber) {
        this.table = table;
        this.containerNumber = Utils.isEmpty(containerNumber) ? null : containerNumber;
    }

    /**
     * Register the identity of a service from the static table. Registering the same service again returns the
     * identity registered first.
     *
     * @param service service name, for example pubsub.googleapis.com
     * @return the registered identity
     * @throws UnknownShortcodeException if the table has no identity for the service
     */
    public ServiceIdentity register(String service) throws UnknownShortcodeException {
        ServiceIdentity existing = identities.get(service);
        if (existing != null) {
            return existing;
        }
        ServiceIdentityDefinition definition = table.findByService(service).orElseThrow(
                () -> new UnknownShortcodeException("No service identity is known for service " + service, service));
        return register(definition);
    }

    /**
     * Register an identity that may not be part of the static table. Idempotent per service.
     *
     * @param definition identity definition
     * @return the registered identity
     * @throws ShortcodeTableException if the shortcode is already registered for a different service
     */
    public ServiceIdentity register(ServiceIdentityDefinition definition) {
        ServiceIdentity existing = identities.get(definition.getService());
        if (existing != null) {
            return existing;
        }
        String owner = shortcodeToService.get(definition.getShortcode());
        if (owner != null) {
            throw new ShortcodeTableException(String.format(
                    "Shortcode %s is already registered for service %s, cannot register it for %s",
                    definition.getShortcode(), owner, definition.getService()));
        }
        ServiceIdentity identity = ServiceIdentity.fromDefinition(definition);
        identities.put(identity.getService(), identity);
        shortcodeToService.put(identity.getShortcode(), identity.getService());
        logger.atDebug().addKeyValue("service", identity.getService()).addKeyValue("shortcode", identity.getShortcode())
                .addKeyValue("eager", identity.isEager()).log("Registered service identity");
        return identity;
    }

    /**
     * Find the identity for a shortcode, registering it from the static table on first use.
     *
     * @param shortcode symbolic identity name
     * @return the registered identity
     * @throws UnknownShortcodeException if the shortcode was never registered and is not in the table
     */
    public ServiceIdentity identityFor(String shortcode) throws UnknownShortcodeException {
        String service = shortcodeToService.get(shortcode);
        if (service != null) {
            return identities.get(service);
        }
        ServiceIdentityDefinition definition = table.findByShortcode(shortcode)
                .orElseThrow(() -> new UnknownShortcodeException(shortcode));
        return register(definition);
    }

    /**
     * Resolve a shortcode to its principal form. This is the concrete principal once materialized, and the principal
     * template otherwise.
     *
     * @param shortcode symbolic identity name
     * @return principal form
     * @throws UnknownShortcodeException if the shortcode was never registered and is not in the table
     */
    public String resolve(String shortcode) throws UnknownShortcodeException {
        return identityFor(shortcode).getPrincipal();
    }

    /**
     * Record the concrete principal the provisioning layer reported for an identity.
     *
     * @param shortcode symbolic identity name
     * @param principal concrete principal
     * @return the materialized identity
     * @throws UnknownShortcodeException   if the shortcode is unknown
     * @throws MalformedPrincipalException if the principal does not fit the identity's template or embeds a different
     *                                     container number
     */
    public ServiceIdentity materialize(String shortcode, String principal)
            throws UnknownShortcodeException, MalformedPrincipalException {
        ServiceIdentity identity = identityFor(shortcode);
        if (identity.isMaterialized()) {
            if (identity.getPrincipal().equals(principal)) {
                return identity;
            }
            throw new MalformedPrincipalException(String.format(
                    "Service identity %s is already materialized as %s, cannot change it to %s", shortcode,
                    identity.getPrincipal(), principal), shortcode);
        }
        PrincipalTemplate template = PrincipalTemplate.of(identity.getPrincipal());
        if (!template.matches(principal, containerNumber)) {
            throw new MalformedPrincipalException(String.format(
                    "Principal %s reported for service identity %s does not match %s", principal, shortcode,
                    containerNumber == null ? template : template + " with container number " + containerNumber),
                    shortcode);
        }
        ServiceIdentity materialized = identity.toBuilder().principal(principal).materialized(true).build();
        identities.put(materialized.getService(), materialized);
        logger.atDebug().addKeyValue("shortcode", shortcode).addKeyValue("principal", principal)
                .log("Service identity materialized");
        return materialized;
    }

    /**
     * Identities the provisioning layer must create together with the container: eager identities whose service is
     * enabled, plus eager identities already referenced during this pass.
     *
     * @param enabledServices services enabled on the container
     * @return eager identities ordered by shortcode
     */
    public List<ServiceIdentity> eagerIdentities(Collection<String> enabledServices) {
        Set<String> enabled = new TreeSet<>(enabledServices == null ? Collections.emptySet() : enabledServices);
        for (ServiceIdentityDefinition definition : table.definitions()) {
            if (definition.isEager() && enabled.contains(definition.getService())) {
                register(definition);
            }
        }
        List<ServiceIdentity> eager = new ArrayList<>();
        for (ServiceIdentity identity : identities.values()) {
            if (identity.isEager()) {
                eager.add(identity);
            }
        }
        Collections.sort(eager);
        return Collections.unmodifiableList(eager);
    }

    /**
     * Identities registered so far in this pass, ordered by shortcode.
     *
     * @return registered identities
     */
    public List<ServiceIdentity> registeredIdentities() {
        List<ServiceIdentity> registered = new ArrayList<>(identities.values());
        Collections.sort(registered);
        return Collections.unmodifiableList(registered);
    }

    /**
     * Shortcode to concrete principal for every identity that is already resolvable, for reuse by other passes.
     *
     * @return discovery map ordered by shortcode
     */
    public Map<String, String> discovery() {
        Map<String, String> discovery = new TreeMap<>();
        for (ServiceIdentity identity : identities.values()) {
            if (identity.isMaterialized()) {
                discovery.put(identity.getShortcode(), identity.getPrincipal());
            }
        }
        return Collections.unmodifiableMap(discovery);
    }
}
