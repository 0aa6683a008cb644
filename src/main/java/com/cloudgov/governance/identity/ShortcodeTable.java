/*
 * SPDX-License-Identifier: Apache-2.0
 */

package com.cloudgov.governance.identity;

import com.cloudgov.governance.identity.exceptions.ShortcodeTableException;
import com.cloudgov.governance.util.Utils;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Fixed table of platform-managed service identities, keyed by shortcode. The table is configuration data: the
 * default ships as a classpath resource and can be replaced by pointing the {@value #TABLE_OVERRIDE_PROPERTY} system
 * property at a YAML file of the same shape.
 * <pre>
 * serviceIdentities:
 *   container-engine:
 *     service: container.googleapis.com
 *     principal: serviceAccount:service-${container.number}@container-engine-robot.iam.gserviceaccount.com
 *     eager: false
 * </pre>
 */
public final class ShortcodeTable {
    public static final String DEFAULT_TABLE_RESOURCE = "service_identities.yaml";
    public static final String TABLE_OVERRIDE_PROPERTY = "governance.shortcodeTable";
    public static final String SERVICE_IDENTITIES_KEY = "serviceIdentities";

    private static final Logger logger = LoggerFactory.getLogger(ShortcodeTable.class);
    private static final ObjectMapper YAML_MAPPER =
            YAMLMapper.builder().configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, true).build();

    private final Map<String, ServiceIdentityDefinition> byShortcode;
    private final Map<String, ServiceIdentityDefinition> byService;

    /**
     * Build a table from definitions. Shortcodes and services must both be unique, and a shortcode must not look like
     * a typed principal.
     *
     * @param definitions table rows
     * @throws ShortcodeTableException if the rows are inconsistent
     */
    public ShortcodeTable(Collection<ServiceIdentityDefinition> definitions) {
        Map<String, ServiceIdentityDefinition> shortcodes = new TreeMap<>();
        Map<String, ServiceIdentityDefinition> services = new TreeMap<>();
        for (ServiceIdentityDefinition definition : definitions) {
            if (definition.getShortcode().indexOf(':') >= 0) {
                throw new ShortcodeTableException(
                        "Shortcode must not contain a principal type prefix: " + definition.getShortcode());
            }
            if (shortcodes.put(definition.getShortcode(), definition) != null) {
                throw new ShortcodeTableException("Duplicate shortcode in table: " + definition.getShortcode());
            }
            if (services.put(definition.getService(), definition) != null) {
                throw new ShortcodeTableException("Service " + definition.getService()
                        + " is mapped to more than one shortcode");
            }
        }
        this.byShortcode = Collections.unmodifiableMap(shortcodes);
        this.byService = Collections.unmodifiableMap(services);
    }

    /**
     * Load the table from the override file if {@value #TABLE_OVERRIDE_PROPERTY} is set, from the bundled resource
     * otherwise.
     *
     * @return the configured table
     * @throws ShortcodeTableException if the table cannot be read
     */
    public static ShortcodeTable loadDefault() {
        String override = System.getProperty(TABLE_OVERRIDE_PROPERTY);
        if (Utils.isNotEmpty(override)) {
            logger.atInfo().addKeyValue("path", override).log("Loading service identity table override");
            return load(Paths.get(override));
        }
        try (InputStream inputStream = ShortcodeTable.class.getResourceAsStream(DEFAULT_TABLE_RESOURCE)) {
            if (inputStream == null) {
                throw new ShortcodeTableException("Bundled service identity table is missing: "
                        + DEFAULT_TABLE_RESOURCE);
            }
            return load(inputStream);
        } catch (IOException e) {
            throw new ShortcodeTableException("Unable to read bundled service identity table", e);
        }
    }

    /**
     * Load the table from a YAML file.
     *
     * @param path file to read
     * @return the table
     * @throws ShortcodeTableException if the file cannot be read or is inconsistent
     */
    public static ShortcodeTable load(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return load(inputStream);
        } catch (IOException e) {
            throw new ShortcodeTableException("Unable to read service identity table " + path, e);
        }
    }

    /**
     * Load the table from a YAML stream.
     *
     * @param inputStream stream to read, not closed
     * @return the table
     * @throws ShortcodeTableException if the content cannot be parsed or is inconsistent
     */
    public static ShortcodeTable load(InputStream inputStream) {
        Map<String, Map<String, ServiceIdentityConfig>> root;
        try {
            root = YAML_MAPPER.readValue(inputStream,
                    new TypeReference<Map<String, Map<String, ServiceIdentityConfig>>>() {
                    });
        } catch (IllegalArgumentException | IOException e) {
            throw new ShortcodeTableException("Unable to deserialize service identity table", e);
        }
        if (root == null || root.get(SERVICE_IDENTITIES_KEY) == null) {
            throw new ShortcodeTableException("Service identity table has no " + SERVICE_IDENTITIES_KEY + " section");
        }

        List<ServiceIdentityDefinition> definitions = new ArrayList<>();
        for (Map.Entry<String, ServiceIdentityConfig> entry : root.get(SERVICE_IDENTITIES_KEY).entrySet()) {
            ServiceIdentityConfig config = entry.getValue();
            if (config == null || Utils.isEmpty(config.getService()) || Utils.isEmpty(config.getPrincipal())) {
                throw new ShortcodeTableException("Service identity " + entry.getKey()
                        + " must declare both service and principal");
            }
            definitions.add(ServiceIdentityDefinition.builder()
                    .shortcode(entry.getKey())
                    .service(config.getService())
                    .principalTemplate(config.getPrincipal())
                    .eager(Boolean.TRUE.equals(config.getEager()))
                    .build());
        }
        logger.atDebug().addKeyValue("identities", definitions.size()).log("Loaded service identity table");
        return new ShortcodeTable(definitions);
    }

    public Optional<ServiceIdentityDefinition> findByShortcode(String shortcode) {
        return Optional.ofNullable(byShortcode.get(shortcode));
    }

    public Optional<ServiceIdentityDefinition> findByService(String service) {
        return Optional.ofNullable(byService.get(service));
    }

    public Collection<ServiceIdentityDefinition> definitions() {
        return byShortcode.values();
    }
}
