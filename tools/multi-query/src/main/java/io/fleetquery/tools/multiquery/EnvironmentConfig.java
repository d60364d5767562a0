package io.fleetquery.tools.multiquery;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of the environments file: the ordered list of endpoints to query.
 */
public record EnvironmentConfig(@JsonProperty("environments") List<EndpointDescriptor> environments) {

    private static final int MIN_PORT = 1;
    private static final int MAX_PORT = 65535;

    public EnvironmentConfig {
        environments = environments == null ? List.of() : List.copyOf(environments);
    }

    public int count() {
        return environments.size();
    }

    /**
     * Collects every problem in the configuration; empty when it is usable.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (environments.isEmpty()) {
            errors.add("No environments found in configuration");
            return errors;
        }

        Map<String, Integer> seenIds = new HashMap<>();
        for (int i = 0; i < environments.size(); i++) {
            EndpointDescriptor env = environments.get(i);
            String prefix = "Environment " + (i + 1);

            if (isBlank(env.id())) {
                errors.add(prefix + ": ClientId is required");
            } else {
                Integer previous = seenIds.putIfAbsent(env.id(), i + 1);
                if (previous != null) {
                    errors.add(prefix + ": ClientId '" + env.id() + "' is already used by environment " + previous);
                }
            }
            if (isBlank(env.host())) {
                errors.add(prefix + ": Hostname is required");
            }
            if (env.port() < MIN_PORT || env.port() > MAX_PORT) {
                errors.add(prefix + ": Port must be between " + MIN_PORT + " and " + MAX_PORT);
            }
            if (isBlank(env.database())) {
                errors.add(prefix + ": Database is required");
            }
            if (isBlank(env.username())) {
                errors.add(prefix + ": Username is required");
            }
            if (isBlank(env.password())) {
                errors.add(prefix + ": Password is required");
            }
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
