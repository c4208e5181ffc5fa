package com.github.alvarosanchez.rpmrepo.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;

/**
 * Package requirement. A comparison flag is only kept together with a version.
 *
 * @param name required capability
 * @param version optional version constraint
 * @param flag optional comparison operator
 */
@Serdeable
@JsonIgnoreProperties(ignoreUnknown = true)
public record Dependency(String name, @Nullable String version, @JsonProperty("flags") @Nullable ComparisonFlag flag) {

    /**
     * Creates a dependency.
     *
     * @param name required capability
     * @param version optional version constraint
     * @param flag optional comparison operator
     */
    public Dependency {
        if (version != null && version.isEmpty()) {
            version = null;
        }
        if (version == null) {
            flag = null;
        }
    }

    /**
     * Builds a dependency from raw header values.
     *
     * @param name required capability
     * @param version version string, possibly empty
     * @param senseFlags raw RPM sense flags
     * @return dependency with a flag only when a version is present
     */
    public static Dependency fromHeader(String name, String version, long senseFlags) {
        if (version == null || version.isEmpty()) {
            return new Dependency(name, null, null);
        }
        return new Dependency(name, version, ComparisonFlag.fromSenseFlags(senseFlags).orElse(null));
    }
}
