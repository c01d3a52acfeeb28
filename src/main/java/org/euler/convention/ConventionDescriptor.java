package org.euler.convention;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one Euler angles convention.
 *
 * Labels and description are presentation data only; conversions use
 * nothing but the {@link ConventionDefinition}.
 * Two descriptors are equal when their normalized names are equal.
 */
public final class ConventionDescriptor {

    private static final List<String> DEFAULT_ANGLE_LABELS = List.of("theta_1", "theta_2", "theta_3");
    private static final List<String> DEFAULT_AXIS_LABELS = List.of("X", "Y", "Z");

    private final String name;
    private final String description;
    private final List<String> angleLabels;
    private final List<String> axisLabels;
    private final Set<String> aliases;
    private final ConventionDefinition definition;

    private ConventionDescriptor(Builder b) {
        this.name = b.name;
        this.description = b.description == null ? "" : b.description;
        this.angleLabels = b.angleLabels;
        this.axisLabels = b.axisLabels;
        this.definition = Objects.requireNonNull(b.definition,
                "Convention '" + b.name + "' needs either an axis code or a parent");

        Set<String> keys = new LinkedHashSet<>();
        keys.add(normalizeAlias(b.name));
        for (String alias : b.aliases) {
            keys.add(normalizeAlias(alias));
        }
        this.aliases = Collections.unmodifiableSet(keys);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Shortcut for a base convention named after its code with default labels,
     * e.g. "XYZs" with aliases "xyzs" and "sxyz".
     */
    public static ConventionDescriptor ofCode(AxisCode code) {
        Objects.requireNonNull(code, "code must not be null");
        String name = code.conventionName();
        String letters = name.substring(0, 3);
        char suffix = code.frame().suffix();
        return builder(name)
                .code(code)
                .aliases(suffix + letters)
                .description(letters + " " + code.frame().name().toLowerCase(Locale.ROOT) + " frame convention")
                .build();
    }

    /**
     * Lookup key rule shared by descriptors and the registry:
     * trim surrounding whitespace and lowercase (Locale.ROOT).
     */
    static String normalizeAlias(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("convention name must be non-empty");
        }
        return raw.strip().toLowerCase(Locale.ROOT);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    /** Display names of the three angles, in triple order. */
    public List<String> angleLabels() {
        return angleLabels;
    }

    /** Display names of the physical axes (e.g. RD, TD, ND). */
    public List<String> axisLabels() {
        return axisLabels;
    }

    /** Normalized lookup keys, the normalized name first. */
    public Set<String> aliases() {
        return aliases;
    }

    public ConventionDefinition definition() {
        return definition;
    }

    public boolean isBase() {
        return definition.isBase();
    }

    /** Own axis code; empty for derived conventions. */
    public Optional<AxisCode> axisCode() {
        if (definition instanceof BaseDefinition base) {
            return Optional.of(base.code());
        }
        return Optional.empty();
    }

    /** Parent name; empty for base conventions. */
    public Optional<String> parentName() {
        if (definition instanceof DerivedDefinition derived) {
            return Optional.of(derived.parentName());
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConventionDescriptor other)) return false;
        return normalizeAlias(name).equals(normalizeAlias(other.name));
    }

    @Override
    public int hashCode() {
        return normalizeAlias(name).hashCode();
    }

    @Override
    public String toString() {
        return name;
    }

    public static final class Builder {
        private final String name;
        private String description;
        private List<String> angleLabels = DEFAULT_ANGLE_LABELS;
        private List<String> axisLabels = DEFAULT_AXIS_LABELS;
        private final List<String> aliases = new ArrayList<>();
        private ConventionDefinition definition;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must be non-empty");
            }
            this.name = name.strip();
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder angleLabels(String first, String second, String third) {
            this.angleLabels = labels(first, second, third);
            return this;
        }

        public Builder axisLabels(String first, String second, String third) {
            this.axisLabels = labels(first, second, third);
            return this;
        }

        public Builder aliases(String... aliases) {
            Objects.requireNonNull(aliases, "aliases must not be null");
            for (String alias : aliases) {
                normalizeAlias(alias);
                this.aliases.add(alias);
            }
            return this;
        }

        public Builder code(AxisCode code) {
            this.definition = new BaseDefinition(code);
            return this;
        }

        public Builder derivedFrom(String parentName, AngleTransform toParent, AngleTransform fromParent) {
            this.definition = new DerivedDefinition(parentName, toParent, fromParent);
            return this;
        }

        public Builder derivedFrom(String parentName, AffineAngleTransform toParent) {
            this.definition = DerivedDefinition.affine(parentName, toParent);
            return this;
        }

        public ConventionDescriptor build() {
            return new ConventionDescriptor(this);
        }

        private static List<String> labels(String first, String second, String third) {
            List<String> out = List.of(first, second, third);
            for (String label : out) {
                if (label.isBlank()) {
                    throw new IllegalArgumentException("labels must be non-empty");
                }
            }
            return out;
        }
    }
}
