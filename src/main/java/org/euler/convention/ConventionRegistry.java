package org.euler.convention;

import org.euler.io.ConventionSource;
import org.euler.io.ConventionTable;
import org.euler.io.json.JsonConventionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup table of Euler angles conventions by case-insensitive name or alias.
 *
 * A registry is validated once when it is built (unique aliases, resolvable and acyclic
 * parent chains, a base default) and never changes afterwards, so one instance can be
 * shared by any number of threads. Extending it means building a new registry.
 */
public final class ConventionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConventionRegistry.class);

    /** Classpath location of the bundled convention table. */
    public static final String STANDARD_TABLE = "/org/euler/conventions.json";

    /** Used when a table or builder does not name a default. */
    public static final String DEFAULT_CONVENTION_NAME = "XYZs";

    private final List<ConventionDescriptor> conventions;
    private final Map<String, ConventionDescriptor> byAlias;
    private final ConventionDescriptor defaultConvention;

    private ConventionRegistry(List<ConventionDescriptor> conventions,
                               Map<String, ConventionDescriptor> byAlias,
                               ConventionDescriptor defaultConvention) {
        this.conventions = List.copyOf(conventions);
        this.byAlias = Collections.unmodifiableMap(byAlias);
        this.defaultConvention = defaultConvention;
    }

    /**
     * The process-wide registry built from {@link #STANDARD_TABLE} on first use.
     */
    public static ConventionRegistry standard() {
        return StandardHolder.INSTANCE;
    }

    /**
     * Builds a registry from any table source (JSON file, test fixture, ...).
     */
    public static ConventionRegistry fromSource(ConventionSource source) {
        Objects.requireNonNull(source, "source must not be null");
        ConventionTable table = source.load();
        return builder()
                .addAll(table.conventions())
                .defaultConvention(table.defaultName())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the convention for the name or alias, or empty if not registered.
     * Use this when absence is part of normal flow.
     */
    public Optional<ConventionDescriptor> find(String nameOrAlias) {
        return Optional.ofNullable(byAlias.get(ConventionDescriptor.normalizeAlias(nameOrAlias)));
    }

    /**
     * @return the convention for the name or alias (exact match after trimming and lowercasing)
     * @throws UnknownConventionException if nothing matches
     */
    public ConventionDescriptor resolve(String nameOrAlias) {
        return find(nameOrAlias).orElseThrow(() -> new UnknownConventionException(nameOrAlias));
    }

    public boolean contains(String nameOrAlias) {
        return find(nameOrAlias).isPresent();
    }

    /** The documented default base convention (XYZs for the standard table). */
    public ConventionDescriptor defaultConvention() {
        return defaultConvention;
    }

    /** All conventions in registration order. */
    public List<ConventionDescriptor> conventions() {
        return conventions;
    }

    /** All normalized lookup keys. */
    public Set<String> aliases() {
        return byAlias.keySet();
    }

    /**
     * Resolves a convention to its base convention by looking up parents by name.
     * The convention itself does not have to be registered, only its ancestors.
     *
     * @throws UnresolvedConventionException if a parent is missing or the chain loops
     */
    public ConventionChain chainOf(ConventionDescriptor convention) {
        Objects.requireNonNull(convention, "convention must not be null");

        List<ConventionDescriptor> path = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        ConventionDescriptor current = convention;

        while (true) {
            if (!visited.add(ConventionDescriptor.normalizeAlias(current.name()))) {
                throw new UnresolvedConventionException(
                        "Parent chain of '" + convention.name() + "' loops back to '" + current.name() + "'"
                );
            }
            path.add(current);

            if (!(current.definition() instanceof DerivedDefinition derived)) {
                return new ConventionChain(path);
            }
            ConventionDescriptor child = current;
            current = find(derived.parentName()).orElseThrow(() -> new UnresolvedConventionException(
                    "Parent '" + derived.parentName() + "' of '" + child.name() + "' is not registered"
            ));
        }
    }

    /**
     * A new registry holding these conventions plus the given ones, with the same default.
     */
    public ConventionRegistry with(ConventionDescriptor... extra) {
        Objects.requireNonNull(extra, "extra must not be null");
        return builder()
                .addAll(conventions)
                .addAll(Arrays.asList(extra))
                .defaultConvention(defaultConvention.name())
                .build();
    }

    private static final class StandardHolder {
        private static final ConventionRegistry INSTANCE =
                fromSource(JsonConventionSource.classpath(STANDARD_TABLE));
    }

    /**
     * Collects conventions and validates them into an immutable registry.
     */
    public static final class Builder {
        private final List<ConventionDescriptor> conventions = new ArrayList<>();
        private String defaultName = DEFAULT_CONVENTION_NAME;

        private Builder() {
        }

        public Builder add(ConventionDescriptor convention) {
            conventions.add(Objects.requireNonNull(convention, "convention must not be null"));
            return this;
        }

        public Builder addAll(List<ConventionDescriptor> list) {
            Objects.requireNonNull(list, "list must not be null");
            list.forEach(this::add);
            return this;
        }

        public Builder defaultConvention(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("default convention name must be non-empty");
            }
            this.defaultName = name;
            return this;
        }

        /**
         * @throws IllegalArgumentException for an empty table, an alias used twice,
         *                                  an unresolvable or looping parent chain,
         *                                  or a default that is missing or derived
         */
        public ConventionRegistry build() {
            if (conventions.isEmpty()) {
                throw new IllegalArgumentException("A registry needs at least one convention");
            }

            Map<String, ConventionDescriptor> byAlias = new LinkedHashMap<>();
            for (ConventionDescriptor c : conventions) {
                for (String alias : c.aliases()) {
                    ConventionDescriptor previous = byAlias.putIfAbsent(alias, c);
                    if (previous != null) {
                        throw new IllegalArgumentException(
                                "Alias '" + alias + "' of '" + c.name() + "' is already used by '" + previous.name() + "'"
                        );
                    }
                }
            }

            ConventionDescriptor def = byAlias.get(ConventionDescriptor.normalizeAlias(defaultName));
            if (def == null) {
                throw new IllegalArgumentException("Default convention '" + defaultName + "' is not in the table");
            }
            if (!def.isBase()) {
                throw new IllegalArgumentException("Default convention '" + defaultName + "' must be a base convention");
            }

            ConventionRegistry registry = new ConventionRegistry(conventions, byAlias, def);
            for (ConventionDescriptor c : conventions) {
                try {
                    registry.chainOf(c);
                } catch (UnresolvedConventionException e) {
                    throw new IllegalArgumentException("Invalid convention table: " + e.getMessage(), e);
                }
            }

            log.info("Convention registry ready: {} conventions, {} aliases, default={}",
                    conventions.size(), byAlias.size(), def.name());
            return registry;
        }
    }
}
