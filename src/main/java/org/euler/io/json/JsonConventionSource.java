package org.euler.io.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.euler.convention.AffineAngleTransform;
import org.euler.convention.AxisCode;
import org.euler.convention.ConventionDescriptor;
import org.euler.convention.ConventionRegistry;
import org.euler.io.ConventionSource;
import org.euler.io.ConventionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JSON implementation of ConventionSource.
 *
 * Expected JSON shape:
 * {
 *   "default": "XYZs",
 *   "conventions": [
 *     { "name": "XYZs", "aliases": ["sxyz"], "code": [0, 0, 0, 0] },
 *     { "name": "Bunge", "axes": "ZXZr", "angleLabels": ["phi1", "Phi", "phi2"] },
 *     { "name": "Kocks", "parent": "Roe",
 *       "toParent": { "scale": [1, 1, -1], "offsetPi": [0, 0, 1] } }
 *   ]
 * }
 *
 * Every entry has exactly one of:
 * - "code": the (inner axis, parity, repetition, frame) tuple of a base convention
 * - "axes": name of an earlier base entry whose code is reused under new labels
 * - "parent": a derived convention with an affine "toParent" map (and optionally "fromParent";
 *   otherwise the inverse of "toParent" is used). Offsets are "offset" (radians) plus "offsetPi" (multiples of pi).
 */
public final class JsonConventionSource implements ConventionSource {

    private static final Logger log = LoggerFactory.getLogger(JsonConventionSource.class);

    private final InputStreamSupplier streamSupplier;
    private final String sourceName;

    // Cached after first load
    private volatile ConventionTable cached;

    private final Object lock = new Object();

    public JsonConventionSource(InputStreamSupplier streamSupplier, String sourceName) {
        this.streamSupplier = Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName must be non-empty");
        }
        this.sourceName = sourceName;
    }

    /**
     * Source reading an absolute classpath resource such as "/org/euler/conventions.json".
     */
    public static JsonConventionSource classpath(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must be non-empty");
        }
        return new JsonConventionSource(() -> {
            InputStream in = JsonConventionSource.class.getResourceAsStream(resource);
            if (in == null) {
                throw new FileNotFoundException("Missing classpath resource: " + resource);
            }
            return in;
        }, "classpath:" + resource);
    }

    public String sourceName() {
        return sourceName;
    }

    @Override
    public ConventionTable load() {
        ConventionTable local = cached;
        if (local != null) {
            return local;
        }

        synchronized (lock) {
            if (cached != null) {
                return cached;
            }
            this.cached = loadOnce();
            return this.cached;
        }
    }

    private ConventionTable loadOnce() {
        ObjectMapper mapper = new ObjectMapper();

        JsonNode root;
        try (InputStream in = streamSupplier.open()) {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON in convention table " + sourceName, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read convention table " + sourceName, e);
        }

        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Convention table " + sourceName + " must be a JSON object");
        }

        String defaultName = ConventionRegistry.DEFAULT_CONVENTION_NAME;
        JsonNode defaultNode = root.get("default");
        if (defaultNode != null) {
            if (!defaultNode.isTextual() || defaultNode.asText().isBlank()) {
                throw new IllegalArgumentException("'default' must be a non-empty string in " + sourceName);
            }
            defaultName = defaultNode.asText();
        }

        JsonNode entries = root.get("conventions");
        if (entries == null || !entries.isArray()) {
            throw new IllegalArgumentException("Convention table " + sourceName + " needs a 'conventions' array");
        }

        List<ConventionDescriptor> result = new ArrayList<>();
        // base codes by normalized name and alias, for "axes" references
        Map<String, AxisCode> codes = new HashMap<>();

        for (JsonNode entry : entries) {
            if (!entry.isObject()) {
                throw new IllegalArgumentException("Expected an object inside 'conventions' of " + sourceName);
            }
            ConventionDescriptor descriptor = readEntry(entry, codes);
            descriptor.axisCode().ifPresent(code -> {
                for (String alias : descriptor.aliases()) {
                    codes.putIfAbsent(alias, code);
                }
            });
            result.add(descriptor);
        }

        if (result.isEmpty()) {
            throw new IllegalArgumentException("Convention table " + sourceName + " is empty");
        }

        log.debug("Parsed {} conventions from {}", result.size(), sourceName);
        return new ConventionTable(defaultName, result);
    }

    private ConventionDescriptor readEntry(JsonNode entry, Map<String, AxisCode> codes) {
        String name = requireText(entry, "name", "<unnamed>");
        ConventionDescriptor.Builder builder = ConventionDescriptor.builder(name);

        JsonNode description = entry.get("description");
        if (description != null) {
            builder.description(description.asText());
        }
        JsonNode aliases = entry.get("aliases");
        if (aliases != null) {
            if (!aliases.isArray()) {
                throw new IllegalArgumentException("'aliases' of '" + name + "' must be an array of strings");
            }
            for (JsonNode alias : aliases) {
                if (!alias.isTextual()) {
                    throw new IllegalArgumentException("'aliases' of '" + name + "' must be an array of strings");
                }
                builder.aliases(alias.asText());
            }
        }
        String[] angleLabels = readLabels(entry, "angleLabels", name);
        if (angleLabels != null) {
            builder.angleLabels(angleLabels[0], angleLabels[1], angleLabels[2]);
        }
        String[] axisLabels = readLabels(entry, "axisLabels", name);
        if (axisLabels != null) {
            builder.axisLabels(axisLabels[0], axisLabels[1], axisLabels[2]);
        }

        boolean hasCode = entry.has("code");
        boolean hasAxes = entry.has("axes");
        boolean hasParent = entry.has("parent");
        int kinds = (hasCode ? 1 : 0) + (hasAxes ? 1 : 0) + (hasParent ? 1 : 0);
        if (kinds != 1) {
            throw new IllegalArgumentException(
                    "Convention '" + name + "' needs exactly one of 'code', 'axes' or 'parent'"
            );
        }

        if (hasCode) {
            builder.code(readCode(entry.get("code"), name));
        } else if (hasAxes) {
            String axes = requireText(entry, "axes", name);
            AxisCode code = codes.get(axes.strip().toLowerCase(Locale.ROOT));
            if (code == null) {
                throw new IllegalArgumentException(
                        "'axes' of '" + name + "' refers to '" + axes + "', which is not an earlier base convention"
                );
            }
            builder.code(code);
        } else {
            String parent = requireText(entry, "parent", name);
            JsonNode toParent = entry.get("toParent");
            if (toParent == null) {
                throw new IllegalArgumentException("Derived convention '" + name + "' needs a 'toParent' map");
            }
            AffineAngleTransform to = readAffine(toParent, name, "toParent");
            JsonNode fromParent = entry.get("fromParent");
            if (fromParent == null) {
                builder.derivedFrom(parent, to);
            } else {
                builder.derivedFrom(parent, to, readAffine(fromParent, name, "fromParent"));
            }
        }
        return builder.build();
    }

    private static AxisCode readCode(JsonNode node, String name) {
        if (!node.isArray() || node.size() != 4) {
            throw new IllegalArgumentException("'code' of '" + name + "' must be an array of 4 integers");
        }
        int[] tuple = new int[4];
        for (int n = 0; n < 4; n++) {
            JsonNode v = node.get(n);
            if (!v.isInt()) {
                throw new IllegalArgumentException("'code' of '" + name + "' must be an array of 4 integers");
            }
            tuple[n] = v.intValue();
        }
        try {
            return AxisCode.of(tuple[0], tuple[1], tuple[2], tuple[3]);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid 'code' of '" + name + "': " + e.getMessage(), e);
        }
    }

    private static AffineAngleTransform readAffine(JsonNode node, String name, String field) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("'" + field + "' of '" + name + "' must be an object");
        }
        double[] scale = readTriple(node, "scale", 1.0, name, field);
        double[] offset = readTriple(node, "offset", 0.0, name, field);
        double[] offsetPi = readTriple(node, "offsetPi", 0.0, name, field);
        for (int n = 0; n < 3; n++) {
            offset[n] += offsetPi[n] * Math.PI;
        }
        try {
            return AffineAngleTransform.of(scale, offset);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid '" + field + "' of '" + name + "': " + e.getMessage(), e);
        }
    }

    private static double[] readTriple(JsonNode node, String key, double fallback, String name, String field) {
        JsonNode values = node.get(key);
        if (values == null) {
            return new double[]{fallback, fallback, fallback};
        }
        if (!values.isArray() || values.size() != 3) {
            throw new IllegalArgumentException(
                    "'" + field + "." + key + "' of '" + name + "' must be an array of 3 numbers"
            );
        }
        double[] out = new double[3];
        for (int n = 0; n < 3; n++) {
            if (!values.get(n).isNumber()) {
                throw new IllegalArgumentException(
                        "'" + field + "." + key + "' of '" + name + "' must be an array of 3 numbers"
                );
            }
            out[n] = values.get(n).doubleValue();
        }
        return out;
    }

    private static String[] readLabels(JsonNode entry, String key, String name) {
        JsonNode labels = entry.get(key);
        if (labels == null) {
            return null;
        }
        if (!labels.isArray() || labels.size() != 3) {
            throw new IllegalArgumentException("'" + key + "' of '" + name + "' must be an array of 3 strings");
        }
        String[] out = new String[3];
        for (int n = 0; n < 3; n++) {
            JsonNode label = labels.get(n);
            if (!label.isTextual() || label.asText().isBlank()) {
                throw new IllegalArgumentException("'" + key + "' of '" + name + "' must be an array of 3 strings");
            }
            out[n] = label.asText();
        }
        return out;
    }

    private static String requireText(JsonNode entry, String key, String name) {
        JsonNode value = entry.get(key);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Missing/blank '" + key + "' in convention entry '" + name + "'");
        }
        return value.asText();
    }

    /**
     * Simple functional interface so callers can provide:
     * - a classpath resource stream
     * - a file stream
     * - an in-memory table in tests
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
