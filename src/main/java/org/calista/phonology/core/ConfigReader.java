package org.calista.phonology.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ConfigReader reads config as JsonNode to detect missing fields,
 * logs a warning for each missing value that falls back to its default,
 * then binds to {@link PhonologyConfig} and validates.
 *
 * Defaults come from PhonologyConfig field initializers + validate().
 */
public final class ConfigReader {

    private static final Logger log = LoggerFactory.getLogger(ConfigReader.class);

    private ConfigReader() {}

    public static PhonologyConfig bind(String json, Path source, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(mapper, "mapper");

        JsonNode root = mapper.readTree(json);
        if (root == null || root.isNull() || root.isMissingNode()) {
            log.warn("Config {} is empty/null. Falling back to defaults.", source);
            PhonologyConfig cfg = new PhonologyConfig();
            cfg.validate();
            return cfg;
        }
        if (!root.isObject()) {
            throw new IllegalStateException("Config root must be JSON object: " + source);
        }

        PhonologyConfig cfg = mapper.treeToValue(root, PhonologyConfig.class);
        if (cfg == null) cfg = new PhonologyConfig();

        for (String warning : missingFields(root)) {
            log.warn("Config {}: {}", source, warning);
        }

        cfg.validate();
        return cfg;
    }

    /**
     * Missing-field report. A missing section is reported once, its children are skipped.
     * Package-private for tests.
     */
    static List<String> missingFields(JsonNode root) {
        PhonologyConfig probe = new PhonologyConfig();
        probe.validate();

        ArrayList<String> out = new ArrayList<>();
        walk(probe, "", root, out, 0);
        return out;
    }

    private static void walk(Object probe, String base, JsonNode root, List<String> out, int depth) {
        if (probe == null || depth > 8) return;

        for (Field f : probe.getClass().getDeclaredFields()) {
            int m = f.getModifiers();
            if (Modifier.isStatic(m) || Modifier.isTransient(m) || f.isSynthetic()) continue;

            String pointer = base + "/" + jsonNameOf(f);
            Object v = valueOf(probe, f);
            boolean scalar = isScalar(f.getType());

            if (root.at(pointer).isMissingNode()) {
                out.add(scalar
                        ? "missing field " + pointer + " -> fallback to default: " + pretty(v)
                        : "missing section " + pointer + " -> fallback to default: {...}");
                continue;
            }
            if (!scalar) walk(v, pointer, root, out, depth + 1);
        }
    }

    private static String jsonNameOf(Field f) {
        JsonProperty jp = f.getAnnotation(JsonProperty.class);
        if (jp != null && jp.value() != null && !jp.value().isBlank()) return jp.value();
        return f.getName();
    }

    private static Object valueOf(Object obj, Field f) {
        try {
            if (!f.canAccess(obj)) f.setAccessible(true);
            return f.get(obj);
        } catch (IllegalAccessException | RuntimeException e) {
            return null;
        }
    }

    private static boolean isScalar(Class<?> t) {
        return t.isPrimitive() || t.isEnum() || t == String.class
                || Number.class.isAssignableFrom(t) || t == Boolean.class;
    }

    private static String pretty(Object v) {
        if (v == null) return "null";
        if (v instanceof String s) return "\"" + s + "\"";
        return String.valueOf(v);
    }
}
