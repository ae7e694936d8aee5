package net.spookly.i2ptunnel.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands environment references in raw YAML values: a whole value {@code env:NAME}, or
 * {@code ${NAME}} / {@code ${NAME:-fallback}} placeholders inside a string.
 */
final class EnvExpander {
    private static final String ENV_PREFIX = "env:";
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::-([^}]*))?}");

    private EnvExpander() {
    }

    static Object expand(Object value) {
        return expand(value, System::getenv);
    }

    static Object expand(Object value, Function<String, String> environment) {
        if (value instanceof Map) {
            Map<Object, Object> expanded = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                expanded.put(entry.getKey(), expand(entry.getValue(), environment));
            }
            return expanded;
        }
        if (value instanceof List) {
            List<?> raw = (List<?>) value;
            List<Object> expanded = new ArrayList<>(raw.size());
            for (Object item : raw) {
                expanded.add(expand(item, environment));
            }
            return expanded;
        }
        if (value instanceof String) {
            return expandString((String) value, environment);
        }
        return value;
    }

    private static String expandString(String raw, Function<String, String> environment) {
        if (raw.startsWith(ENV_PREFIX)) {
            String key = raw.substring(ENV_PREFIX.length()).trim();
            String envValue = environment.apply(key);
            if (envValue == null) {
                throw new ConfigException("Missing required environment variable: " + key);
            }
            return envValue;
        }
        if (raw.indexOf("${") < 0) {
            return raw;
        }
        Matcher matcher = PLACEHOLDER.matcher(raw);
        StringBuilder builder = new StringBuilder();
        while (matcher.find()) {
            String key = matcher.group(1);
            String fallback = matcher.group(2);
            String envValue = environment.apply(key);
            if (envValue == null) {
                if (fallback == null) {
                    throw new ConfigException("Missing required environment variable: " + key);
                }
                envValue = fallback;
            }
            matcher.appendReplacement(builder, Matcher.quoteReplacement(envValue));
        }
        matcher.appendTail(builder);
        return builder.toString();
    }
}
