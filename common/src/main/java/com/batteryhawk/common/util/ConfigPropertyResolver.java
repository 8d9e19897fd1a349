/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.common.util;

import com.batteryhawk.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${key}} and {@code ${key:defaultValue}} placeholders inside configuration
 * values, so that secrets such as broker passwords can stay out of the JSON files.
 *
 * <p>Resolution order:</p>
 * <ol>
 *   <li><strong>JVM system properties</strong> ({@code -Dkey=value})</li>
 *   <li><strong>Environment variables</strong></li>
 *   <li><strong>Default value</strong> after the colon</li>
 *   <li>Otherwise a {@link ConfigurationException}</li>
 * </ol>
 *
 * <p>Use {@code \:} to keep a literal colon inside a default, e.g.
 * {@code ${broker.url:tcp\://localhost\:1883}}.</p>
 */
public class ConfigPropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigPropertyResolver.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Properties systemProperties;
    private final UnaryOperator<String> environment;

    public ConfigPropertyResolver() {
        this(System.getProperties(), System::getenv);
    }

    public ConfigPropertyResolver(Properties systemProperties, UnaryOperator<String> environment) {
        this.systemProperties = systemProperties != null ? systemProperties : new Properties();
        this.environment = environment;
    }

    /**
     * Resolve every placeholder in a single string value.
     *
     * @throws ConfigurationException if a placeholder has no value and no default
     */
    public String resolve(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolveExpression(matcher.group(1))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /** Recursively resolve all string values of a config tree, in place. */
    @SuppressWarnings("unchecked")
    public void resolveMap(Map<String, Object> map) {
        if (map == null) return;
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Object val = entry.getValue();
            if (val instanceof String s) {
                entry.setValue(resolve(s));
            } else if (val instanceof Map) {
                resolveMap((Map<String, Object>) val);
            } else if (val instanceof List) {
                resolveList((List<Object>) val);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void resolveList(List<Object> list) {
        for (int i = 0; i < list.size(); i++) {
            Object val = list.get(i);
            if (val instanceof String s) {
                list.set(i, resolve(s));
            } else if (val instanceof Map) {
                resolveMap((Map<String, Object>) val);
            } else if (val instanceof List) {
                resolveList((List<Object>) val);
            }
        }
    }

    private String resolveExpression(String expr) {
        String key = expr.trim();
        String defaultValue = null;
        int colonIdx = findUnescapedColon(expr);
        if (colonIdx >= 0) {
            key = expr.substring(0, colonIdx).trim();
            defaultValue = expr.substring(colonIdx + 1).replace("\\:", ":");
        }

        String val = systemProperties.getProperty(key);
        if (val != null) {
            log.debug("Resolved ${{}} from system property", key);
            return val;
        }
        val = environment.apply(key);
        if (val != null) {
            log.debug("Resolved ${{}} from environment", key);
            return val;
        }
        if (defaultValue != null) {
            return defaultValue;
        }
        throw new ConfigurationException("Cannot resolve configuration placeholder ${" + key + "}. "
                + "Set -D" + key + "=value, export " + key + ", or give an inline default ${" + key + ":value}");
    }

    private int findUnescapedColon(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            if (expr.charAt(i) == ':' && (i == 0 || expr.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }
}
