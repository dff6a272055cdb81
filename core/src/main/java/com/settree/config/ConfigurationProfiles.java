/**
 * Set Tree Library
 * Copyright (c) 2026 Set Tree Project.
 * All rights reserved.
 */

package com.settree.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Table;

import com.settree.SetsConfigurationException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Named set configurations read from a properties file. Keys that appear
 * before any section form the global configuration; a line of the form
 * {@code [name]} starts a named profile whose unspecified keys are taken
 * from the global configuration.
 *
 * <pre>
 * row.terminator = ","
 * auto.wrap.braces = true
 *
 * [records]
 * field.terminator = ";"
 * row.terminator = "|"
 * ignore.empty.fields = true
 * </pre>
 *
 * <p>Values may be enclosed in double quotes to keep surrounding blanks.
 * Outside quotes a {@code #} starts a comment.</p>
 */
public final class ConfigurationProfiles {
    private static final Logger logger = Logger.getLogger(ConfigurationProfiles.class.getName());

    public static final String FIELD_TERMINATOR = "field.terminator";
    public static final String ROW_TERMINATOR = "row.terminator";
    public static final String IGNORE_EMPTY_FIELDS = "ignore.empty.fields";
    public static final String AUTO_WRAP_BRACES = "auto.wrap.braces";

    private final SetsConfiguration global;
    private final ImmutableMap<String, SetsConfiguration> profiles;

    private ConfigurationProfiles(SetsConfiguration global, ImmutableMap<String, SetsConfiguration> profiles) {
        this.global = global;
        this.profiles = profiles;
    }

    /**
     * Create profiles from the given global settings and the table of
     * (profile, key, value) settings.
     *
     * @throws SetsConfigurationException if any profile is invalid
     */
    public static ConfigurationProfiles of(Map<String, String> global, Table<String, String, String> profiles) {
        checkNotNull(global, "global");
        checkNotNull(profiles, "profiles");

        SetsConfiguration base = configure("global", SetsConfiguration.builder(), global);
        ImmutableMap.Builder<String, SetsConfiguration> named = ImmutableMap.builder();
        for (String name : profiles.rowKeySet()) {
            named.put(name, configure(name, base.toBuilder(), profiles.row(name)));
        }
        return new ConfigurationProfiles(base, named.build());
    }

    /**
     * Reads profiles from the input character stream.
     *
     * @throws IOException if an error occurred when reading from the input stream
     * @throws SetsConfigurationException if any profile is invalid
     */
    public static ConfigurationProfiles load(Reader reader) throws IOException {
        LoadingProperties props = new LoadingProperties();
        props.load(reader);
        return props.build();
    }

    /**
     * Reads profiles from the input byte stream, which is assumed to use the
     * ISO 8859-1 character encoding.
     *
     * @throws IOException if an error occurred when reading from the input stream
     * @throws SetsConfigurationException if any profile is invalid
     */
    public static ConfigurationProfiles load(InputStream stream) throws IOException {
        LoadingProperties props = new LoadingProperties();
        props.load(stream);
        return props.build();
    }

    /**
     * Returns the global configuration.
     */
    public SetsConfiguration global() {
        return global;
    }

    /**
     * Returns the named profile.
     *
     * @throws NoSuchElementException if there is no such profile
     */
    public SetsConfiguration get(String name) {
        return lookup(name).orElseThrow(() ->
            new NoSuchElementException("No configuration profile named " + name));
    }

    public Optional<SetsConfiguration> lookup(String name) {
        return Optional.ofNullable(profiles.get(checkNotNull(name, "name")));
    }

    public Set<String> names() {
        return profiles.keySet();
    }

    private static SetsConfiguration configure(String profile, SetsConfiguration.Builder builder,
                                               Map<String, String> settings) {
        settings.forEach((key, value) -> {
            switch (key) {
            case FIELD_TERMINATOR:
                builder.fieldTerminator(value);
                break;
            case ROW_TERMINATOR:
                builder.rowTerminator(value);
                break;
            case IGNORE_EMPTY_FIELDS:
                builder.ignoreEmptyFields(parseBoolean(profile, key, value));
                break;
            case AUTO_WRAP_BRACES:
                builder.autoWrapBraces(parseBoolean(profile, key, value));
                break;
            default:
                logger.config(() -> "Unknown key '" + key + "' in configuration profile " + profile);
            }
        });

        try {
            return builder.build();
        } catch (SetsConfigurationException ex) {
            throw new SetsConfigurationException(
                "Invalid configuration profile '" + profile + "'.", ex.getMessage(), ex);
        }
    }

    private static boolean parseBoolean(String profile, String key, String value) {
        if ("true".equalsIgnoreCase(value))
            return true;
        if ("false".equalsIgnoreCase(value))
            return false;
        throw new SetsConfigurationException(
            "Invalid configuration profile '" + profile + "'.",
            "The value of " + key + " must be true or false, but was '" + value + "'.");
    }

    @SuppressWarnings("serial")
    static class LoadingProperties extends Properties {
        private final Map<String, String> global = new HashMap<>();
        private final Map<String, Map<String, String>> sections = new HashMap<>();
        private Map<String, String> current = global;

        /**
         * Overridden to handle property sections.
         */
        @Override
        public synchronized Object put(Object key, Object value) {
            if (key instanceof String && value instanceof String) {
                String skey = (String)key;
                if (skey.startsWith("[") && skey.endsWith("]")) {
                    skey = skey.substring(1, skey.length() - 1).trim();
                    current = sections.computeIfAbsent(skey, x -> new HashMap<>());
                } else {
                    current.put(skey, unquote((String)value));
                }
            }
            return null;
        }

        private static final Pattern QUOTED_STRING = Pattern.compile("\"(.*)\"\\s*(#.*)?");

        static String unquote(String val) {
            Matcher m = QUOTED_STRING.matcher(val);
            if (m.matches()) {
                val = m.group(1);
            } else {
                int i = val.indexOf('#');
                if (i != -1) {
                    val = val.substring(0, i);
                }
                val = val.trim();
            }
            return val;
        }

        ConfigurationProfiles build() {
            SetsConfiguration base = configure("global", SetsConfiguration.builder(), global);
            ImmutableMap.Builder<String, SetsConfiguration> named = ImmutableMap.builder();
            sections.forEach((name, settings) ->
                named.put(name, configure(name, base.toBuilder(), settings)));
            ConfigurationProfiles result = new ConfigurationProfiles(base, named.build());
            logger.config(() -> "Loaded configuration profiles " + result);
            return result;
        }
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("global", global)
            .add("profiles", profiles)
            .toString();
    }
}
