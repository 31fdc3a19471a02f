package com.google.testbuilder.metadata;
/*
Copyright 2025 Google LLC

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    https://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.testbuilder.models.DataProviderTestSuite;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Project-wide defaults for {@link AnnotationMetadataResolver}. Annotations on a test class or
 * method always win over these settings.
 * <p>
 * Recognized properties:
 * <ul>
 * <li>{@code testbuilder.defaultGroup} - group of tests without {@code @Group}, {@code default} if unset</li>
 * <li>{@code testbuilder.processIsolation} - run every test in its own process</li>
 * <li>{@code testbuilder.backupGlobals}</li>
 * <li>{@code testbuilder.backupStaticAttributes}</li>
 * <li>{@code testbuilder.preserveGlobalState}</li>
 * </ul>
 * Boolean properties accept {@code true} or {@code false}. An unset tri-state property leaves the
 * runner default in place.
 */
public final class ResolverSettings {

    public static final String DEFAULT_GROUP = "testbuilder.defaultGroup";
    public static final String PROCESS_ISOLATION = "testbuilder.processIsolation";
    public static final String BACKUP_GLOBALS = "testbuilder.backupGlobals";
    public static final String BACKUP_STATIC_ATTRIBUTES = "testbuilder.backupStaticAttributes";
    public static final String PRESERVE_GLOBAL_STATE = "testbuilder.preserveGlobalState";

    private static final Logger logger = Logger.getLogger(ResolverSettings.class.getName());

    private final String defaultGroup;
    private final boolean processIsolation;
    private final Optional<Boolean> backupGlobals;
    private final Optional<Boolean> backupStaticAttributes;
    private final Optional<Boolean> preserveGlobalState;

    private ResolverSettings(Builder builder) {
        this.defaultGroup = builder.defaultGroup;
        this.processIsolation = builder.processIsolation;
        this.backupGlobals = builder.backupGlobals;
        this.backupStaticAttributes = builder.backupStaticAttributes;
        this.preserveGlobalState = builder.preserveGlobalState;
    }

    public static ResolverSettings defaults() {
        return new Builder().build();
    }

    public static class Builder {
        private String defaultGroup = DataProviderTestSuite.DEFAULT_GROUP;
        private boolean processIsolation = false;
        private Optional<Boolean> backupGlobals = Optional.empty();
        private Optional<Boolean> backupStaticAttributes = Optional.empty();
        private Optional<Boolean> preserveGlobalState = Optional.empty();

        public Builder withDefaultGroup(String defaultGroup) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(defaultGroup), "defaultGroup must not be empty");
            this.defaultGroup = defaultGroup;
            return this;
        }

        public Builder withProcessIsolation(boolean processIsolation) {
            this.processIsolation = processIsolation;
            return this;
        }

        public Builder withBackupGlobals(Boolean backupGlobals) {
            this.backupGlobals = Optional.ofNullable(backupGlobals);
            return this;
        }

        public Builder withBackupStaticAttributes(Boolean backupStaticAttributes) {
            this.backupStaticAttributes = Optional.ofNullable(backupStaticAttributes);
            return this;
        }

        public Builder withPreserveGlobalState(Boolean preserveGlobalState) {
            this.preserveGlobalState = Optional.ofNullable(preserveGlobalState);
            return this;
        }

        public ResolverSettings build() {
            return new ResolverSettings(this);
        }
    }

    /**
     * Reads settings from a properties file.
     *
     * @param propertiesFile path to the file
     * @return the settings
     * @throws IllegalStateException if the file cannot be read or holds an invalid value
     */
    public static ResolverSettings fromPropertiesFile(Path propertiesFile) {
        Preconditions.checkNotNull(propertiesFile, "propertiesFile must not be null");
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(propertiesFile)) {
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Error reading test builder settings from %s: %s".formatted(propertiesFile, e.getMessage()), e);
        }
        logger.info(() -> "Loaded test builder settings from %s".formatted(propertiesFile.toAbsolutePath()));
        return fromProperties(properties);
    }

    public static ResolverSettings fromProperties(Properties properties) {
        Preconditions.checkNotNull(properties, "properties must not be null");
        Builder builder = new Builder()
                .withProcessIsolation(parseBoolean(properties, PROCESS_ISOLATION).orElse(false))
                .withBackupGlobals(parseBoolean(properties, BACKUP_GLOBALS).orElse(null))
                .withBackupStaticAttributes(parseBoolean(properties, BACKUP_STATIC_ATTRIBUTES).orElse(null))
                .withPreserveGlobalState(parseBoolean(properties, PRESERVE_GLOBAL_STATE).orElse(null));
        String group = Strings.emptyToNull(Strings.nullToEmpty(properties.getProperty(DEFAULT_GROUP)).trim());
        if (group != null) {
            builder.withDefaultGroup(group);
        }
        return builder.build();
    }

    private static Optional<Boolean> parseBoolean(Properties properties, String key) {
        String value = Strings.nullToEmpty(properties.getProperty(key)).trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "" -> Optional.empty();
            case "true" -> Optional.of(true);
            case "false" -> Optional.of(false);
            default -> throw new IllegalStateException(
                    "%s must be true or false but was '%s'".formatted(key, properties.getProperty(key)));
        };
    }

    public String defaultGroup() {
        return defaultGroup;
    }

    public boolean processIsolation() {
        return processIsolation;
    }

    public Optional<Boolean> backupGlobals() {
        return backupGlobals;
    }

    public Optional<Boolean> backupStaticAttributes() {
        return backupStaticAttributes;
    }

    public Optional<Boolean> preserveGlobalState() {
        return preserveGlobalState;
    }

    @Override
    public String toString() {
        return "ResolverSettings[defaultGroup=" + defaultGroup
                + ", processIsolation=" + processIsolation
                + ", backupGlobals=" + backupGlobals
                + ", backupStaticAttributes=" + backupStaticAttributes
                + ", preserveGlobalState=" + preserveGlobalState + ']';
    }
}
