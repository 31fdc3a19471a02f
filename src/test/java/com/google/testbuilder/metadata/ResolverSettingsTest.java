package com.google.testbuilder.metadata;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResolverSettingsTest {

    @Test
    void defaults_leaveRunnerDefaultsInPlace() {
        ResolverSettings settings = ResolverSettings.defaults();

        assertEquals("default", settings.defaultGroup());
        assertFalse(settings.processIsolation());
        assertEquals(Optional.empty(), settings.backupGlobals());
        assertEquals(Optional.empty(), settings.backupStaticAttributes());
        assertEquals(Optional.empty(), settings.preserveGlobalState());
    }

    @Test
    void fromPropertiesFile_readsEveryKey() {
        ResolverSettings settings = ResolverSettings.fromPropertiesFile(Path.of("src/test/resources/testbuilder.properties"));

        assertEquals("unit", settings.defaultGroup());
        assertTrue(settings.processIsolation());
        assertEquals(Optional.of(false), settings.backupGlobals());
        assertEquals(Optional.empty(), settings.backupStaticAttributes());
        assertEquals(Optional.of(true), settings.preserveGlobalState());
    }

    @Test
    void fromPropertiesFile_invalidBoolean_throwsIllegalStateException() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> ResolverSettings.fromPropertiesFile(Path.of("src/test/resources/testbuilder-invalid.properties")));

        assertEquals("testbuilder.backupStaticAttributes must be true or false but was 'yes'", e.getMessage());
    }

    @Test
    void fromPropertiesFile_missingFile_throwsIllegalStateException() {
        assertThrows(IllegalStateException.class,
                () -> ResolverSettings.fromPropertiesFile(Path.of("src/test/resources/does-not-exist.properties")));
    }

    @Test
    void fromProperties_blankDefaultGroup_keepsDefault() {
        Properties properties = new Properties();
        properties.setProperty(ResolverSettings.DEFAULT_GROUP, "  ");

        assertEquals("default", ResolverSettings.fromProperties(properties).defaultGroup());
    }

    @Test
    void builder_emptyDefaultGroup_throwsIllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> new ResolverSettings.Builder().withDefaultGroup(""));
    }
}
