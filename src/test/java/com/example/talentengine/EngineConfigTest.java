package com.example.talentengine;

import com.example.talentengine.util.EngineConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for config resolution order.
 */
@DisplayName("EngineConfig Tests")
public class EngineConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("talentengine.abilities");
    }

    @Test
    @DisplayName("Values come from the YAML resource, nested keys flattened")
    void fromYaml() {
        EngineConfig config = EngineConfig.load("/testdata/engine.yaml");
        assertEquals("/testdata/abilities.yaml", config.getAbilitiesResource());
        assertEquals("jdbc:h2:mem:engineconfigtest;DB_CLOSE_DELAY=-1", config.getDbUrl());
        // not in the file, falls back to the default
        assertEquals("sa", config.getDbUser());
    }

    @Test
    @DisplayName("Missing resource falls back to defaults")
    void defaults() {
        EngineConfig config = EngineConfig.load("/testdata/missing.yaml");
        assertEquals("/data/abilities.yaml", config.getAbilitiesResource());
        assertEquals("", config.getDbPassword());
    }

    @Test
    @DisplayName("System properties override the file")
    void systemPropertyOverride() {
        System.setProperty("talentengine.abilities", "/other.yaml");
        EngineConfig config = EngineConfig.load("/testdata/engine.yaml");
        assertEquals("/other.yaml", config.getAbilitiesResource());
    }

    @Test
    @DisplayName("Environment variable names do not depend on the default locale")
    void envNameIgnoresLocale() {
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("TALENTENGINE_ABILITIES", EngineConfig.envName(EngineConfig.KEY_ABILITIES));
            assertEquals("TALENTENGINE_DB_URL", EngineConfig.envName(EngineConfig.KEY_DB_URL));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
