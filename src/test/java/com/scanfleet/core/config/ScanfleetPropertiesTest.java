package com.scanfleet.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScanfleetPropertiesTest {

    @Test
    void defaults() {
        var properties = new ScanfleetProperties();

        assertEquals(1, properties.getWorkers());
        assertEquals("repos.txt", properties.getReposFile());
        assertTrue(properties.isConvertToSsh());
        assertEquals(3, properties.getSonar().getMaxRetries());
        assertEquals("sonar-scanner", properties.getSonar().getScannerCommand());
        assertEquals("/api/projects/update", properties.getSonar().getMetadataEndpoint());
    }

    @Test
    void validateNamesEveryMissingValue() {
        var properties = new ScanfleetProperties();

        var ex = assertThrows(MissingConfigurationException.class, properties::validate);

        assertEquals(2, ex.getMissing().size());
        assertTrue(ex.getMessage().contains("SONAR_HOST"));
        assertTrue(ex.getMessage().contains("SONAR_TOKEN"));
    }

    @Test
    void validatePassesWithHostAndToken() {
        var properties = new ScanfleetProperties();
        properties.getSonar().setHost("https://sonar.example.com");
        properties.getSonar().setToken("squ_1");

        assertDoesNotThrow(properties::validate);
    }

    @Test
    void onlyTokenMissing() {
        var properties = new ScanfleetProperties();
        properties.getSonar().setHost("https://sonar.example.com");

        var ex = assertThrows(MissingConfigurationException.class, properties::validate);
        assertEquals(1, ex.getMissing().size());
    }

    @Test
    void overrideLookupByRepositoryName() {
        var properties = new ScanfleetProperties();
        var override = new ScanfleetProperties.RepoOverride();
        override.setWorkdir("app");
        override.setCommands(List.of("npm ci"));
        properties.getOverrides().put("widgets", override);

        assertEquals("app", properties.overrideFor("widgets").workdir());
        assertEquals(List.of("npm ci"), properties.overrideFor("widgets").commands());
        assertFalse(properties.overrideFor("gadgets").hasWorkdir());
        assertTrue(properties.overrideFor("gadgets").commands().isEmpty());
    }
}
