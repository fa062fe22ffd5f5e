package com.vtb.posture.service;

import com.vtb.posture.models.AuthMethod;
import com.vtb.posture.models.EndpointConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class YamlEndpointConfigSourceTest {

    private final YamlEndpointConfigSource source =
        new YamlEndpointConfigSource(Path.of("src/test/resources/fixtures/endpoints.yaml"));

    @Test
    void loadsValidEndpointsAndSkipsBrokenOnes() {
        List<EndpointConfig> configs = source.findAll();

        assertEquals(2, configs.size());
        assertEquals("payments", configs.get(0).getId());
        assertEquals("Payments API", configs.get(0).getName());
        assertEquals("legacy", configs.get(1).getId());
    }

    @Test
    void mapsNestedRulesAndAuthAliases() {
        EndpointConfig payments = source.findById("payments").orElseThrow();
        assertEquals(AuthMethod.MTLS, payments.getAuthMethod());
        assertEquals(6000.0, payments.getThrottling().ratePerHour());
        assertTrue(payments.getQuota().active());
        assertTrue(payments.getAllowedHours().restricted());
        assertEquals(List.of("10.0.0.0/8"), payments.getWhitelist());

        EndpointConfig legacy = source.findById("legacy").orElseThrow();
        assertEquals(AuthMethod.API_KEY, legacy.getAuthMethod());
        assertFalse(legacy.getClientSsl());
        assertNull(legacy.getBackendSsl());
        assertEquals("UTC", legacy.getTimeZone());
    }

    @Test
    void unknownIdIsEmpty() {
        assertTrue(source.findById("nope").isEmpty());
        assertTrue(source.findById(null).isEmpty());
    }

    @Test
    void acceptsPlainListRoot(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("endpoints.json");
        Files.writeString(file, "[{\"id\":\"a\",\"authMethod\":\"oauth2\"},{\"id\":\"b\"}]", StandardCharsets.UTF_8);

        List<EndpointConfig> configs = new YamlEndpointConfigSource(file).findAll();
        assertEquals(2, configs.size());
        assertEquals(AuthMethod.OAUTH, configs.get(0).getAuthMethod());
    }

    @Test
    void missingFileFailsLoudly(@TempDir Path tempDir) {
        YamlEndpointConfigSource missing = new YamlEndpointConfigSource(tempDir.resolve("none.yaml"));
        assertThrows(IllegalStateException.class, missing::findAll);
    }
}
