package com.vtb.posture.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.posture.models.ScoreReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportGeneratorTest {

    private final JsonReportGenerator generator = new JsonReportGenerator();

    @Test
    void writesIsoDatesAndAllSections() throws Exception {
        ScoreReport report = ReportFixtures.weakReport();
        JsonNode json = new ObjectMapper().readTree(generator.toJson(report));

        assertEquals("legacy", json.path("endpointId").asText());
        assertEquals("2024-03-08T06:30:00Z", json.path("generatedAt").asText());
        assertEquals("2024-03-01", json.path("timeRange").path("start").asText());

        JsonNode result = json.path("result");
        assertEquals(report.getResult().getOverallScore(), result.path("overallScore").asDouble());
        assertEquals(9, result.path("components").size());
        assertEquals("IP_WHITELIST", result.path("components").get(0).path("component").asText());
        assertEquals(24, result.path("trafficStats").path("hourlyCounts").size());
        assertTrue(result.path("sensitiveData").path("matchingEntries").asLong() > 0);
        assertEquals(report.getResult().getRecommendations().size(), result.path("recommendations").size());
    }

    @Test
    void sameReportGivesSameBytes() throws Exception {
        ScoreReport report = ReportFixtures.weakReport();
        assertEquals(generator.toJson(report), generator.toJson(ReportFixtures.weakReport()));
    }

    @Test
    void generatesFileWithConventionalName(@TempDir Path tempDir) throws Exception {
        ScoreReport report = ReportFixtures.strongReport();
        String name = generator.fileNameFor(report);
        assertEquals("posture-payments-2024-03-01_2024-03-07.json", name);

        Path file = tempDir.resolve(name);
        generator.generate(report, file);
        ScoreReport read = JsonReportGenerator.createMapper().readValue(file.toFile(), ScoreReport.class);
        assertEquals(report, read);
    }
}
