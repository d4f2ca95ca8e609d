package com.mocha.supporters.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.model.ImageDimensions;
import com.mocha.supporters.sync.model.Supporter;
import com.mocha.supporters.sync.model.SupporterDataset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SupporterDatasetExporterTest {
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @TempDir
    Path tempDir;

    @Test
    void skipsExportWhenNoPathConfigured() {
        SupporterDatasetExporter exporter = new SupporterDatasetExporter(new SupportersProperties(), objectMapper);

        assertThat(exporter.export(new SupporterDataset(List.of(), List.of(), Instant.now()))).isEmpty();
    }

    @Test
    void writesBothBucketsAsJson() throws Exception {
        SupportersProperties properties = new SupportersProperties();
        Path target = tempDir.resolve("data").resolve("supporters.json");
        properties.getExport().setPath(target.toString());
        SupporterDatasetExporter exporter = new SupporterDatasetExporter(properties, objectMapper);
        Supporter sponsor = new Supporter(
            "id-acme", "Acme", "acme", "https://acme.example", "m", "s", "ORGANIZATION", 12500,
            Instant.parse("2019-05-01T10:00:00Z"), "m", "id-acme.png", new ImageDimensions(64, 64)
        );
        Supporter backer = new Supporter(
            "id-jane", "Jane", "jane", null, "m", "s", "INDIVIDUAL", 5000,
            Instant.parse("2019-06-01T10:00:00Z"), "s", "id-jane.png", null
        );

        Optional<Path> written = exporter.export(new SupporterDataset(List.of(sponsor), List.of(backer), Instant.now()));

        assertThat(written).contains(target);
        JsonNode root = objectMapper.readTree(target.toFile());
        assertThat(root.path("sponsors").get(0).path("slug").asText()).isEqualTo("acme");
        assertThat(root.path("sponsors").get(0).path("totalDonations").asLong()).isEqualTo(12500L);
        assertThat(root.path("sponsors").get(0).path("dimensions").path("width").asInt()).isEqualTo(64);
        assertThat(root.path("sponsors").get(0).path("firstDonation").asText()).isEqualTo("2019-05-01T10:00:00Z");
        assertThat(root.path("backers").get(0).path("avatarFile").asText()).isEqualTo("id-jane.png");
    }
}
