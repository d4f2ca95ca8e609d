package com.mocha.supporters.sync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.assets.AssetStorageException;
import com.mocha.supporters.sync.model.SupporterDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Writes the dataset as pretty-printed JSON for the documentation build, when an export path is set.
 */
@Component
public class SupporterDatasetExporter {
    private static final Logger log = LoggerFactory.getLogger(SupporterDatasetExporter.class);

    private final SupportersProperties properties;
    private final ObjectMapper objectMapper;

    public SupporterDatasetExporter(SupportersProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public Optional<Path> export(SupporterDataset dataset) {
        if (!properties.getExport().isEnabled()) {
            return Optional.empty();
        }
        Path target = resolvePath(properties.getExport().getPath());
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), dataset);
        } catch (IOException e) {
            throw new AssetStorageException("Unable to export supporters to " + target, e);
        }
        log.info("Exported {} supporters to {}", dataset.totalCount(), target);
        return Optional.of(target);
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath.trim());
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
