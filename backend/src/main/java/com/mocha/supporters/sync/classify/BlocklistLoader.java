package com.mocha.supporters.sync.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Reads the blocklist, a JSON array of slugs, from a Spring resource location
 * such as {@code classpath:blocklist.json} or {@code file:/etc/supporters/blocklist.json}.
 */
@Component
public class BlocklistLoader {
    private static final Logger log = LoggerFactory.getLogger(BlocklistLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public BlocklistLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public Blocklist load(String location) {
        if (location == null || location.isBlank()) {
            log.info("No blocklist configured; nothing will be excluded");
            return Blocklist.empty();
        }
        Resource resource = resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new BlocklistLoadException("Blocklist not found at " + location);
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new BlocklistLoadException("Unable to read blocklist at " + location, e);
        }
        if (root == null || !root.isArray()) {
            throw new BlocklistLoadException("Blocklist at " + location + " must be a JSON array of slugs");
        }
        Set<String> slugs = new LinkedHashSet<>();
        for (JsonNode entry : root) {
            if (entry.isTextual() && !entry.asText().isBlank()) {
                slugs.add(entry.asText().trim());
            }
        }
        log.info("Loaded {} blocklisted slugs from {}", slugs.size(), location);
        return Blocklist.of(slugs);
    }
}
