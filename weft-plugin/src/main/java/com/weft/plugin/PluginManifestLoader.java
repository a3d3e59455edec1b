package com.weft.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@link PluginDescriptor} manifests from {@code *.json} files in a directory. Each file
 * holds either one descriptor object or an array of them. Files are read in name order; a file
 * that cannot be parsed is logged and skipped so one broken manifest does not hide the rest.
 */
public final class PluginManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginManifestLoader.class);

    private final ObjectMapper mapper;

    public PluginManifestLoader() {
        this(new ObjectMapper());
    }

    public PluginManifestLoader(ObjectMapper mapper) {
        this.mapper = mapper != null ? mapper : new ObjectMapper();
    }

    /**
     * Loads every descriptor found in the directory.
     *
     * @param manifestDir directory containing {@code *.json} manifests; missing directory = empty list
     * @return descriptors in file-name order, then in array order within a file
     */
    public List<PluginDescriptor> loadDirectory(Path manifestDir) {
        List<PluginDescriptor> out = new ArrayList<>();
        if (manifestDir == null || !Files.isDirectory(manifestDir)) {
            log.debug("Manifest directory not found: {}", manifestDir);
            return out;
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(manifestDir, "*.json")) {
            for (Path p : stream) {
                files.add(p);
            }
        } catch (IOException e) {
            log.warn("Failed to list manifest directory {}: {}", manifestDir, e.getMessage());
            return out;
        }
        files.sort(null);
        for (Path file : files) {
            try {
                out.addAll(loadFile(file));
            } catch (IOException | IllegalArgumentException e) {
                log.error("Invalid plugin manifest file={} (skipping): {}", file.getFileName(), e.getMessage());
            }
        }
        log.info("Loaded {} plugin descriptor(s) from {}", out.size(), manifestDir);
        return out;
    }

    /**
     * Reads one manifest file.
     *
     * @throws IOException if the file cannot be read or is not valid descriptor JSON
     */
    public List<PluginDescriptor> loadFile(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    /**
     * Parses manifest JSON: a single descriptor object or an array of descriptors.
     *
     * @throws JsonProcessingException if the JSON is malformed or a descriptor is invalid
     */
    public List<PluginDescriptor> parse(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        List<PluginDescriptor> out = new ArrayList<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return out;
        }
        if (root.isArray()) {
            for (JsonNode node : root) {
                out.add(mapper.treeToValue(node, PluginDescriptor.class));
            }
        } else {
            out.add(mapper.treeToValue(root, PluginDescriptor.class));
        }
        return out;
    }
}
