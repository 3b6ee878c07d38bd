package com.landfall.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads Kubernetes manifests from JSON and YAML files.
 *
 * <p>Directories are walked in path order. Multi-document YAML, top-level JSON arrays
 * and {@code kind: List} wrappers are flattened into individual objects, keeping
 * file order.
 */
@Component
public class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ManifestLoader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public List<KubernetesManifest> load(List<Path> sources) {
        var manifests = new ArrayList<KubernetesManifest>();
        for (var source : sources) {
            for (var file : expand(source)) {
                manifests.addAll(loadFile(file));
            }
        }
        log.info("Loaded {} manifests from {} source(s)", manifests.size(), sources.size());
        return manifests;
    }

    List<KubernetesManifest> loadFile(Path file) {
        var documents = new ArrayList<JsonNode>();
        try {
            if (isYaml(file)) {
                try (var it = yamlMapper.readerFor(JsonNode.class).<JsonNode>readValues(file.toFile())) {
                    while (it.hasNext()) {
                        documents.add(it.next());
                    }
                }
            } else {
                documents.add(jsonMapper.readTree(file.toFile()));
            }
        } catch (IOException e) {
            throw new ManifestLoadException("reading manifest file " + file, e);
        }

        var manifests = new ArrayList<KubernetesManifest>();
        for (var document : documents) {
            flatten(document, file, manifests);
        }
        return manifests;
    }

    private void flatten(JsonNode node, Path file, List<KubernetesManifest> out) {
        if (node == null || node.isNull() || node.isMissingNode() || (node.isObject() && node.isEmpty())) {
            return;
        }
        if (node.isArray()) {
            node.forEach(item -> flatten(item, file, out));
            return;
        }
        if (!node.isObject()) {
            throw new ManifestLoadException("manifest in %s is not an object".formatted(file));
        }
        if ("List".equals(node.path("kind").asText()) && node.has("items")) {
            node.get("items").forEach(item -> flatten(item, file, out));
            return;
        }
        var manifest = new KubernetesManifest(node);
        if (manifest.kind().isEmpty()) {
            throw new ManifestLoadException("manifest in %s has no kind".formatted(file));
        }
        if (manifest.name().isEmpty()) {
            throw new ManifestLoadException("%s manifest in %s has no metadata.name".formatted(manifest.kind(), file));
        }
        out.add(manifest);
    }

    private static List<Path> expand(Path source) {
        if (!Files.exists(source)) {
            throw new ManifestLoadException("manifest source does not exist: " + source);
        }
        if (!Files.isDirectory(source)) {
            return List.of(source);
        }
        try (Stream<Path> walk = Files.walk(source)) {
            return walk.filter(Files::isRegularFile)
                    .filter(ManifestLoader::isManifestFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ManifestLoadException("scanning manifest directory " + source, e);
        }
    }

    private static boolean isManifestFile(Path path) {
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") || isYaml(path);
    }

    private static boolean isYaml(Path path) {
        var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
