package com.guardrails.engine.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.guardrails.core.exception.GuardrailException;
import com.guardrails.core.json.GuardrailJson;
import com.guardrails.core.model.GuardrailPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads policies from {@code *.yaml}, {@code *.yml} and {@code *.json} files in a directory.
 * A file holds one policy object or a list of them. Declared order is file name, then position in file.
 * Unknown properties are parse errors so that a misspelled key never silently drops a condition.
 */
public class DirectoryPolicySource implements PolicySource {

    private static final Logger log = LoggerFactory.getLogger(DirectoryPolicySource.class);

    private final Path directory;
    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DirectoryPolicySource(Path directory) {
        this.directory = directory;
        this.jsonMapper = strict(new ObjectMapper());
        this.yamlMapper = strict(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper strict(ObjectMapper mapper) {
        return GuardrailJson.configure(mapper)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<PolicyDocument> read() {
        if (!Files.isDirectory(directory)) {
            throw new GuardrailException("POLICY_SOURCE_UNAVAILABLE",
                "Policy directory does not exist: " + directory);
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                .filter(Files::isRegularFile)
                .filter(DirectoryPolicySource::isPolicyFile)
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new GuardrailException("POLICY_SOURCE_UNAVAILABLE",
                "Cannot list policy directory " + directory, e);
        }

        List<PolicyDocument> documents = new ArrayList<>();
        for (Path file : files) {
            documents.addAll(readFile(file));
        }
        log.debug("Read {} policy documents from {} files in {}", documents.size(), files.size(), directory);
        return documents;
    }

    private List<PolicyDocument> readFile(Path file) {
        String name = file.getFileName().toString();
        ObjectMapper mapper = name.toLowerCase(Locale.ROOT).endsWith(".json") ? jsonMapper : yamlMapper;

        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            return List.of(PolicyDocument.unreadable(name, e.getMessage()));
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return List.of(PolicyDocument.unreadable(name, "file is empty"));
        }

        List<JsonNode> nodes = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(nodes::add);
        } else if (root.has("policies") && root.get("policies").isArray()) {
            root.get("policies").forEach(nodes::add);
        } else {
            nodes.add(root);
        }

        List<PolicyDocument> documents = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            String origin = name + "#" + i;
            try {
                documents.add(PolicyDocument.parsed(origin, mapper.treeToValue(nodes.get(i), GuardrailPolicy.class)));
            } catch (IOException | IllegalArgumentException e) {
                documents.add(PolicyDocument.unreadable(origin, e.getMessage()));
            }
        }
        return documents;
    }

    private static boolean isPolicyFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    @Override
    public String describe() {
        return directory.toString();
    }
}
