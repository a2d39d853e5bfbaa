package com.soundbank.generator.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soundbank.generator.model.LoadedBank;
import com.soundbank.generator.model.SourceNode;
import com.soundbank.generator.model.TreeNode;

/**
 * Loads a bank dump (the parsed bank tree serialized as JSON) into a {@link LoadedBank}.
 *
 * Expected shape:
 * <pre>
 * { "bankId": 123, "filename": "Music.bnk", "items": [ node, ... ] }
 * node = { "name": "...", "type": "sid", "value": 10, "attrs": {"hashname": "..."}, "children": [ node, ... ] }
 * </pre>
 * Only {@code name} is required on a node.
 */
public class BankDumpParser {
    private static final Logger log = LoggerFactory.getLogger(BankDumpParser.class);

    private final ObjectMapper mapper;

    public BankDumpParser() {
        this(new ObjectMapper());
    }

    public BankDumpParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Parse every dump in the given order; the order is the bank load order.
     */
    public List<LoadedBank> parseAll(List<Path> dumps) throws IOException {
        List<LoadedBank> banks = new ArrayList<>();
        for (Path dump : dumps) {
            banks.add(parse(dump));
        }
        return banks;
    }

    public LoadedBank parse(Path dump) throws IOException {
        Objects.requireNonNull(dump, "dump");
        if (!Files.isRegularFile(dump)) {
            throw new BankLoadException(dump, "bank dump not found");
        }

        JsonNode root;
        try {
            root = mapper.readTree(dump.toFile());
        } catch (JsonProcessingException e) {
            throw new BankLoadException(dump, "invalid JSON (" + e.getOriginalMessage() + ")", e);
        }
        if (root == null || !root.isObject()) {
            throw new BankLoadException(dump, "root must be an object");
        }

        JsonNode bankId = root.get("bankId");
        if (bankId == null || !bankId.canConvertToLong()) {
            throw new BankLoadException(dump, "missing numeric 'bankId'");
        }

        String filename = root.hasNonNull("filename")
                ? root.get("filename").asText()
                : dump.getFileName().toString();

        LoadedBank.LoadedBankBuilder bank = LoadedBank.builder()
                .bankId(bankId.asLong())
                .filename(filename);

        JsonNode items = root.get("items");
        if (items != null && !items.isNull()) {
            if (!items.isArray()) {
                throw new BankLoadException(dump, "'items' must be an array");
            }
            for (JsonNode item : items) {
                bank.item(toNode(dump, item));
            }
        }

        LoadedBank loaded = bank.build();
        log.info("Loaded bank {} ({}): {} items", loaded.getFilename(), loaded.getBankId(), loaded.getItems().size());
        return loaded;
    }

    private SourceNode toNode(Path dump, JsonNode json) throws BankLoadException {
        if (!json.isObject() || !json.hasNonNull("name")) {
            throw new BankLoadException(dump, "node without 'name': " + json);
        }

        TreeNode.TreeNodeBuilder node = TreeNode.builder()
                .name(json.get("name").asText());

        if (json.hasNonNull("type")) {
            node.type(json.get("type").asText());
        }
        if (json.hasNonNull("value")) {
            node.value(toScalar(json.get("value")));
        }

        JsonNode attrs = json.get("attrs");
        if (attrs != null && attrs.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = attrs.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                node.attr(field.getKey(), field.getValue().asText());
            }
        }

        JsonNode children = json.get("children");
        if (children != null && children.isArray()) {
            for (JsonNode child : children) {
                node.child(toNode(dump, child));
            }
        }
        return node.build();
    }

    private Object toScalar(JsonNode value) {
        if (value.isIntegralNumber()) {
            return value.asLong();
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return value.asText();
    }
}
