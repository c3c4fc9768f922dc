package work.lcod.scriptgen.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import work.lcod.scriptgen.graph.Block;
import work.lcod.scriptgen.graph.Connection;
import work.lcod.scriptgen.graph.ContainerKind;
import work.lcod.scriptgen.graph.GraphSnapshot;
import work.lcod.scriptgen.graph.Parameter;
import work.lcod.scriptgen.graph.ParamType;
import work.lcod.scriptgen.graph.Port;
import work.lcod.scriptgen.graph.PortDirection;
import work.lcod.scriptgen.graph.PortType;

/**
 * Reads a graph document (YAML or JSON) into a {@link GraphSnapshot}.
 *
 * <pre>
 * blocks:
 *   - id: a1b2c3d4
 *     title: Get-Process
 *     command: Get-Process
 *     parameters:
 *       - { name: Name, type: String, value: "pwsh" }
 *   - id: f00dcafe
 *     title: If / Else
 *     container: IfElse
 *     parameters: [ { name: Condition, type: ScriptBlock, value: "$_.CPU -gt 10" } ]
 *     zones:
 *       - { name: Then, children: [ c0ffee00 ] }
 * connections:
 *   - { source: a1b2c3d4, target: f00dcafe }
 * </pre>
 *
 * Port names default to {@code Out}/{@code In}. Dangling references are left to snapshot validation.
 */
public final class GraphDocumentLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private GraphDocumentLoader() {}

    public static GraphSnapshot loadFromFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (JsonProcessingException ex) {
            throw new GraphFormatException("invalid_document", "Unreadable graph document " + path + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read graph document: " + path, ex);
        }
    }

    public static GraphSnapshot parse(String document) {
        try {
            return fromTree(YAML_MAPPER.readTree(document));
        } catch (JsonProcessingException ex) {
            throw new GraphFormatException("invalid_document", "Unreadable graph document: " + ex.getOriginalMessage(), ex);
        }
    }

    static GraphSnapshot parse(InputStream in) throws IOException {
        return fromTree(YAML_MAPPER.readTree(in));
    }

    private static GraphSnapshot fromTree(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return GraphSnapshot.empty();
        }
        if (!root.isObject()) {
            throw new GraphFormatException("invalid_document", "Graph document must be an object");
        }
        var blocks = new ArrayList<Block>();
        for (var node : array(root, "blocks")) {
            blocks.add(toBlock(node));
        }
        var connections = new ArrayList<Connection>();
        for (var node : array(root, "connections")) {
            connections.add(toConnection(node));
        }
        return GraphSnapshot.of(blocks, connections);
    }

    private static Block toBlock(JsonNode node) {
        if (!node.isObject()) {
            throw new GraphFormatException("invalid_block", "Block entry must be an object: " + node);
        }
        var id = text(node, "id");
        if (id.isBlank()) {
            throw new GraphFormatException("invalid_block", "Block entry is missing an id: " + node);
        }
        var parameters = new ArrayList<Parameter>();
        for (var param : array(node, "parameters")) {
            parameters.add(toParameter(id, param));
        }

        ContainerKind container;
        try {
            container = ContainerKind.fromDeclaration(text(node, "container"), parameters);
        } catch (IllegalArgumentException ex) {
            throw new GraphFormatException("invalid_block", "Block '" + id + "': " + ex.getMessage(), ex);
        }

        var builder = Block.builder(id)
            .title(text(node, "title"))
            .category(text(node, "category"))
            .command(text(node, "command"))
            .script(text(node, "script"))
            .outputVariable(text(node, "outputVariable"))
            .parameters(parameters)
            .container(container);
        for (var zone : array(node, "zones")) {
            var children = new ArrayList<String>();
            for (var child : array(zone, "children")) {
                children.add(child.asText());
            }
            builder.zone(text(zone, "name"), children);
        }
        if (node.has("inputs")) {
            builder.inputs(toPorts(id, node, "inputs", PortDirection.INPUT));
        }
        if (node.has("outputs")) {
            builder.outputs(toPorts(id, node, "outputs", PortDirection.OUTPUT));
        }
        return builder.build();
    }

    private static Parameter toParameter(String blockId, JsonNode node) {
        var name = text(node, "name");
        if (name.isBlank()) {
            throw new GraphFormatException("invalid_parameter", "Block '" + blockId + "' has a parameter without a name");
        }
        try {
            return new Parameter(name, ParamType.from(text(node, "type")), text(node, "value"), text(node, "default"));
        } catch (IllegalArgumentException ex) {
            throw new GraphFormatException("invalid_parameter", "Block '" + blockId + "': " + ex.getMessage(), ex);
        }
    }

    private static List<Port> toPorts(String blockId, JsonNode node, String field, PortDirection direction) {
        var ports = new ArrayList<Port>();
        for (var port : array(node, field)) {
            var name = port.isTextual() ? port.asText() : text(port, "name");
            if (name.isBlank()) {
                throw new GraphFormatException("invalid_port", "Block '" + blockId + "' declares a port without a name");
            }
            try {
                var type = port.isTextual() ? PortType.PIPELINE : PortType.from(text(port, "type"));
                ports.add(new Port(name, direction, type));
            } catch (IllegalArgumentException ex) {
                throw new GraphFormatException("invalid_port", "Block '" + blockId + "': " + ex.getMessage(), ex);
            }
        }
        return ports;
    }

    private static Connection toConnection(JsonNode node) {
        var source = text(node, "source");
        var target = text(node, "target");
        if (source.isBlank() || target.isBlank()) {
            throw new GraphFormatException("invalid_connection", "Connection needs both source and target: " + node);
        }
        return new Connection(source, text(node, "sourcePort"), target, text(node, "targetPort"));
    }

    private static Iterable<JsonNode> array(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new GraphFormatException("invalid_document", "'" + field + "' must be a list");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.asText();
    }
}
