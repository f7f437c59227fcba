package flowc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;

/**
 * Reads an articy:draft JSON export.
 *
 * <p>Every model of every package becomes a graph node; models carrying a {@code Template} are
 * also collected as entities. The top-level children of the {@code Flow} hierarchy element become
 * the graph's roots.
 */
public final class ExportReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExportReader.class);

  // articy writes the null reference as an all-zero id.
  private static final Pattern NULL_ID = Pattern.compile("(0[xX])?0*");

  private final ObjectMapper mapper;

  public ExportReader() {
    this(new ObjectMapper());
  }

  public ExportReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public FlowExport read(Path file) throws CompilerException {
    JsonNode root;
    try (InputStream in = Files.newInputStream(file)) {
      root = mapper.readTree(in);
    } catch (IOException ex) {
      throw new CompilerException(String.format("cannot read export file %s", file), ex);
    }
    if (root == null || !root.isObject()) {
      throw new CompilerException(String.format("export file %s is not a JSON object", file));
    }
    FlowExport export = read(root);
    LOGGER.info(
        "Read {} nodes and {} entities from {}",
        export.graph().nodes().size(),
        export.entities().size(),
        file);
    return export;
  }

  public FlowExport read(JsonNode root) throws CompilerException {
    FlowGraph.Builder graph = FlowGraph.builder();
    ImmutableList.Builder<Entity> entities = ImmutableList.builder();

    for (JsonNode pkg : root.path("Packages")) {
      for (JsonNode model : pkg.path("Models")) {
        graph.addNode(readNode(model));
        if (model.has("Template")) {
          entities.add(readEntity(model));
        }
      }
    }
    for (JsonNode element : root.path("Hierarchy").path("Children")) {
      if (!text(element, "Type").equals("Flow")) continue;
      for (JsonNode child : element.path("Children")) {
        graph.addRoot(text(child, "Id"));
      }
    }

    return FlowExport.create(
        graph.build(),
        entities.build(),
        readTemplateNames(root.path("ObjectDefinitions")),
        readNamespaces(root.path("GlobalVariables")));
  }

  private static FlowGraph.Node readNode(JsonNode model) throws CompilerException {
    JsonNode props = model.path("Properties");
    String id = text(props, "Id");
    if (id.isEmpty()) {
      throw new CompilerException(
          String.format("model of type '%s' has no id", text(model, "Type")));
    }

    FlowGraph.Node.Builder node =
        FlowGraph.Node.builder(id, text(model, "Type"))
            .setDisplayName(text(props, "DisplayName"))
            .setText(text(props, "Text"))
            .setMenuText(text(props, "MenuText"))
            .setStageDirections(text(props, "StageDirections"))
            .setExpression(text(props, "Expression"));
    reference(props, "Speaker").ifPresent(node::setSpeakerId);
    reference(props, "Parent").ifPresent(node::setParentId);
    reference(props, "Target").ifPresent(node::setJumpTargetId);

    for (JsonNode pin : props.path("InputPins")) {
      node.addInputPin(
          FlowGraph.Pin.create(
              text(pin, "Id"),
              ownerOf(pin, id),
              FlowGraph.Pin.Direction.INPUT,
              text(pin, "Text"),
              readConnections(pin)));
    }
    for (JsonNode pin : props.path("OutputPins")) {
      node.addOutputPin(
          FlowGraph.Pin.create(
              text(pin, "Id"),
              ownerOf(pin, id),
              FlowGraph.Pin.Direction.OUTPUT,
              text(pin, "Text"),
              readConnections(pin)));
    }
    return node.build();
  }

  private static ImmutableList<FlowGraph.Connection> readConnections(JsonNode pin) {
    ImmutableList.Builder<FlowGraph.Connection> connections = ImmutableList.builder();
    for (JsonNode connection : pin.path("Connections")) {
      connections.add(
          FlowGraph.Connection.create(
              text(connection, "Label"),
              text(connection, "Target"),
              text(connection, "TargetPin")));
    }
    return connections.build();
  }

  private static Entity readEntity(JsonNode model) {
    JsonNode props = model.path("Properties");
    ImmutableTable.Builder<String, String, String> features = ImmutableTable.builder();
    for (Iterator<Map.Entry<String, JsonNode>> it = model.path("Template").fields();
        it.hasNext(); ) {
      Map.Entry<String, JsonNode> feature = it.next();
      for (Iterator<Map.Entry<String, JsonNode>> properties = feature.getValue().fields();
          properties.hasNext(); ) {
        Map.Entry<String, JsonNode> property = properties.next();
        if (property.getValue().isValueNode()) {
          features.put(feature.getKey(), property.getKey(), property.getValue().asText());
        }
      }
    }
    return Entity.create(
        text(props, "Id"), text(model, "Type"), text(props, "DisplayName"), features.build());
  }

  private static ImmutableMap<String, String> readTemplateNames(JsonNode definitions) {
    Map<String, String> names = new LinkedHashMap<>();
    for (JsonNode definition : definitions) {
      JsonNode template = definition.path("Template");
      if (template.isObject()) {
        names.putIfAbsent(text(definition, "Type"), text(template, "DisplayName"));
      }
    }
    return ImmutableMap.copyOf(names);
  }

  private static ImmutableList<VariableNamespace> readNamespaces(JsonNode globals) {
    ImmutableList.Builder<VariableNamespace> namespaces = ImmutableList.builder();
    for (JsonNode namespace : globals) {
      ImmutableList.Builder<VariableNamespace.Variable> variables = ImmutableList.builder();
      for (JsonNode variable : namespace.path("Variables")) {
        variables.add(
            VariableNamespace.Variable.create(
                text(variable, "Variable"),
                text(variable, "Type"),
                text(variable, "Value"),
                text(variable, "Description")));
      }
      namespaces.add(
          VariableNamespace.create(
              text(namespace, "Namespace"), text(namespace, "Description"), variables.build()));
    }
    return namespaces.build();
  }

  private static String ownerOf(JsonNode pin, String nodeId) {
    String owner = text(pin, "Owner");
    return owner.isEmpty() ? nodeId : owner;
  }

  private static Optional<String> reference(JsonNode props, String field) {
    String id = text(props, field);
    return NULL_ID.matcher(id).matches() ? Optional.empty() : Optional.of(id);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    return value.isValueNode() ? value.asText() : "";
  }
}
