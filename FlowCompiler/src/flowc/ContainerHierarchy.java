package flowc;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// Assigns every reachable container an output location, in pre-order.
public final class ContainerHierarchy {
  private static final Logger LOGGER = LoggerFactory.getLogger(ContainerHierarchy.class);

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern UNSAFE_PATH_CHARS = Pattern.compile("[\\\\/:*?\"<>|]");
  // "." and ".." would point at the parent directory or the current one.
  private static final Pattern DOTS_ONLY = Pattern.compile("\\.*");

  private final ImmutableMap<String, FlowGraph.Node> containersById;
  private final ImmutableMap<String, Location> locationsById;
  private final ImmutableList<String> rootIds;

  private ContainerHierarchy(
      ImmutableMap<String, FlowGraph.Node> containersById,
      ImmutableMap<String, Location> locationsById,
      ImmutableList<String> rootIds) {
    this.containersById = containersById;
    this.locationsById = locationsById;
    this.rootIds = rootIds;
  }

  public ImmutableList<FlowGraph.Node> containers() {
    return containersById.values().asList();
  }

  public ImmutableList<String> rootIds() {
    return rootIds;
  }

  public boolean contains(String containerId) {
    return locationsById.containsKey(containerId);
  }

  public Optional<Location> locationOf(String containerId) {
    return Optional.ofNullable(locationsById.get(containerId));
  }

  public static String directoryName(FlowGraph.Node container) {
    String name = container.displayName().trim().toLowerCase(Locale.ROOT);
    name = UNSAFE_PATH_CHARS.matcher(WHITESPACE.matcher(name).replaceAll("_")).replaceAll("_");
    return DOTS_ONLY.matcher(name).matches() ? container.id() : name;
  }

  public static ContainerHierarchy build(FlowGraph graph, RoleTable roles, String filePrefix)
      throws CompilerException {
    ImmutableList.Builder<String> rootIds = ImmutableList.builder();
    if (graph.rootIds().isEmpty()) {
      for (FlowGraph.Node node : graph.nodes()) {
        if (roles.isContainer(node) && !hasContainerParent(graph, roles, node)) {
          rootIds.add(node.id());
        }
      }
    } else {
      for (String id : graph.rootIds()) {
        Optional<FlowGraph.Node> node = graph.node(id);
        if (node.isPresent() && roles.isContainer(node.get())) {
          rootIds.add(id);
        } else {
          LOGGER.debug("Skipping hierarchy root {}: not a container", id);
        }
      }
    }

    Builder builder = new Builder(graph, roles, filePrefix);
    ImmutableList<String> roots = rootIds.build();
    for (String id : roots) {
      builder.visit(graph.node(id).get(), ImmutableList.of());
    }
    return new ContainerHierarchy(
        ImmutableMap.copyOf(builder.containers), ImmutableMap.copyOf(builder.locations), roots);
  }

  private static boolean hasContainerParent(
      FlowGraph graph, RoleTable roles, FlowGraph.Node node) {
    return node.parentId().flatMap(graph::node).map(roles::isContainer).orElse(false);
  }

  private static final class Builder {
    private final FlowGraph graph;
    private final RoleTable roles;
    private final String filePrefix;

    private final Map<String, FlowGraph.Node> containers = new LinkedHashMap<>();
    private final Map<String, Location> locations = new LinkedHashMap<>();
    private final Map<String, String> ownersByPath = new LinkedHashMap<>();

    private Builder(FlowGraph graph, RoleTable roles, String filePrefix) {
      this.graph = graph;
      this.roles = roles;
      this.filePrefix = filePrefix;
    }

    private void visit(FlowGraph.Node container, ImmutableList<String> parentDirectories)
        throws CompilerException {
      if (containers.containsKey(container.id())) {
        throw new CompilerException(container, "container reached twice in the hierarchy");
      }

      String dir = directoryName(container);
      ImmutableList<String> directories =
          ImmutableList.<String>builder().addAll(parentDirectories).add(dir).build();
      Location location = Location.create(directories, filePrefix + dir + ".rpy");

      String previous = ownersByPath.putIfAbsent(location.directoryPath(), container.id());
      if (previous != null) {
        throw new CompilerException(
            container,
            String.format(
                "output location '%s' is already used by node %s",
                location.directoryPath(),
                previous));
      }
      containers.put(container.id(), container);
      locations.put(container.id(), location);

      for (FlowGraph.Node child : graph.childrenOf(container.id())) {
        if (roles.isContainer(child)) {
          visit(child, directories);
        }
      }
    }
  }
}
