package flowc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// A container's file holds the container itself followed by its direct children that are not
// containers; nested containers get their own files.
public class FlowCompiler {
  private static final Logger LOGGER = LoggerFactory.getLogger(FlowCompiler.class);

  private final FlowGraph graph;
  private final ContainerHierarchy hierarchy;
  private final RoleTable roles;
  private final NodeCompiler nodeCompiler;

  public FlowCompiler(
      FlowGraph graph,
      ContainerHierarchy hierarchy,
      CompilerConfig config,
      SymbolTable symbols,
      Diagnostics diagnostics,
      SpeakerLookup speakers,
      AssetTree assets) {
    this.graph = graph;
    this.hierarchy = hierarchy;
    this.roles = config.roles();
    this.nodeCompiler =
        new NodeCompiler(graph, hierarchy, config, symbols, diagnostics, speakers, assets);
  }

  public Labels labels() {
    return nodeCompiler.labels();
  }

  public CompiledFlow compile() throws CompilerException {
    ImmutableMap.Builder<Location, ImmutableList<String>> files = ImmutableMap.builder();
    for (FlowGraph.Node container : hierarchy.containers()) {
      Location location = hierarchy.locationOf(container.id()).get();
      LOGGER.debug("Compiling {} into {}", container.id(), location);

      ImmutableList<String> lines =
          ScriptOutput.capture(
              out -> {
                nodeCompiler.compile(container, location, out);
                for (FlowGraph.Node child : graph.childrenOf(container.id())) {
                  if (!roles.isContainer(child)) {
                    nodeCompiler.compile(child, location, out);
                  }
                }
              });
      files.put(location, lines);
    }
    ImmutableMap<Location, ImmutableList<String>> built = files.build();
    Verify.verify(built.size() == hierarchy.containers().size());
    return CompiledFlow.create(built);
  }
}
