package flowc;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

// All generated files of one run, keyed by their path relative to the target directory.
@AutoValue
public abstract class ScriptProject {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScriptProject.class);

  public abstract ImmutableMap<String, String> files();

  // First path segment of every root container; the only directories the target may contain.
  public abstract ImmutableSet<String> rootDirectories();

  public abstract ImmutableSet<String> symbols();

  public abstract Diagnostics diagnostics();

  public static ScriptProject compile(FlowExport export, CompilerConfig config, AssetTree assets)
      throws CompilerException {
    FlowGraph graph = export.graph();
    SymbolTable symbols = new SymbolTable();
    Diagnostics diagnostics = new Diagnostics();
    ContainerHierarchy hierarchy =
        ContainerHierarchy.build(graph, config.roles(), config.filePrefix());
    LOGGER.debug("{} containers in the hierarchy", hierarchy.containers().size());

    ImmutableMap.Builder<String, String> files = ImmutableMap.builder();
    files.put(
        config.baseFileName(),
        ScriptOutput.render(
            BaseFileGenerator.generate(graph, hierarchy, config, new Labels(config), symbols)));

    CharactersGenerator.Result characters =
        new CharactersGenerator(config).generate(export, symbols);
    files.put(config.charactersFileName(), ScriptOutput.render(characters.lines()));
    files.put(
        config.variablesFileName(),
        ScriptOutput.render(VariablesGenerator.generate(export.namespaces(), symbols)));

    CompiledFlow flow =
        new FlowCompiler(
                graph, hierarchy, config, symbols, diagnostics, characters.speakers(), assets)
            .compile();
    for (Map.Entry<Location, ImmutableList<String>> file : flow.files().entrySet()) {
      files.put(file.getKey().filePath(), ScriptOutput.render(file.getValue()));
    }
    files.put(config.logFileName(), diagnostics.render());

    ImmutableSet.Builder<String> rootDirectories = ImmutableSet.builder();
    for (String rootId : hierarchy.rootIds()) {
      hierarchy.locationOf(rootId).ifPresent(l -> rootDirectories.add(l.directories().get(0)));
    }
    return create(files.build(), rootDirectories.build(), symbols.symbols(), diagnostics);
  }

  static ScriptProject create(
      ImmutableMap<String, String> files,
      ImmutableSet<String> rootDirectories,
      ImmutableSet<String> symbols,
      Diagnostics diagnostics) {
    return new AutoValue_ScriptProject(files, rootDirectories, symbols, diagnostics);
  }
}
