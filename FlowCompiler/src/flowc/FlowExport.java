package flowc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class FlowExport {
  public abstract FlowGraph graph();

  public abstract ImmutableList<Entity> entities();

  // type tag -> display name of its template
  public abstract ImmutableMap<String, String> templateNames();

  public abstract ImmutableList<VariableNamespace> namespaces();

  public Optional<String> templateNameOf(String type) {
    return Optional.ofNullable(templateNames().get(type));
  }

  public static FlowExport create(
      FlowGraph graph,
      Iterable<Entity> entities,
      ImmutableMap<String, String> templateNames,
      Iterable<VariableNamespace> namespaces) {
    return new AutoValue_FlowExport(
        graph, ImmutableList.copyOf(entities), templateNames, ImmutableList.copyOf(namespaces));
  }
}
