package flowc;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class CompiledFlow {
  public abstract ImmutableMap<Location, ImmutableList<String>> files();

  public ImmutableList<String> linesOf(Location location) {
    ImmutableList<String> lines = files().get(location);
    return lines == null ? ImmutableList.of() : lines;
  }

  public static CompiledFlow create(ImmutableMap<Location, ImmutableList<String>> files) {
    return new AutoValue_CompiledFlow(files);
  }
}
