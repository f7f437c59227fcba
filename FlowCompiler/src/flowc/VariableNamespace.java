package flowc;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class VariableNamespace {

  @AutoValue
  public abstract static class Variable {
    public abstract String name();

    // Boolean, Integer or String
    public abstract String type();

    public abstract String value();

    public abstract String description();

    public static Variable create(String name, String type, String value, String description) {
      return new AutoValue_VariableNamespace_Variable(name, type, value, description);
    }
  }

  public abstract String name();

  public abstract String description();

  public abstract ImmutableList<Variable> variables();

  public static VariableNamespace create(
      String name, String description, Iterable<Variable> variables) {
    return new AutoValue_VariableNamespace(name, description, ImmutableList.copyOf(variables));
  }
}
