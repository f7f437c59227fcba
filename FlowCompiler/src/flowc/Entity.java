package flowc;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableTable;

@AutoValue
public abstract class Entity {
  public abstract String id();

  public abstract String type();

  public abstract String displayName();

  // feature -> property -> value
  public abstract ImmutableTable<String, String, String> features();

  public Optional<String> property(String feature, String property) {
    return Optional.ofNullable(features().get(feature, property));
  }

  public static Entity create(
      String id, String type, String displayName, ImmutableTable<String, String, String> features) {
    return new AutoValue_Entity(id, type, displayName, features);
  }
}
