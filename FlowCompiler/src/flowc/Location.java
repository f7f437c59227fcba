package flowc;

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class Location {
  private static final Joiner PATH_JOINER = Joiner.on('/');

  public abstract ImmutableList<String> directories();

  public abstract String fileName();

  public String directoryPath() {
    return PATH_JOINER.join(directories());
  }

  public String filePath() {
    return directories().isEmpty()
        ? fileName()
        : PATH_JOINER.join(directoryPath(), fileName());
  }

  public static Location create(Iterable<String> directories, String fileName) {
    return new AutoValue_Location(ImmutableList.copyOf(directories), fileName);
  }

  // A file directly in the target root, such as the base or log file.
  public static Location rootFile(String fileName) {
    return create(ImmutableList.of(), fileName);
  }

  @Override
  public final String toString() {
    return filePath();
  }
}
