package flowc;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

// Non-fatal warnings, grouped by the output file they concern.
public final class Diagnostics {
  private static final String INDENT = "    ";

  private final ListMultimap<String, String> entries = LinkedListMultimap.create();

  public void log(Location location, String message) {
    log(location.filePath(), message);
  }

  public void log(String location, String message) {
    entries.put(location, message);
  }

  public ImmutableListMultimap<String, String> entries() {
    return ImmutableListMultimap.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public String render() {
    StringBuilder sb = new StringBuilder();
    for (String location : entries.keySet()) {
      sb.append(location).append('\n');
      for (String message : entries.get(location)) {
        sb.append(INDENT).append(message).append('\n');
      }
    }
    return sb.toString();
  }
}
