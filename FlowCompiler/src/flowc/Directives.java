package flowc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Stage directions parsed into key/value pairs, bare flags and an optional menu priority.
 *
 * <p>Segments are separated by commas; commas inside double quotes don't split. A segment is
 * {@code key="value"}, {@code key=value}, an integer (menu priority, first one wins) or a flag.
 */
@AutoValue
public abstract class Directives {
  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public static final String LABEL = "label";
  public static final String SPEAKER = "speaker";
  public static final String PRE = "pre";
  public static final String POST = "post";
  public static final String MARKDOWN = "markdown";
  public static final String DISPLAY_TEXT_BOX = "display_text_box";
  public static final String REPEAT_MENU_TEXT = "repeat_menu_text";
  public static final String DONT_REPEAT_MENU_TEXT = "dont_repeat_menu_text";

  private static final Directives EMPTY =
      new AutoValue_Directives(
          ImmutableMap.of(), ImmutableSet.of(), Optional.empty(), ImmutableList.of());

  public abstract ImmutableMap<String, String> values();

  public abstract ImmutableSet<String> flags();

  public abstract Optional<Integer> priority();

  // Segments that could not be parsed; callers report them and otherwise ignore them.
  public abstract ImmutableList<String> malformed();

  public Optional<String> value(String key) {
    return Optional.ofNullable(values().get(key));
  }

  public Optional<Boolean> booleanValue(String key) {
    return value(key)
        .flatMap(
            v -> {
              if (v.equalsIgnoreCase("true")) return Optional.of(true);
              if (v.equalsIgnoreCase("false")) return Optional.of(false);
              return Optional.empty();
            });
  }

  public boolean booleanValue(String key, boolean defaultValue) {
    return booleanValue(key).orElse(defaultValue);
  }

  public boolean hasFlag(String flag) {
    return flags().contains(flag);
  }

  public static Directives empty() {
    return EMPTY;
  }

  public static Directives of(FlowGraph.Node node) {
    return parse(node.stageDirections());
  }

  public static Directives parse(String text) {
    if (text.trim().isEmpty()) return EMPTY;

    Map<String, String> values = new LinkedHashMap<>();
    Set<String> flags = new LinkedHashSet<>();
    List<String> malformed = new ArrayList<>();
    Optional<Integer> priority = Optional.empty();

    for (String segment : splitSegments(text)) {
      segment = segment.trim();
      if (segment.isEmpty()) continue;

      int eq = segment.indexOf('=');
      if (eq < 0) {
        if (INTEGER.matcher(segment).matches()) {
          if (!priority.isPresent()) {
            try {
              priority = Optional.of(Integer.parseInt(segment));
            } catch (NumberFormatException ex) {
              malformed.add(segment);
            }
          }
        } else if (segment.indexOf('"') >= 0) {
          malformed.add(segment);
        } else {
          flags.add(segment.replace(" ", ""));
        }
        continue;
      }

      String key = segment.substring(0, eq).trim();
      Optional<String> value = parseValue(segment.substring(eq + 1).trim());
      if (!KEY.matcher(key).matches() || !value.isPresent()) {
        malformed.add(segment);
      } else {
        values.putIfAbsent(key, value.get());
      }
    }

    return new AutoValue_Directives(
        ImmutableMap.copyOf(values),
        ImmutableSet.copyOf(flags),
        priority,
        ImmutableList.copyOf(malformed));
  }

  private static Optional<String> parseValue(String raw) {
    if (!raw.startsWith("\"")) {
      return raw.indexOf('"') >= 0 ? Optional.empty() : Optional.of(raw);
    }
    if (raw.length() < 2 || !raw.endsWith("\"")) return Optional.empty();
    String inner = raw.substring(1, raw.length() - 1);
    return inner.indexOf('"') >= 0 ? Optional.empty() : Optional.of(inner);
  }

  private static ImmutableList<String> splitSegments(String text) {
    ImmutableList.Builder<String> segments = ImmutableList.builder();
    StringBuilder current = new StringBuilder();
    boolean quoted = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '"') {
        quoted = !quoted;
      } else if (c == ',' && !quoted) {
        segments.add(current.toString());
        current.setLength(0);
        continue;
      }
      current.append(c);
    }
    segments.add(current.toString());
    return segments.build();
  }
}
