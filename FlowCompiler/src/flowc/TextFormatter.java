package flowc;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

public final class TextFormatter {
  private static final Splitter PARAGRAPH_SPLITTER =
      Splitter.onPattern("\\r\\n\\r\\n|\\n\\n").omitEmptyStrings();
  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

  private static final Pattern BOLD = Pattern.compile("\\*\\*(.*?)\\*\\*");
  private static final Pattern ITALICS = Pattern.compile("\\*(.*?)\\*");
  private static final Pattern UNDERLINE = Pattern.compile("_(.*?)_");
  // Ren'Py interpolations such as [player.name] are left untouched.
  private static final Pattern INTERPOLATION = Pattern.compile("\\[[^\\]]*\\]");

  private TextFormatter() {}

  public static String escape(String text) {
    return text.replace("\"", "\\\"").replace("'", "\\'").replace("%", "\\%");
  }

  public static String applyTextStyles(String text) {
    StringBuilder sb = new StringBuilder();
    Matcher m = INTERPOLATION.matcher(text);
    int last = 0;
    while (m.find()) {
      sb.append(styleSegment(text.substring(last, m.start())));
      sb.append(m.group());
      last = m.end();
    }
    sb.append(styleSegment(text.substring(last)));
    return sb.toString();
  }

  private static String styleSegment(String text) {
    String styled = BOLD.matcher(text).replaceAll("{b}$1{/b}");
    styled = ITALICS.matcher(styled).replaceAll("{i}$1{/i}");
    return UNDERLINE.matcher(styled).replaceAll("{u}$1{/u}");
  }

  public static String format(String text, boolean textStyles) {
    String escaped = escape(text);
    return textStyles ? applyTextStyles(escaped) : escaped;
  }

  // Paragraphs are separated by a blank line; remaining line breaks become '\n' escapes.
  public static ImmutableList<String> paragraphs(String text, boolean textStyles) {
    ImmutableList.Builder<String> paragraphs = ImmutableList.builder();
    for (String paragraph : PARAGRAPH_SPLITTER.split(text)) {
      String joined = LINE_BREAK.matcher(paragraph.trim()).replaceAll("\\\\n");
      if (!joined.isEmpty()) {
        paragraphs.add(format(joined, textStyles));
      }
    }
    return paragraphs.build();
  }

  public static String quote(String formatted) {
    return "\"" + formatted + "\"";
  }
}
