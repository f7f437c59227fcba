package flowc;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

// Rewrites articy expression syntax (C-like) into Ren'Py's Python syntax.
public final class ExpressionTranslator {
  private static final Pattern TRUE_LITERAL = Pattern.compile("\\btrue\\b");
  private static final Pattern FALSE_LITERAL = Pattern.compile("\\bfalse\\b");
  private static final Pattern AND = Pattern.compile("\\s*&&\\s*");
  private static final Pattern OR = Pattern.compile("\\s*\\|\\|\\s*");
  // '!' that is not the start of '!='.
  private static final Pattern NOT = Pattern.compile("!(?!=)\\s*");
  private static final Pattern STRING_LITERAL = Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"");
  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

  private static final Splitter STATEMENT_SPLITTER =
      Splitter.on(';').trimResults().omitEmptyStrings();

  private ExpressionTranslator() {}

  // Double-quoted string literals are copied unchanged.
  public static String translate(String text) {
    StringBuilder sb = new StringBuilder();
    Matcher literal = STRING_LITERAL.matcher(text);
    int start = 0;
    while (literal.find()) {
      sb.append(rewrite(text.substring(start, literal.start()))).append(literal.group());
      start = literal.end();
    }
    return sb.append(rewrite(text.substring(start))).toString();
  }

  private static String rewrite(String text) {
    String converted = TRUE_LITERAL.matcher(text).replaceAll("True");
    converted = FALSE_LITERAL.matcher(converted).replaceAll("False");
    converted = AND.matcher(converted).replaceAll(" and ");
    converted = OR.matcher(converted).replaceAll(" or ");
    converted = NOT.matcher(converted).replaceAll("not ");
    return converted;
  }

  // Conditions must fit on a single 'if' line.
  public static String translateCondition(String text) {
    return translate(LINE_BREAK.matcher(text).replaceAll(" ")).trim();
  }

  public static ImmutableList<String> translateStatements(String text) {
    String joined = LINE_BREAK.matcher(text).replaceAll("");
    ImmutableList.Builder<String> statements = ImmutableList.builder();
    for (String statement : STATEMENT_SPLITTER.split(joined)) {
      statements.add(translate(statement).trim());
    }
    return statements.build();
  }
}
