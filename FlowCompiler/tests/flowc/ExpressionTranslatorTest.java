package flowc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class ExpressionTranslatorTest {

  @Test
  public void logicalOperators() {
    assertThat(ExpressionTranslator.translate("a&&b || !c")).isEqualTo("a and b or not c");
  }

  @Test
  public void notEqualsIsKept() {
    assertThat(ExpressionTranslator.translate("x != 3 && !done"))
        .isEqualTo("x != 3 and not done");
  }

  @Test
  public void negationSwallowsWhitespace() {
    assertThat(ExpressionTranslator.translate("! flag")).isEqualTo("not flag");
  }

  @Test
  public void booleanLiteralsAreWholeWords() {
    assertThat(ExpressionTranslator.translate("trueLove == true || false"))
        .isEqualTo("trueLove == True or False");
  }

  @Test
  public void otherTextPassesThrough() {
    assertThat(ExpressionTranslator.translate("GameState.gold >= 10"))
        .isEqualTo("GameState.gold >= 10");
  }

  @Test
  public void conditionOnOneLine() {
    assertThat(ExpressionTranslator.translateCondition("  a &&\r\nb  ")).isEqualTo("a and b");
  }

  @Test
  public void emptyCondition() {
    assertThat(ExpressionTranslator.translateCondition(" \r\n ")).isEmpty();
  }

  @Test
  public void statements() {
    assertThat(ExpressionTranslator.translateStatements("x = 1;\r\ny = true;; ;"))
        .containsExactly("x = 1", "y = True")
        .inOrder();
  }

  @Test
  public void noStatements() {
    assertThat(ExpressionTranslator.translateStatements("")).isEmpty();
  }

  @Test
  public void stringLiteralsAreKept() {
    assertThat(ExpressionTranslator.translate("msg == \"Hi! true && \\\"false\\\"\" && !ok"))
        .isEqualTo("msg == \"Hi! true && \\\"false\\\"\" and not ok");
  }

  @Test
  public void statementsWithStringLiterals() {
    assertThat(ExpressionTranslator.translateStatements("msg = \"Hi!\"; ok = true"))
        .containsExactly("msg = \"Hi!\"", "ok = True")
        .inOrder();
  }
}
