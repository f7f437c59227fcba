package flowc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class DirectivesTest {

  @Test
  public void empty() {
    assertThat(Directives.parse("  ")).isEqualTo(Directives.empty());
  }

  @Test
  public void valuesAndPriority() {
    Directives directives = Directives.parse("label=\"intro\", speaker=\"Old Man\", 3");

    assertThat(directives.value(Directives.LABEL)).hasValue("intro");
    assertThat(directives.value(Directives.SPEAKER)).hasValue("Old Man");
    assertThat(directives.priority()).hasValue(3);
    assertThat(directives.malformed()).isEmpty();
  }

  @Test
  public void firstPriorityWins() {
    assertThat(Directives.parse("5, -7").priority()).hasValue(5);
    assertThat(Directives.parse("-7").priority()).hasValue(-7);
  }

  @Test
  public void firstKeyWins() {
    assertThat(Directives.parse("label=a, label=b").value(Directives.LABEL)).hasValue("a");
  }

  @Test
  public void unquotedValue() {
    assertThat(Directives.parse("display_text_box = False").value(Directives.DISPLAY_TEXT_BOX))
        .hasValue("False");
  }

  @Test
  public void commasInsideQuotes() {
    Directives directives = Directives.parse("post=\"with Dissolve(0.5, alpha=True)\", 2");

    assertThat(directives.value(Directives.POST)).hasValue("with Dissolve(0.5, alpha=True)");
    assertThat(directives.priority()).hasValue(2);
  }

  @Test
  public void flags() {
    Directives directives = Directives.parse("dont_repeat_menu_text, other flag");

    assertThat(directives.hasFlag(Directives.DONT_REPEAT_MENU_TEXT)).isTrue();
    assertThat(directives.hasFlag("otherflag")).isTrue();
    assertThat(directives.priority()).isEmpty();
  }

  @Test
  public void booleanValues() {
    Directives directives = Directives.parse("markdown=TRUE, display_text_box=maybe");

    assertThat(directives.booleanValue(Directives.MARKDOWN)).hasValue(true);
    assertThat(directives.booleanValue(Directives.DISPLAY_TEXT_BOX)).isEmpty();
    assertThat(directives.booleanValue(Directives.DISPLAY_TEXT_BOX, true)).isTrue();
    assertThat(directives.booleanValue(Directives.REPEAT_MENU_TEXT, false)).isFalse();
  }

  @Test
  public void malformedSegments() {
    Directives directives = Directives.parse("=x, 4, label=\"open");

    assertThat(directives.malformed()).containsExactly("=x", "label=\"open").inOrder();
    assertThat(directives.value(Directives.LABEL)).isEmpty();
    assertThat(directives.priority()).hasValue(4);
  }

  @Test
  public void ofNode() {
    FlowGraph.Node node =
        FlowGraph.Node.builder("0x1", "DialogueFragment")
            .setStageDirections("speaker=\"Narrator\"")
            .build();

    assertThat(Directives.of(node).value(Directives.SPEAKER)).hasValue("Narrator");
  }
}
