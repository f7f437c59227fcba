package flowc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class TextFormatterTest {

  @Test
  public void escape() {
    assertThat(TextFormatter.escape("He said \"it's 100%\""))
        .isEqualTo("He said \\\"it\\'s 100\\%\\\"");
  }

  @Test
  public void textStyles() {
    assertThat(TextFormatter.applyTextStyles("**bold**, *italics* and _underlined_"))
        .isEqualTo("{b}bold{/b}, {i}italics{/i} and {u}underlined{/u}");
  }

  @Test
  public void interpolationsKeepTheirUnderscores() {
    assertThat(TextFormatter.applyTextStyles("[player_name] is *here*"))
        .isEqualTo("[player_name] is {i}here{/i}");
  }

  @Test
  public void formatWithoutStyles() {
    assertThat(TextFormatter.format("*not styled*", false)).isEqualTo("*not styled*");
  }

  @Test
  public void paragraphs() {
    assertThat(TextFormatter.paragraphs("One\r\nline\r\n\r\nTwo\n\n\n\n  Three  ", false))
        .containsExactly("One\\nline", "Two", "Three")
        .inOrder();
  }

  @Test
  public void noParagraphs() {
    assertThat(TextFormatter.paragraphs("\r\n\r\n", false)).isEmpty();
  }

  @Test
  public void quote() {
    assertThat(TextFormatter.quote("hi")).isEqualTo("\"hi\"");
  }
}
