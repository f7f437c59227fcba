package flowc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.io.MoreFiles;

public class ConfigLoaderTest {

  @TempDir Path dir;

  private CompilerConfig load(String... lines) throws IOException, CompilerException {
    Path file = dir.resolve("flowc.properties");
    MoreFiles.asCharSink(file, StandardCharsets.UTF_8).write(String.join("\n", lines) + "\n");
    return ConfigLoader.load(file);
  }

  @Test
  public void defaults() throws IOException, CompilerException {
    CompilerConfig config = load("# nothing set");

    assertThat(config.exportFile()).isEqualTo(dir.resolve("articy_export.json"));
    assertThat(config.targetDir()).isEqualTo(dir.resolve("game/articy"));
    assertThat(config.gameDir()).isEmpty();
    assertThat(config.terminalLabel()).isEqualTo("label_end");
    assertThat(config.menuDisplayTextBox()).isTrue();
    assertThat(config.assetExtensions())
        .containsExactly(".png", ".webp", ".gif", ".jpg", ".jpeg")
        .inOrder();
    assertThat(config.roles().roleOf("DialogueFragment")).hasValue(Role.DIALOGUE_LINE);
  }

  @Test
  public void sections() throws IOException, CompilerException {
    CompilerConfig config =
        load(
            "paths.export=export/story.json",
            "paths.target=out/game/story",
            "files.prefix=story_",
            "renpy.labelPrefix=lbl_",
            "renpy.endLabel=fin",
            "renpy.menuDisplayTextBox=False",
            "renpy.markdownTextStyles=TRUE",
            "renpy.attentionPrefixes=# fixme, # todo",
            "articy.characterTemplates=Character, Sidekick",
            "articy.variableSetCharacterName=display");

    assertThat(config.exportFile()).isEqualTo(dir.resolve("export/story.json"));
    assertThat(config.filePrefix()).isEqualTo("story_");
    assertThat(config.terminalLabel()).isEqualTo("lbl_fin");
    assertThat(config.menuDisplayTextBox()).isFalse();
    assertThat(config.markdownTextStyles()).isTrue();
    assertThat(config.attentionPrefixes()).containsExactly("# fixme", "# todo").inOrder();
    assertThat(config.characterTemplates()).containsExactly("Character", "Sidekick");
    assertThat(config.variableSetCharacterName()).isEqualTo("display");
    assertThat(config.resolvedGameDir()).isEqualTo(dir.resolve("out/game").toAbsolutePath());
  }

  @Test
  public void explicitGameDir() throws IOException, CompilerException {
    CompilerConfig config = load("paths.game=assets");

    assertThat(config.resolvedGameDir()).isEqualTo(dir.resolve("assets"));
  }

  @Test
  public void gameDirDefaultsToTargetParent() throws IOException, CompilerException {
    CompilerConfig config = load("paths.target=out/scripts");

    assertThat(config.resolvedGameDir()).isEqualTo(dir.resolve("out").toAbsolutePath());
  }

  @Test
  public void roles() throws IOException, CompilerException {
    CompilerConfig config = load("roles.NpcLine=dialogue_line", "roles.Hub=IGNORED");

    assertThat(config.roles().roleOf("NpcLine")).hasValue(Role.DIALOGUE_LINE);
    assertThat(config.roles().roleOf("Hub")).hasValue(Role.IGNORED);
    assertThat(config.roles().roleOf("Condition")).hasValue(Role.BRANCH_CONDITION);
  }

  @Test
  public void unknownRole() {
    CompilerException ex = assertThrows(CompilerException.class, () -> load("roles.X=SCENE"));
    assertThat(ex.errorMsg()).startsWith("roles.X: unknown role 'SCENE'");
  }

  @Test
  public void invalidBoolean() {
    CompilerException ex =
        assertThrows(CompilerException.class, () -> load("renpy.comments=sometimes"));
    assertThat(ex.errorMsg()).isEqualTo("comments: expected True or False but was 'sometimes'");
  }

  @Test
  public void missingFile() {
    assertThrows(CompilerException.class, () -> ConfigLoader.load(dir.resolve("absent")));
  }
}
