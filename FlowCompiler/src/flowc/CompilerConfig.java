package flowc;

import java.nio.file.Path;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

@AutoValue
public abstract class CompilerConfig {
  // Paths
  public abstract Path exportFile();

  public abstract Path targetDir();

  public abstract Optional<Path> gameDir();

  // Files
  public abstract String filePrefix();

  public abstract String baseFileName();

  public abstract String variablesFileName();

  public abstract String charactersFileName();

  public abstract String logFileName();

  // Ren'Py
  public abstract String characterPrefix();

  public abstract String labelPrefix();

  public abstract String startLabel();

  public abstract String endLabel();

  public abstract boolean menuDisplayTextBox();

  public abstract boolean markdownTextStyles();

  public abstract boolean relativeAssetsInBraces();

  public abstract String assetDirectory();

  public abstract ImmutableList<String> assetExtensions();

  public abstract ImmutableList<String> attentionPrefixes();

  public abstract boolean repeatMenuText();

  public abstract boolean comments();

  // articy
  public abstract ImmutableSet<String> characterTemplates();

  public abstract ImmutableList<String> characterFeatures();

  public abstract String characterNameProperty();

  public abstract String variableSetFeature();

  public abstract String variableSetProperty();

  public abstract String variableSetCharacterName();

  public abstract RoleTable roles();

  public String terminalLabel() {
    return labelPrefix() + endLabel();
  }

  // Ren'Py resolves asset paths against its 'game' directory.
  public Path resolvedGameDir() {
    if (gameDir().isPresent()) return gameDir().get();
    Path target = targetDir().toAbsolutePath().normalize();
    for (Path p = target.getParent(); p != null; p = p.getParent()) {
      if (p.getFileName() != null && p.getFileName().toString().equals("game")) return p;
    }
    return target.getParent() != null ? target.getParent() : target;
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_CompilerConfig.Builder()
        .setExportFile(Path.of("articy_export.json"))
        .setTargetDir(Path.of("game", "articy"))
        .setFilePrefix("articy_")
        .setBaseFileName("start.rpy")
        .setVariablesFileName("variables.rpy")
        .setCharactersFileName("characters.rpy")
        .setLogFileName("log.txt")
        .setCharacterPrefix("character.")
        .setLabelPrefix("label_")
        .setStartLabel("start")
        .setEndLabel("end")
        .setMenuDisplayTextBox(true)
        .setMarkdownTextStyles(false)
        .setRelativeAssetsInBraces(true)
        .setAssetDirectory("images")
        .setAssetExtensions(ImmutableList.of(".png", ".webp", ".gif", ".jpg", ".jpeg"))
        .setAttentionPrefixes(ImmutableList.of("# todo", "#todo"))
        .setRepeatMenuText(false)
        .setComments(true)
        .setCharacterTemplates(ImmutableSet.of("Character"))
        .setCharacterFeatures(ImmutableList.of("RenPyCharacterParams"))
        .setCharacterNameProperty("RenPyCharacterName")
        .setVariableSetFeature("FeatureVariableSet")
        .setVariableSetProperty("VariablesSetName")
        .setVariableSetCharacterName("name")
        .setRoles(RoleTable.defaults());
  }

  public static CompilerConfig defaults() {
    return builder().build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setExportFile(Path exportFile);

    public abstract Builder setTargetDir(Path targetDir);

    public abstract Builder setGameDir(Path gameDir);

    public abstract Builder setFilePrefix(String filePrefix);

    public abstract Builder setBaseFileName(String baseFileName);

    public abstract Builder setVariablesFileName(String variablesFileName);

    public abstract Builder setCharactersFileName(String charactersFileName);

    public abstract Builder setLogFileName(String logFileName);

    public abstract Builder setCharacterPrefix(String characterPrefix);

    public abstract Builder setLabelPrefix(String labelPrefix);

    public abstract Builder setStartLabel(String startLabel);

    public abstract Builder setEndLabel(String endLabel);

    public abstract Builder setMenuDisplayTextBox(boolean menuDisplayTextBox);

    public abstract Builder setMarkdownTextStyles(boolean markdownTextStyles);

    public abstract Builder setRelativeAssetsInBraces(boolean relativeAssetsInBraces);

    public abstract Builder setAssetDirectory(String assetDirectory);

    public abstract Builder setAssetExtensions(Iterable<String> assetExtensions);

    public abstract Builder setAttentionPrefixes(Iterable<String> attentionPrefixes);

    public abstract Builder setRepeatMenuText(boolean repeatMenuText);

    public abstract Builder setComments(boolean comments);

    public abstract Builder setCharacterTemplates(Iterable<String> characterTemplates);

    public abstract Builder setCharacterFeatures(Iterable<String> characterFeatures);

    public abstract Builder setCharacterNameProperty(String characterNameProperty);

    public abstract Builder setVariableSetFeature(String variableSetFeature);

    public abstract Builder setVariableSetProperty(String variableSetProperty);

    public abstract Builder setVariableSetCharacterName(String variableSetCharacterName);

    public abstract Builder setRoles(RoleTable roles);

    public abstract CompilerConfig build();
  }
}
