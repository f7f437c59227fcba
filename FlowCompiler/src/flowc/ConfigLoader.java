package flowc;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.javaprop.JavaPropsMapper;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

// Reads a .properties file into a CompilerConfig. Absent keys keep their defaults; relative
// paths resolve against the directory of the file.
public final class ConfigLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

  private static final ImmutableSet<String> SECTIONS =
      ImmutableSet.of("paths", "files", "renpy", "articy", "roles");
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private static final JavaPropsMapper MAPPER = new JavaPropsMapper();

  private ConfigLoader() {}

  public static CompilerConfig load(Path file) throws CompilerException {
    JsonNode tree;
    try (InputStream in = Files.newInputStream(file)) {
      tree = MAPPER.readTree(in);
    } catch (IOException ex) {
      throw new CompilerException(String.format("cannot read config file %s", file), ex);
    }
    Path baseDir = file.toAbsolutePath().getParent();
    return fromTree(tree == null ? MAPPER.createObjectNode() : tree, baseDir);
  }

  public static CompilerConfig fromTree(JsonNode tree, Path baseDir) throws CompilerException {
    for (Iterator<String> it = tree.fieldNames(); it.hasNext(); ) {
      String section = it.next();
      if (!SECTIONS.contains(section)) {
        LOGGER.warn("Ignoring unknown config section '{}'", section);
      }
    }

    CompilerConfig.Builder builder = CompilerConfig.builder();

    JsonNode paths = tree.path("paths");
    builder.setExportFile(baseDir.resolve(string(paths, "export").orElse("articy_export.json")));
    builder.setTargetDir(baseDir.resolve(string(paths, "target").orElse("game/articy")));
    string(paths, "game")
        .filter(v -> !v.isEmpty())
        .ifPresent(v -> builder.setGameDir(baseDir.resolve(v)));

    JsonNode files = tree.path("files");
    string(files, "prefix").ifPresent(builder::setFilePrefix);
    string(files, "base").ifPresent(builder::setBaseFileName);
    string(files, "variables").ifPresent(builder::setVariablesFileName);
    string(files, "characters").ifPresent(builder::setCharactersFileName);
    string(files, "log").ifPresent(builder::setLogFileName);

    JsonNode renpy = tree.path("renpy");
    string(renpy, "characterPrefix").ifPresent(builder::setCharacterPrefix);
    string(renpy, "labelPrefix").ifPresent(builder::setLabelPrefix);
    string(renpy, "startLabel").ifPresent(builder::setStartLabel);
    string(renpy, "endLabel").ifPresent(builder::setEndLabel);
    bool(renpy, "menuDisplayTextBox", builder::setMenuDisplayTextBox);
    bool(renpy, "markdownTextStyles", builder::setMarkdownTextStyles);
    bool(renpy, "relativeAssetsInBraces", builder::setRelativeAssetsInBraces);
    string(renpy, "assetDirectory").ifPresent(builder::setAssetDirectory);
    list(renpy, "assetExtensions").ifPresent(builder::setAssetExtensions);
    list(renpy, "attentionPrefixes").ifPresent(builder::setAttentionPrefixes);
    bool(renpy, "repeatMenuText", builder::setRepeatMenuText);
    bool(renpy, "comments", builder::setComments);

    JsonNode articy = tree.path("articy");
    list(articy, "characterTemplates").ifPresent(builder::setCharacterTemplates);
    list(articy, "characterFeatures").ifPresent(builder::setCharacterFeatures);
    string(articy, "characterNameProperty").ifPresent(builder::setCharacterNameProperty);
    string(articy, "variableSetFeature").ifPresent(builder::setVariableSetFeature);
    string(articy, "variableSetProperty").ifPresent(builder::setVariableSetProperty);
    string(articy, "variableSetCharacterName").ifPresent(builder::setVariableSetCharacterName);

    builder.setRoles(RoleTable.withOverrides(roles(tree.path("roles"))));
    return builder.build();
  }

  private static Map<String, Role> roles(JsonNode section) throws CompilerException {
    Map<String, Role> roles = new LinkedHashMap<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = section.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> entry = it.next();
      String value = entry.getValue().asText().trim().toUpperCase(Locale.ROOT);
      try {
        roles.put(entry.getKey(), Role.valueOf(value));
      } catch (IllegalArgumentException ex) {
        throw new CompilerException(
            String.format(
                "roles.%s: unknown role '%s', expected one of %s",
                entry.getKey(),
                entry.getValue().asText(),
                ImmutableList.copyOf(Role.values())),
            ex);
      }
    }
    return roles;
  }

  private static Optional<String> string(JsonNode section, String key) {
    JsonNode node = section.path(key);
    return node.isValueNode() ? Optional.of(node.asText().trim()) : Optional.empty();
  }

  private static Optional<ImmutableList<String>> list(JsonNode section, String key) {
    return string(section, key).map(v -> ImmutableList.copyOf(LIST_SPLITTER.split(v)));
  }

  private static void bool(JsonNode section, String key, Consumer<Boolean> setter)
      throws CompilerException {
    Optional<String> value = string(section, key);
    if (!value.isPresent()) return;
    if (value.get().equalsIgnoreCase("true")) {
      setter.accept(true);
    } else if (value.get().equalsIgnoreCase("false")) {
      setter.accept(false);
    } else {
      throw new CompilerException(
          String.format("%s: expected True or False but was '%s'", key, value.get()));
    }
  }
}
