package flowc;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

// Writes a define for every character entity and remembers which id each one got.
public final class CharactersGenerator {
  private static final Splitter WORD_SPLITTER =
      Splitter.onPattern("\\s+").trimResults().omitEmptyStrings();
  private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Za-z0-9_]");

  @AutoValue
  public abstract static class Result {
    public abstract ImmutableList<String> lines();

    // entity id -> Ren'Py character id
    public abstract ImmutableMap<String, String> characterIds();

    public SpeakerLookup speakers() {
      return SpeakerLookup.of(characterIds());
    }

    static Result create(ImmutableList<String> lines, ImmutableMap<String, String> characterIds) {
      return new AutoValue_CharactersGenerator_Result(lines, characterIds);
    }
  }

  private final CompilerConfig config;

  public CharactersGenerator(CompilerConfig config) {
    this.config = config;
  }

  public boolean isCharacter(Entity entity, FlowExport export) {
    return config.characterTemplates().contains(entity.type())
        || export
            .templateNameOf(entity.type())
            .map(config.characterTemplates()::contains)
            .orElse(false);
  }

  public Result generate(FlowExport export, SymbolTable symbols) {
    ScriptOutput out = new ScriptOutput();
    Map<String, String> ids = new LinkedHashMap<>();
    for (Entity entity : export.entities()) {
      if (!isCharacter(entity, export)) continue;

      String id = symbols.allocate(config.characterPrefix() + baseName(entity));
      ids.put(entity.id(), id);

      Optional<String> variableSet = variableSet(entity);
      String name =
          nameProperty(entity)
              .orElseGet(
                  () ->
                      variableSet
                          .map(set -> set + "." + config.variableSetCharacterName())
                          .orElse(entity.displayName()));
      boolean dynamic = !nameProperty(entity).isPresent() && variableSet.isPresent();

      RenPyStatements.writeDefine(
          id,
          String.format(
              "Character(%s, dynamic=%s)",
              TextFormatter.quote(TextFormatter.escape(name)),
              dynamic ? "True" : "False"),
          out);
      out.blank();
    }
    return Result.create(out.lines(), ImmutableMap.copyOf(ids));
  }

  private Optional<String> nameProperty(Entity entity) {
    for (String feature : config.characterFeatures()) {
      Optional<String> name =
          entity
              .property(feature, config.characterNameProperty())
              .filter(v -> !v.trim().isEmpty());
      if (name.isPresent()) return name;
    }
    return Optional.empty();
  }

  private Optional<String> variableSet(Entity entity) {
    return entity
        .property(config.variableSetFeature(), config.variableSetProperty())
        .map(String::trim)
        .filter(v -> !v.isEmpty());
  }

  // First word of the display name, lowercased and reduced to identifier characters.
  static String baseName(Entity entity) {
    String word =
        WORD_SPLITTER.splitToList(entity.displayName()).stream().findFirst().orElse("");
    String base = NON_IDENTIFIER.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("_");
    if (base.isEmpty()) {
      base = NON_IDENTIFIER.matcher(entity.id().toLowerCase(Locale.ROOT)).replaceAll("_");
    }
    return Character.isDigit(base.charAt(0)) ? "_" + base : base;
  }
}
