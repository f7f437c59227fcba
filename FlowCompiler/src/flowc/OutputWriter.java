package flowc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

// Replaces the contents of the target directory with a ScriptProject. The old directory is only
// removed when everything in it looks generated: directories named like a root container and files
// carrying the file prefix or one of the fixed file names.
public final class OutputWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(OutputWriter.class);

  private final CompilerConfig config;

  public OutputWriter(CompilerConfig config) {
    this.config = config;
  }

  public void cleanUp(Path targetDir, ImmutableSet<String> rootDirectories)
      throws CompilerException {
    if (!Files.exists(targetDir)) return;
    if (!Files.isDirectory(targetDir)) {
      throw new CompilerException(String.format("target %s is not a directory", targetDir));
    }

    ImmutableSet<String> fixedFiles =
        ImmutableSet.of(
            config.baseFileName(),
            config.variablesFileName(),
            config.charactersFileName(),
            config.logFileName());
    for (Path item : list(targetDir)) {
      String name = item.getFileName().toString();
      if (Files.isDirectory(item)) {
        if (!rootDirectories.contains(name)) {
          throw new CompilerException(
              String.format("unexpected content: directory \"%s\" in %s", name, targetDir));
        }
      } else if (!name.startsWith(config.filePrefix()) && !fixedFiles.contains(name)) {
        throw new CompilerException(
            String.format("unexpected content: file \"%s\" in %s", name, targetDir));
      }
    }

    try {
      MoreFiles.deleteRecursively(targetDir, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException ex) {
      throw new CompilerException(String.format("cannot remove %s", targetDir), ex);
    }
    LOGGER.info("Removed previous output in {}", targetDir);
  }

  public void write(Path targetDir, ScriptProject project) throws CompilerException {
    Path root = targetDir.toAbsolutePath().normalize();
    for (String file : project.files().keySet()) {
      if (!root.resolve(file).normalize().startsWith(root)) {
        throw new CompilerException(
            String.format("output file \"%s\" lies outside of %s", file, targetDir));
      }
    }
    cleanUp(targetDir, project.rootDirectories());
    for (Map.Entry<String, String> file : project.files().entrySet()) {
      Path path = targetDir.resolve(file.getKey());
      try {
        MoreFiles.createParentDirectories(path);
        MoreFiles.asCharSink(path, StandardCharsets.UTF_8).write(file.getValue());
      } catch (IOException ex) {
        throw new CompilerException(String.format("cannot write %s", path), ex);
      }
      LOGGER.debug("Wrote {}", path);
    }
    LOGGER.info("Wrote {} files to {}", project.files().size(), targetDir);
  }

  private static ImmutableList<Path> list(Path dir) throws CompilerException {
    try (Stream<Path> items = Files.list(dir)) {
      return items.sorted().collect(ImmutableList.toImmutableList());
    } catch (IOException ex) {
      throw new CompilerException(String.format("cannot list %s", dir), ex);
    }
  }
}
