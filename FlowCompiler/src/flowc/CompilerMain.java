package flowc;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CompilerMain {
  private static final Logger LOGGER = LoggerFactory.getLogger(CompilerMain.class);

  private static final String DEFAULT_CONFIG = "flowc.properties";

  public static void main(String[] args) {
    if (args.length > 1) {
      System.err.println("Usage: $COMPILER [config.properties]");
      System.exit(1);
    }
    Path configFile = Path.of(args.length == 1 ? args[0] : DEFAULT_CONFIG);

    try {
      run(configFile);
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
    }
    System.out.println("Compilation succeeded!");
  }

  public static ScriptProject run(Path configFile) throws CompilerException {
    CompilerConfig config = ConfigLoader.load(configFile);
    LOGGER.info("Compiling {} into {}", config.exportFile(), config.targetDir());

    FlowExport export = new ExportReader().read(config.exportFile());
    ScriptProject project =
        ScriptProject.compile(export, config, new DirectoryAssetTree(config.resolvedGameDir()));
    new OutputWriter(config).write(config.targetDir(), project);

    if (!project.diagnostics().isEmpty()) {
      LOGGER.warn(
          "{} warnings, see {}",
          project.diagnostics().size(),
          config.targetDir().resolve(config.logFileName()));
    }
    return project;
  }
}
