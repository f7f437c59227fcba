package flowc;

import java.nio.file.Files;
import java.nio.file.Path;

public final class DirectoryAssetTree implements AssetTree {
  private final Path root;

  public DirectoryAssetTree(Path root) {
    this.root = root;
  }

  @Override
  public boolean exists(String path) {
    return Files.isRegularFile(root.resolve(path));
  }

  @Override
  public String toString() {
    return root.toString();
  }
}
