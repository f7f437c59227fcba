package flowc;

@FunctionalInterface
public interface AssetTree {
  boolean exists(String path);
}
