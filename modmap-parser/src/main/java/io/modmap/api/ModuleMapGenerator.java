package io.modmap.api;

import io.modmap.ast.ModuleMapFile;
import io.modmap.impl.ModuleMapRenderer;
import java.util.Objects;

/**
 * Generates module map text from a tree, the reverse of {@link ModuleMapParser}.
 *
 * <p>Text generated from a parsed file parses back to an equal tree, and regenerating canonical
 * text with the same options reproduces it byte for byte.
 */
public final class ModuleMapGenerator {

  private ModuleMapGenerator() {}

  /**
   * Generates text using {@link GeneratorOptions#DEFAULT}.
   *
   * @throws NullPointerException if file is null
   */
  public static String generate(ModuleMapFile file) {
    return generate(file, GeneratorOptions.DEFAULT);
  }

  /**
   * Generates text with custom options.
   *
   * @param file the tree to render
   * @param options generator options
   * @return module map text without a trailing newline
   * @throws NullPointerException if file or options is null
   */
  public static String generate(ModuleMapFile file, GeneratorOptions options) {
    Objects.requireNonNull(file, "file must not be null");
    Objects.requireNonNull(options, "options must not be null");
    return new ModuleMapRenderer(options.indentation()).render(file);
  }
}
