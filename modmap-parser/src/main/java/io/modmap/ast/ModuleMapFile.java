package io.modmap.ast;

import io.modmap.ast.ModuleMap.ModuleDeclaration;
import java.util.List;

/**
 * Root of a parsed module map: the top-level module declarations in source order.
 *
 * <p>Instances come from {@link io.modmap.api.ModuleMapParser} or are built by hand and passed to
 * {@link io.modmap.api.ModuleMapGenerator}.
 */
public record ModuleMapFile(List<ModuleDeclaration> moduleDeclarations) {

  public ModuleMapFile {
    moduleDeclarations = List.copyOf(moduleDeclarations);
  }

  public static ModuleMapFile of(ModuleDeclaration... moduleDeclarations) {
    return new ModuleMapFile(List.of(moduleDeclarations));
  }
}
