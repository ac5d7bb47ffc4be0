package io.modmap.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST model for the Clang module map language.
 *
 * <p>Every node is an immutable record; closed sets of alternatives are sealed interfaces. Nodes
 * carry no source locations.
 *
 * <pre>
 * framework module MyLib [system] {
 *     umbrella header "MyLib.h"
 *     module Sub {
 *         requires objc, !blocks
 *         private header "Sub.h"
 *     }
 *     explicit module * {
 *         export *
 *     }
 * }
 *
 * extern module Other "other/module.modulemap"
 * </pre>
 */
public final class ModuleMap {

  private ModuleMap() {}

  // === Module declarations ===

  /** A module defined in the containing file or referenced from another one. */
  public sealed interface ModuleDeclaration
      permits LocalModuleDeclaration, ExternModuleDeclaration {}

  /**
   * Parts shared by a module body and an inferred submodule body: both render as {@code
   * [explicit] [framework] module <id> [attr]... { members }}.
   */
  public sealed interface ModuleBody permits LocalModuleDeclaration, InferredSubmoduleDeclaration {
    boolean explicit();

    boolean framework();

    /** The text rendered in the module id position. */
    String moduleIdText();

    List<String> attributes();
  }

  /**
   * A module declared with a body of members.
   *
   * @param explicit only meaningful for submodules; the contents are only visible when the
   *     submodule is named explicitly in an import
   * @param framework the module corresponds to a Darwin-style framework
   */
  public record LocalModuleDeclaration(
      boolean explicit,
      boolean framework,
      ModuleId moduleId,
      List<String> attributes,
      List<ModuleMember> members)
      implements ModuleDeclaration, ModuleBody {

    public LocalModuleDeclaration {
      Objects.requireNonNull(moduleId, "moduleId must not be null");
      attributes = List.copyOf(attributes);
      members = List.copyOf(members);
    }

    @Override
    public String moduleIdText() {
      return moduleId.toString();
    }
  }

  /**
   * A module declared in another module map file.
   *
   * @param filePath absolute path or path relative to the containing file, without quotes
   */
  public record ExternModuleDeclaration(ModuleId moduleId, String filePath)
      implements ModuleDeclaration {
    public ExternModuleDeclaration {
      Objects.requireNonNull(moduleId, "moduleId must not be null");
      Objects.requireNonNull(filePath, "filePath must not be null");
    }
  }

  /** Dotted module name such as {@code Foo.Bar}. */
  public record ModuleId(List<String> components) {
    public ModuleId {
      components = List.copyOf(components);
      if (components.isEmpty()) {
        throw new IllegalArgumentException("Module id must have at least one component");
      }
    }

    public static ModuleId of(String... components) {
      return new ModuleId(List.of(components));
    }

    /** Dot-joined canonical form. */
    @Override
    public String toString() {
      return String.join(".", components);
    }
  }

  // === Module members ===

  /** Members that can appear in a module body. Their order is preserved. */
  public sealed interface ModuleMember
      permits RequiresDeclaration,
          HeaderDeclaration,
          UmbrellaDirectoryDeclaration,
          SubmoduleDeclaration,
          ExportDeclaration,
          ExportAsDeclaration,
          UseDeclaration,
          LinkDeclaration,
          ConfigMacrosDeclaration,
          ConflictDeclaration {}

  /** {@code requires feature, !feature} */
  public record RequiresDeclaration(List<Feature> features) implements ModuleMember {
    public RequiresDeclaration {
      features = List.copyOf(features);
      if (features.isEmpty()) {
        throw new IllegalArgumentException("requires needs at least one feature");
      }
    }
  }

  /**
   * A language dialect, platform, environment or target feature.
   *
   * @param incompatible the module is unavailable when the feature is present ({@code !feature})
   */
  public record Feature(boolean incompatible, String identifier) {
    public Feature {
      Objects.requireNonNull(identifier, "identifier must not be null");
    }
  }

  /** {@code [private] [textual] header "path"}, {@code umbrella header}, {@code exclude header}. */
  public record HeaderDeclaration(
      HeaderKind kind, String filePath, List<HeaderAttribute> headerAttributes)
      implements ModuleMember {
    public HeaderDeclaration {
      Objects.requireNonNull(kind, "kind must not be null");
      Objects.requireNonNull(filePath, "filePath must not be null");
      headerAttributes = List.copyOf(headerAttributes);
    }
  }

  /** How a header contributes to its module. */
  public sealed interface HeaderKind
      permits StandardHeader, TextualHeader, UmbrellaHeader, ExcludedHeader {}

  /** Parsed and compiled into the enclosing module. */
  public record StandardHeader(boolean isPrivate) implements HeaderKind {}

  /** Not compiled with the module, textually included where named by {@code #include}. */
  public record TextualHeader(boolean isPrivate) implements HeaderKind {}

  /** Includes every header of its directory. */
  public record UmbrellaHeader() implements HeaderKind {}

  /** Neither compiled nor considered part of the module. */
  public record ExcludedHeader() implements HeaderKind {}

  /** {@code size 123} or {@code mtime 456} inside a header attribute block. */
  public record HeaderAttribute(String key, long value) {
    public HeaderAttribute {
      Objects.requireNonNull(key, "key must not be null");
    }
  }

  /** {@code umbrella "directory"} */
  public record UmbrellaDirectoryDeclaration(String filePath) implements ModuleMember {
    public UmbrellaDirectoryDeclaration {
      Objects.requireNonNull(filePath, "filePath must not be null");
    }
  }

  /** A module nested in the member list of another module. */
  public sealed interface SubmoduleDeclaration extends ModuleMember
      permits ModuleSubmodule, InferredSubmoduleDeclaration {}

  /** An ordinary nested module, local or extern. */
  public record ModuleSubmodule(ModuleDeclaration declaration) implements SubmoduleDeclaration {
    public ModuleSubmodule {
      Objects.requireNonNull(declaration, "declaration must not be null");
    }
  }

  /**
   * {@code module * { export * }}: one submodule per header not covered by a header declaration.
   */
  public record InferredSubmoduleDeclaration(
      boolean explicit,
      boolean framework,
      List<String> attributes,
      List<InferredSubmoduleMember> members)
      implements SubmoduleDeclaration, ModuleBody {

    public InferredSubmoduleDeclaration {
      attributes = List.copyOf(attributes);
      members = List.copyOf(members);
    }

    @Override
    public String moduleIdText() {
      return "*";
    }
  }

  /** The {@code export *} member of an inferred submodule. */
  public record InferredSubmoduleMember() {}

  /** {@code export A.B.*} */
  public record ExportDeclaration(WildcardModuleId moduleId) implements ModuleMember {
    public ExportDeclaration {
      Objects.requireNonNull(moduleId, "moduleId must not be null");
    }
  }

  /**
   * Module id prefix, optionally closed by {@code *}. A lone {@code *} has no components.
   */
  public record WildcardModuleId(List<String> components, boolean trailingStar) {
    public WildcardModuleId {
      components = List.copyOf(components);
      if (components.isEmpty() && !trailingStar) {
        throw new IllegalArgumentException("Wildcard module id without components must be '*'");
      }
    }

    @Override
    public String toString() {
      if (components.isEmpty()) {
        return "*";
      }
      return String.join(".", components) + (trailingStar ? ".*" : "");
    }
  }

  /** {@code export_as Name} */
  public record ExportAsDeclaration(String identifier) implements ModuleMember {
    public ExportAsDeclaration {
      Objects.requireNonNull(identifier, "identifier must not be null");
    }
  }

  /** {@code use Foo.Bar} */
  public record UseDeclaration(ModuleId moduleId) implements ModuleMember {
    public UseDeclaration {
      Objects.requireNonNull(moduleId, "moduleId must not be null");
    }
  }

  /**
   * {@code link [framework] "name"}
   *
   * @param framework link with {@code -framework name} instead of {@code -lname}
   */
  public record LinkDeclaration(boolean framework, String libraryOrFrameworkName)
      implements ModuleMember {
    public LinkDeclaration {
      Objects.requireNonNull(libraryOrFrameworkName, "libraryOrFrameworkName must not be null");
    }
  }

  /** {@code config_macros [exhaustive] NDEBUG, LOG_LEVEL} */
  public record ConfigMacrosDeclaration(List<String> attributes, List<String> macroNames)
      implements ModuleMember {
    public ConfigMacrosDeclaration {
      attributes = List.copyOf(attributes);
      macroNames = List.copyOf(macroNames);
    }
  }

  /** {@code conflict Other, "message"} */
  public record ConflictDeclaration(ModuleId moduleId, String diagnosticMessage)
      implements ModuleMember {
    public ConflictDeclaration {
      Objects.requireNonNull(moduleId, "moduleId must not be null");
      Objects.requireNonNull(diagnosticMessage, "diagnosticMessage must not be null");
    }
  }
}
