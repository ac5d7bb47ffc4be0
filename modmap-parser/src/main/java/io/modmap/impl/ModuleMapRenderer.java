package io.modmap.impl;

import io.modmap.api.Indentation;
import io.modmap.ast.ModuleMap.ConfigMacrosDeclaration;
import io.modmap.ast.ModuleMap.ConflictDeclaration;
import io.modmap.ast.ModuleMap.ExcludedHeader;
import io.modmap.ast.ModuleMap.ExportAsDeclaration;
import io.modmap.ast.ModuleMap.ExportDeclaration;
import io.modmap.ast.ModuleMap.ExternModuleDeclaration;
import io.modmap.ast.ModuleMap.Feature;
import io.modmap.ast.ModuleMap.HeaderAttribute;
import io.modmap.ast.ModuleMap.HeaderDeclaration;
import io.modmap.ast.ModuleMap.HeaderKind;
import io.modmap.ast.ModuleMap.InferredSubmoduleDeclaration;
import io.modmap.ast.ModuleMap.LinkDeclaration;
import io.modmap.ast.ModuleMap.LocalModuleDeclaration;
import io.modmap.ast.ModuleMap.ModuleBody;
import io.modmap.ast.ModuleMap.ModuleDeclaration;
import io.modmap.ast.ModuleMap.ModuleMember;
import io.modmap.ast.ModuleMap.ModuleSubmodule;
import io.modmap.ast.ModuleMap.RequiresDeclaration;
import io.modmap.ast.ModuleMap.StandardHeader;
import io.modmap.ast.ModuleMap.TextualHeader;
import io.modmap.ast.ModuleMap.UmbrellaDirectoryDeclaration;
import io.modmap.ast.ModuleMap.UmbrellaHeader;
import io.modmap.ast.ModuleMap.UseDeclaration;
import io.modmap.ast.ModuleMapFile;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a module map tree as canonical text, the inverse of {@link RecursiveDescentParser}.
 *
 * <p>Each member goes on its own line one level deeper than its module; top-level declarations are
 * separated by one blank line and the output has no trailing newline.
 */
public final class ModuleMapRenderer {

  private final Indentation indentation;

  public ModuleMapRenderer(Indentation indentation) {
    this.indentation = indentation;
  }

  public String render(ModuleMapFile file) {
    StringBuilder out = new StringBuilder();
    List<ModuleDeclaration> declarations = file.moduleDeclarations();
    for (int i = 0; i < declarations.size(); i++) {
      if (i > 0) {
        out.append("\n\n");
      }
      renderDeclaration(declarations.get(i), 0, out);
    }
    return out.toString();
  }

  private void renderDeclaration(ModuleDeclaration declaration, int depth, StringBuilder out) {
    if (declaration instanceof LocalModuleDeclaration local) {
      renderBody(local, depth, out);
    } else if (declaration instanceof ExternModuleDeclaration extern) {
      out.append(indentation.at(depth))
          .append("extern module ")
          .append(extern.moduleId())
          .append(' ')
          .append(quoted(extern.filePath()));
    } else {
      throw new IllegalStateException("Unknown module declaration: " + declaration);
    }
  }

  /** Declaration line, one line per member, closing brace. */
  private void renderBody(ModuleBody body, int depth, StringBuilder out) {
    List<String> components = new ArrayList<>();
    if (body.explicit()) {
      components.add("explicit");
    }
    if (body.framework()) {
      components.add("framework");
    }
    components.add("module");
    components.add(body.moduleIdText());
    for (String attribute : body.attributes()) {
      components.add("[" + attribute + "]");
    }
    components.add("{");
    out.append(indentation.at(depth)).append(String.join(" ", components));

    if (body instanceof LocalModuleDeclaration local) {
      for (ModuleMember member : local.members()) {
        out.append('\n');
        renderMember(member, depth + 1, out);
      }
    } else if (body instanceof InferredSubmoduleDeclaration inferred) {
      for (int i = 0; i < inferred.members().size(); i++) {
        out.append('\n').append(indentation.at(depth + 1)).append("export *");
      }
    }
    out.append('\n').append(indentation.at(depth)).append('}');
  }

  private void renderMember(ModuleMember member, int depth, StringBuilder out) {
    if (member instanceof ModuleSubmodule submodule) {
      renderDeclaration(submodule.declaration(), depth, out);
    } else if (member instanceof InferredSubmoduleDeclaration inferred) {
      renderBody(inferred, depth, out);
    } else {
      out.append(indentation.at(depth)).append(memberLine(member));
    }
  }

  private static String memberLine(ModuleMember member) {
    if (member instanceof RequiresDeclaration requires) {
      return "requires "
          + requires.features().stream()
              .map(ModuleMapRenderer::feature)
              .collect(Collectors.joining(", "));
    } else if (member instanceof HeaderDeclaration header) {
      return header(header);
    } else if (member instanceof UmbrellaDirectoryDeclaration umbrella) {
      return "umbrella " + quoted(umbrella.filePath());
    } else if (member instanceof ExportDeclaration export) {
      return "export " + export.moduleId();
    } else if (member instanceof ExportAsDeclaration exportAs) {
      return "export_as " + exportAs.identifier();
    } else if (member instanceof UseDeclaration use) {
      return "use " + use.moduleId();
    } else if (member instanceof LinkDeclaration link) {
      return (link.framework() ? "link framework " : "link ")
          + quoted(link.libraryOrFrameworkName());
    } else if (member instanceof ConfigMacrosDeclaration macros) {
      return configMacros(macros);
    } else if (member instanceof ConflictDeclaration conflict) {
      return "conflict " + conflict.moduleId() + ", " + quoted(conflict.diagnosticMessage());
    }
    throw new IllegalStateException("Unknown module member: " + member);
  }

  private static String feature(Feature feature) {
    return (feature.incompatible() ? "!" : "") + feature.identifier();
  }

  private static String header(HeaderDeclaration header) {
    List<String> components = new ArrayList<>(headerKind(header.kind()));
    components.add("header");
    components.add(quoted(header.filePath()));
    if (!header.headerAttributes().isEmpty()) {
      components.add("{");
      for (HeaderAttribute attribute : header.headerAttributes()) {
        components.add(attribute.key() + " " + attribute.value());
      }
      components.add("}");
    }
    return String.join(" ", components);
  }

  private static List<String> headerKind(HeaderKind kind) {
    if (kind instanceof StandardHeader standard) {
      return standard.isPrivate() ? List.of("private") : List.of();
    } else if (kind instanceof TextualHeader textual) {
      return textual.isPrivate() ? List.of("private", "textual") : List.of("textual");
    } else if (kind instanceof UmbrellaHeader) {
      return List.of("umbrella");
    } else if (kind instanceof ExcludedHeader) {
      return List.of("exclude");
    }
    throw new IllegalStateException("Unknown header kind: " + kind);
  }

  private static String configMacros(ConfigMacrosDeclaration macros) {
    List<String> components = new ArrayList<>();
    components.add("config_macros");
    for (String attribute : macros.attributes()) {
      components.add("[" + attribute + "]");
    }
    if (!macros.macroNames().isEmpty()) {
      components.add(String.join(", ", macros.macroNames()));
    }
    return String.join(" ", components);
  }

  private static String quoted(String value) {
    return "\"" + value + "\"";
  }
}
