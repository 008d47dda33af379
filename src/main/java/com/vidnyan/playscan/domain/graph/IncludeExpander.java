package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.ast.AstKind;
import com.vidnyan.playscan.domain.ast.AstNode;
import com.vidnyan.playscan.domain.ast.ChildRole;
import com.vidnyan.playscan.domain.ast.ModuleNames;
import com.vidnyan.playscan.domain.ast.RoleSources;
import com.vidnyan.playscan.domain.ast.StructuralModelBuilder;
import com.vidnyan.playscan.domain.error.CyclicIncludeException;
import com.vidnyan.playscan.domain.error.Diagnostic;
import com.vidnyan.playscan.domain.error.DiagnosticType;
import com.vidnyan.playscan.domain.error.RawTreeLoadException;
import com.vidnyan.playscan.domain.error.RoleNotFoundException;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.scope.PrecedenceTier;
import com.vidnyan.playscan.domain.template.TemplateReferenceExtractor;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads and grafts the content of directives while the graph walk reaches them.
 *
 * Keeps the expansion stack of the current build: entering a directive whose file or role
 * is already on the stack is a cycle. One instance per build, never shared.
 */
@Slf4j
class IncludeExpander {

    private final ScriptSource source;
    private final StructuralModelBuilder models;
    private final List<Diagnostic> diagnostics;
    private final Deque<String> stack = new ArrayDeque<>();
    private final Map<AstNode, String> pushed = new IdentityHashMap<>();

    IncludeExpander(ScriptSource source, StructuralModelBuilder models, List<Diagnostic> diagnostics) {
        this.source = source;
        this.models = models;
        this.diagnostics = diagnostics;
    }

    /**
     * Mark the unit root file or role as being expanded.
     */
    void enterRoot(String key) {
        stack.push(key);
    }

    /**
     * Expand the directive if needed and push it on the expansion stack.
     *
     * @throws CyclicIncludeException when the directive's target is already being expanded
     * @throws RoleNotFoundException when a role include names an unknown role
     */
    void enter(AstNode directive) {
        if (directive.isUnanalyzable()) {
            return;
        }
        String target = directive.target().orElse("");
        if (TemplateReferenceExtractor.isTemplated(target)) {
            record(DiagnosticType.MISSING_INCLUDE, directive,
                    "Include target '" + target + "' is templated and cannot be resolved statically");
            return;
        }
        if (directive.kind() == AstKind.ROLE_INCLUDE) {
            enterRole(directive, target);
        } else {
            enterFile(directive, target);
        }
    }

    /**
     * Pop the directive if {@link #enter} pushed it.
     */
    void leave(AstNode directive) {
        if (pushed.remove(directive) != null) {
            stack.pop();
        }
    }

    private void enterRole(AstNode directive, String roleName) {
        String key = "role:" + roleName;
        push(directive, key);
        if (directive.isExpanded()) {
            return;
        }
        RoleSources role;
        try {
            role = source.loadRole(roleName, baseDirectory(directive));
        } catch (RoleNotFoundException e) {
            record(DiagnosticType.ROLE_NOT_FOUND, directive, e.getMessage());
            throw e;
        }
        log.debug("Expanding role {} from {}", roleName, role.rootPath());
        directive.graft(List.of(models.buildRole(role)));
    }

    private void enterFile(AstNode directive, String target) {
        String action = directive.module().orElse("");
        boolean varsFile = ModuleNames.INCLUDE_VARS.contains(action) || "vars_files".equals(action);

        Optional<Path> file = locate(directive, target, varsFile ? "vars" : "tasks");
        if (file.isEmpty()) {
            record(DiagnosticType.MISSING_INCLUDE, directive, "Included file '" + target + "' not found");
            return;
        }
        push(directive, file.get().toString());
        if (directive.isExpanded()) {
            return;
        }

        RawNode content;
        try {
            content = source.load(file.get());
        } catch (RawTreeLoadException e) {
            record(DiagnosticType.MISSING_INCLUDE, directive, e.getMessage());
            return;
        }
        log.debug("Expanding {} {}", action, file.get());
        if (varsFile) {
            PrecedenceTier tier = directive.tier().orElse(PrecedenceTier.INCLUDE_VARS);
            directive.graft(List.of(models.buildVariableFile(content, tier, ChildRole.INCLUDED)));
        } else if ("import_playbook".equals(action)) {
            directive.graft(models.buildIncludedPlays(content));
        } else {
            directive.graft(models.buildIncludedTasks(content, directive.isHandlerContext()));
        }
    }

    private void push(AstNode directive, String key) {
        if (stack.contains(key)) {
            List<String> cycle = new ArrayList<>();
            List<String> bottomUp = new ArrayList<>(stack);
            Collections.reverse(bottomUp);
            cycle.addAll(bottomUp.subList(bottomUp.indexOf(key), bottomUp.size()));
            cycle.add(key);
            CyclicIncludeException error = new CyclicIncludeException(cycle);
            record(DiagnosticType.CYCLIC_INCLUDE, directive, error.getMessage());
            throw error;
        }
        stack.push(key);
        pushed.put(directive, key);
    }

    /**
     * Candidate locations: the role's own subdirectory first, then next to the including file.
     */
    private Optional<Path> locate(AstNode directive, String target, String roleSubdirectory) {
        Path targetPath = Path.of(target);
        if (targetPath.isAbsolute()) {
            return source.exists(targetPath) ? Optional.of(targetPath) : Optional.empty();
        }
        List<Path> candidates = new ArrayList<>();
        enclosingRoleRoot(directive).ifPresent(root -> candidates.add(root.resolve(roleSubdirectory).resolve(target)));
        Path dir = directoryOf(directive);
        candidates.add(dir != null ? dir.resolve(target) : targetPath);
        return candidates.stream()
                .map(Path::normalize)
                .filter(source::exists)
                .findFirst();
    }

    private Path baseDirectory(AstNode directive) {
        return enclosingRoleRoot(directive)
                .map(root -> root.getParent() != null ? root.getParent() : Path.of(""))
                .orElseGet(() -> {
                    Path dir = directoryOf(directive);
                    return dir != null ? dir : Path.of("");
                });
    }

    private static Optional<Path> enclosingRoleRoot(AstNode node) {
        return node.enclosing(AstKind.ROLE)
                .flatMap(AstNode::target)
                .map(Path::of);
    }

    private static Path directoryOf(AstNode node) {
        if (!node.location().isKnown()) {
            return null;
        }
        return Path.of(node.location().filePath()).getParent();
    }

    private void record(DiagnosticType type, AstNode node, String message) {
        log.warn("{} at {}: {}", type, node.location().format(), message);
        diagnostics.add(Diagnostic.of(type, message, node.location(), node.id()));
    }
}
