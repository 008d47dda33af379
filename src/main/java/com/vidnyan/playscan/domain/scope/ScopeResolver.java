package com.vidnyan.playscan.domain.scope;

import com.vidnyan.playscan.domain.ast.AstKind;
import com.vidnyan.playscan.domain.ast.AstNode;
import lombok.extern.slf4j.Slf4j;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Builds the scope tree of an expanded AST and registers every variable definition.
 *
 * Lexical definitions go to the scope of the node that owns them. Runtime definitions
 * ({@code set_fact}, {@code register}, {@code include_vars}) go to the unit root scope, since
 * facts outlive the block that sets them. Loop variables stay on their task.
 * Variable files contribute to the scope that loaded them.
 */
@Slf4j
public class ScopeResolver {

    public ScopeTree resolveScopes(AstNode root) {
        Map<AstNode, Scope> scopes = new IdentityHashMap<>();
        Scope rootScope = new Scope(root, null);
        scopes.put(root, rootScope);

        root.descendants().skip(1)
                .filter(node -> node.kind().opensScope())
                .forEach(node -> scopes.put(node, openScope(node, scopes, rootScope)));

        int definitions = 0;
        for (AstNode node : (Iterable<AstNode>) root.descendants()::iterator) {
            if (node.kind() == AstKind.VARIABLE_DEFINITION) {
                registrationScope(node, scopes, rootScope).define(node);
                definitions++;
            }
        }
        log.debug("Resolved {} scopes with {} definitions for {}", scopes.size(), definitions, root.label());
        return new ScopeTree(rootScope, scopes);
    }

    private Scope openScope(AstNode node, Map<AstNode, Scope> scopes, Scope rootScope) {
        Scope parent = enclosingScope(node, scopes, rootScope);
        Scope scope = new Scope(node, parent);
        if (node.kind() == AstKind.VARIABLE_FILE) {
            boolean runtime = node.tier().map(PrecedenceTier::isRuntime).orElse(false);
            loadingScope(node, scopes, rootScope, runtime).attach(scope);
        }
        return scope;
    }

    /**
     * Scope a variable file contributes to. A file loaded by a directive contributes to the
     * directive's container, since its variables are visible beyond the directive itself.
     */
    private Scope loadingScope(AstNode file, Map<AstNode, Scope> scopes, Scope rootScope, boolean runtime) {
        if (runtime) {
            return rootScope;
        }
        AstNode loader = file.parent().orElse(null);
        if (loader != null && loader.kind().isDirective()) {
            return enclosingScope(loader, scopes, rootScope);
        }
        return loader != null ? scopes.getOrDefault(loader, rootScope) : rootScope;
    }

    private Scope registrationScope(AstNode definition, Map<AstNode, Scope> scopes, Scope rootScope) {
        AstNode owner = definition.parent().orElse(null);
        if (owner != null && owner.kind() == AstKind.LOOP) {
            return enclosingScope(owner, scopes, rootScope);
        }
        if (owner != null && owner.kind() == AstKind.VARIABLE_FILE) {
            return scopes.get(owner);
        }
        if (definition.tier().map(PrecedenceTier::isRuntime).orElse(false)) {
            return rootScope;
        }
        return owner != null ? enclosingScopeInclusive(owner, scopes, rootScope) : rootScope;
    }

    private static Scope enclosingScope(AstNode node, Map<AstNode, Scope> scopes, Scope rootScope) {
        return node.parent().map(p -> enclosingScopeInclusive(p, scopes, rootScope)).orElse(rootScope);
    }

    private static Scope enclosingScopeInclusive(AstNode node, Map<AstNode, Scope> scopes, Scope rootScope) {
        for (AstNode current = node; current != null; current = current.parent().orElse(null)) {
            Scope scope = scopes.get(current);
            if (scope != null) {
                return scope;
            }
        }
        return rootScope;
    }
}
