package com.vidnyan.playscan.domain.scope;

import com.vidnyan.playscan.domain.ast.AstNode;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Scopes of one analysis unit and the precedence-aware lookup over them.
 *
 * Lookup walks from a scope to the root. For every tier the nearest scope holding the name
 * contributes its definitions; the highest tier present wins and same-tier definitions of
 * that scope all contribute.
 */
public class ScopeTree {

    private final Scope root;
    private final Map<AstNode, Scope> scopes;

    ScopeTree(Scope root, Map<AstNode, Scope> scopes) {
        this.root = root;
        this.scopes = Collections.unmodifiableMap(new IdentityHashMap<>(scopes));
    }

    public Scope root() {
        return root;
    }

    public Collection<Scope> scopes() {
        return scopes.values();
    }

    /**
     * Scope of the nearest node at or above the given one that opens a scope.
     */
    public Scope scopeOf(AstNode node) {
        AstNode current = node;
        while (current != null) {
            Scope scope = scopes.get(current);
            if (scope != null) {
                return scope;
            }
            current = current.parent().orElse(null);
        }
        return root;
    }

    public Set<AstNode> resolve(Scope scope, String name) {
        return resolve(scope, name, def -> true);
    }

    /**
     * Definitions of the name visible from the scope that pass the filter, highest tier only.
     * Empty when the name is undefined.
     */
    public Set<AstNode> resolve(Scope scope, String name, Predicate<AstNode> visible) {
        NavigableMap<PrecedenceTier, Set<AstNode>> byTier = candidates(scope, name, visible);
        return byTier.isEmpty() ? Set.of() : Collections.unmodifiableSet(byTier.lastEntry().getValue());
    }

    /**
     * All tiers at which the name is visible from the scope, each with the definitions of the
     * nearest scope holding that tier. Ordered by ascending precedence.
     */
    public NavigableMap<PrecedenceTier, Set<AstNode>> candidates(Scope scope, String name,
                                                                  Predicate<AstNode> visible) {
        Map<PrecedenceTier, Set<AstNode>> found = new EnumMap<>(PrecedenceTier.class);
        for (Scope current = scope; current != null; current = current.parent().orElse(null)) {
            current.definitionsOf(name).forEach((tier, defs) -> {
                if (found.containsKey(tier)) {
                    return;
                }
                Set<AstNode> kept = new LinkedHashSet<>();
                defs.stream().filter(visible).forEach(kept::add);
                if (!kept.isEmpty()) {
                    found.put(tier, kept);
                }
            });
        }
        return new TreeMap<>(found);
    }
}
