package com.vidnyan.playscan.domain.scope;

import com.vidnyan.playscan.domain.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Variable scope opened by one AST node.
 * Holds its own definitions per precedence tier plus the scopes of variable files it loaded.
 */
public class Scope {

    private final AstNode owner;
    private final Scope parent;
    private final Map<PrecedenceTier, Map<String, Set<AstNode>>> definitions = new EnumMap<>(PrecedenceTier.class);
    private final List<Scope> attachedFiles = new ArrayList<>();

    Scope(AstNode owner, Scope parent) {
        this.owner = owner;
        this.parent = parent;
    }

    public AstNode owner() {
        return owner;
    }

    public Optional<Scope> parent() {
        return Optional.ofNullable(parent);
    }

    public List<Scope> attachedFiles() {
        return Collections.unmodifiableList(attachedFiles);
    }

    void define(AstNode definition) {
        PrecedenceTier tier = definition.tier()
                .orElseThrow(() -> new IllegalArgumentException(definition + " has no precedence tier"));
        String name = definition.name()
                .orElseThrow(() -> new IllegalArgumentException(definition + " has no name"));
        definitions.computeIfAbsent(tier, t -> new HashMap<>())
                .computeIfAbsent(name, n -> new LinkedHashSet<>())
                .add(definition);
    }

    void attach(Scope file) {
        attachedFiles.add(file);
    }

    /**
     * Definitions of a name held by this scope and its attached files, per tier.
     */
    public Map<PrecedenceTier, Set<AstNode>> definitionsOf(String name) {
        Map<PrecedenceTier, Set<AstNode>> result = new EnumMap<>(PrecedenceTier.class);
        collect(name, result);
        for (Scope file : attachedFiles) {
            file.collect(name, result);
        }
        return result;
    }

    /**
     * Every definition registered directly on this scope.
     */
    public List<AstNode> ownDefinitions() {
        List<AstNode> all = new ArrayList<>();
        definitions.values().forEach(byName -> byName.values().forEach(all::addAll));
        return all;
    }

    private void collect(String name, Map<PrecedenceTier, Set<AstNode>> into) {
        definitions.forEach((tier, byName) -> {
            Set<AstNode> defs = byName.get(name);
            if (defs != null) {
                into.computeIfAbsent(tier, t -> new LinkedHashSet<>()).addAll(defs);
            }
        });
    }

    @Override
    public String toString() {
        return "Scope[" + owner.label() + "]";
    }
}
