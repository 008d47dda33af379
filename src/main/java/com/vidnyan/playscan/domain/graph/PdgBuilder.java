package com.vidnyan.playscan.domain.graph;

import com.vidnyan.playscan.domain.ast.AstIdGenerator;
import com.vidnyan.playscan.domain.ast.AstKind;
import com.vidnyan.playscan.domain.ast.AstNode;
import com.vidnyan.playscan.domain.ast.ChildRole;
import com.vidnyan.playscan.domain.ast.RoleSources;
import com.vidnyan.playscan.domain.ast.StructuralModelBuilder;
import com.vidnyan.playscan.domain.error.AnalysisException;
import com.vidnyan.playscan.domain.error.Diagnostic;
import com.vidnyan.playscan.domain.error.DiagnosticType;
import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawMapping;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawNodes;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;
import com.vidnyan.playscan.domain.scope.PrecedenceTier;
import com.vidnyan.playscan.domain.scope.Scope;
import com.vidnyan.playscan.domain.scope.ScopeResolver;
import com.vidnyan.playscan.domain.scope.ScopeTree;
import com.vidnyan.playscan.domain.template.TemplateReferenceExtractor;
import com.vidnyan.playscan.domain.template.TemplateReferences;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the program dependence graph of one analysis unit.
 *
 * <p>Control flow is laid out in one walk over the AST. Directives are expanded when the walk
 * reaches them, so file access and cycle detection happen in one place. Handler triggers are
 * linked once a whole play is laid out. Data flow is added afterwards: every referenced
 * variable of every step and definition becomes a USE node fed by REACHES edges from the
 * definitions that may be visible there.</p>
 *
 * <p>Stateless between builds; every call works on its own {@link Construction}.</p>
 */
@Slf4j
public class PdgBuilder {

    /**
     * Variables provided by the runtime rather than by the script.
     */
    static final Set<String> MAGIC_VARIABLES = Set.of(
            "inventory_hostname", "inventory_hostname_short", "inventory_dir", "inventory_file",
            "hostvars", "groups", "group_names", "play_hosts", "playbook_dir", "role_path",
            "role_name", "role_names", "omit", "environment", "vars", "lookup");

    private static final Set<String> EXPRESSION_KEYS = Set.of("when", "changed_when", "failed_when", "until");

    /**
     * Expressions evaluated after the module ran; they see the task's own registered result.
     */
    private static final Set<String> RESULT_EXPRESSION_KEYS = Set.of("changed_when", "failed_when", "until");

    private static final Set<String> NOT_SCANNED_TASK_KEYS = Set.of(
            "args", "action", "local_action", "vars", "block", "rescue", "always", "register");

    private static final Set<String> NOT_SCANNED_PLAY_KEYS = Set.of(
            "vars", "vars_files", "vars_prompt", "pre_tasks", "roles", "tasks", "post_tasks", "handlers");

    private static final Set<String> SCANNED_ROLE_ENTRY_KEYS = Set.of(
            "role", "name", "when", "become_user", "delegate_to", "environment");

    private final TemplateReferenceExtractor extractor = new TemplateReferenceExtractor();
    private final ScopeResolver scopeResolver = new ScopeResolver();

    /**
     * Load, expand and lay out the unit.
     *
     * @throws AnalysisException when the unit cannot be built; carries the diagnostics collected so far
     */
    public PdgBuildResult build(AnalysisUnit unit) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        StructuralModelBuilder models = new StructuralModelBuilder(new AstIdGenerator());
        IncludeExpander expander = new IncludeExpander(unit.source(), models, diagnostics);

        try {
            AstNode root = loadRoot(unit, models, expander);
            if (!unit.extraVars().isEmpty()) {
                Location origin = Location.at("extra vars", 1, 1);
                models.attachVariables(root, RawNodes.fromPlain(unit.extraVars(), origin), PrecedenceTier.EXTRA_VARS);
            }
            Construction construction = new Construction(unit.name(), root, expander, diagnostics);
            ProgramDependenceGraph graph = construction.run();

            ProgramDependenceGraph.Stats stats = graph.stats();
            log.info("Built PDG for {}: {} nodes, {} edges, {} diagnostics",
                    unit.name(), stats.nodeCount(), stats.edgeCount(), diagnostics.size());
            return new PdgBuildResult(graph, root, diagnostics);
        } catch (AnalysisException e) {
            throw e.withDiagnostics(diagnostics);
        }
    }

    private static AstNode loadRoot(AnalysisUnit unit, StructuralModelBuilder models, IncludeExpander expander) {
        if (unit.type() == AnalysisUnit.UnitType.ROLE) {
            Path roleDir = unit.path();
            Path base = roleDir.getParent() != null ? roleDir.getParent() : Path.of("");
            RoleSources sources = unit.source().loadRole(unit.name(), base);
            expander.enterRoot("role:" + unit.name());
            return models.buildRole(sources);
        }
        RawNode raw = unit.source().load(unit.path());
        expander.enterRoot(unit.path().normalize().toString());
        return models.buildPlaybook(raw, unit.path().toString());
    }

    /**
     * Outgoing control edge still waiting for its target.
     */
    private record Pending(String from, PdgEdgeType type, String guard, StaticGuard staticGuard, PdgEdgeType via) {

        static Pending sequence(String from) {
            return new Pending(from, PdgEdgeType.SEQUENCE, null, null, null);
        }

        static Pending of(String from, PdgEdgeType type) {
            return new Pending(from, type, null, null, null);
        }

        static Pending skipped(String from, String guard, StaticGuard staticGuard, PdgEdgeType via) {
            return new Pending(from, PdgEdgeType.BRANCH, guard, staticGuard, via);
        }

        PdgEdge to(String target) {
            if (type == PdgEdgeType.BRANCH) {
                return PdgEdge.branch(from, target, guard, false, staticGuard, via);
            }
            return PdgEdge.of(from, target, type);
        }

        /**
         * Edge type a guarded branch replaces, null for a plain sequence.
         */
        PdgEdgeType replacedType() {
            return type == PdgEdgeType.BRANCH ? via : type == PdgEdgeType.SEQUENCE ? null : type;
        }
    }

    /**
     * Units laid out for one play, for handler sequencing and trigger linking.
     */
    private static final class PlayContext {
        private final List<AstNode> handlers = new ArrayList<>();
        private final List<AstNode> units = new ArrayList<>();
    }

    /**
     * State of a single build.
     */
    private final class Construction {

        private final String unitName;
        private final AstNode root;
        private final IncludeExpander expander;
        private final List<Diagnostic> diagnostics;

        private final List<PdgNode> nodes = new ArrayList<>();
        private final List<PdgEdge> edges = new ArrayList<>();
        private final Map<AstNode, String> unitIds = new IdentityHashMap<>();
        private final Map<AstNode, String> definitionIds = new IdentityHashMap<>();
        private final Map<String, String> useIds = new HashMap<>();
        private final List<String> executableIds = new ArrayList<>();
        private int nextId;

        private ScopeTree scopes;
        private ControlFlowAnalysis controlFlow;

        Construction(String unitName, AstNode root, IncludeExpander expander, List<Diagnostic> diagnostics) {
            this.unitName = unitName;
            this.root = root;
            this.expander = expander;
            this.diagnostics = diagnostics;
        }

        ProgramDependenceGraph run() {
            String entry = addNode(PdgNode.builder(newId(), PdgNodeKind.ENTRY)
                    .astNode(root.id())
                    .location(root.location())
                    .label("entry " + unitName));

            List<Pending> ends = List.of(Pending.sequence(entry));
            if (root.kind() == AstKind.ROLE) {
                PlayContext play = new PlayContext();
                ends = walkRole(root, ends, play);
                ends = walkHandlers(play, ends);
                linkHandlers(play);
            } else {
                ends = walkSequence(controlFlowChildren(root), ends, null);
            }

            String exit = addNode(PdgNode.builder(newId(), PdgNodeKind.EXIT)
                    .astNode(root.id())
                    .location(root.location())
                    .label("exit " + unitName));
            connect(ends, exit);

            addDataFlow(entry);
            return ProgramDependenceGraph.of(unitName, nodes, edges, entry, exit);
        }

        // ---------------------------------------------------------- control flow

        private List<Pending> walkSequence(List<AstNode> units, List<Pending> ends, PlayContext play) {
            List<Pending> current = ends;
            for (AstNode unit : units) {
                current = walkUnit(unit, current, play, false);
            }
            return current;
        }

        private List<Pending> walkUnit(AstNode unit, List<Pending> ends, PlayContext play, boolean notified) {
            return switch (unit.kind()) {
                case PLAY -> walkPlay(unit, ends);
                case BLOCK -> walkBlock(unit, ends, play, notified);
                case TASK, HANDLER -> walkTask(unit, ends, play, notified);
                case INCLUDE_DIRECTIVE, IMPORT_DIRECTIVE, ROLE_INCLUDE -> walkDirective(unit, ends, play, notified);
                case ROLE -> walkRole(unit, ends, play);
                default -> ends;
            };
        }

        private List<Pending> walkPlay(AstNode playNode, List<Pending> ends) {
            String id = addUnitNode(playNode, PdgNodeKind.PLAY, null);
            connect(ends, id);

            for (AstNode directive : playNode.children(ChildRole.VARS)) {
                if (directive.kind().isDirective()) {
                    expander.enter(directive);
                    expander.leave(directive);
                }
            }

            PlayContext play = new PlayContext();
            play.handlers.addAll(playNode.children(ChildRole.HANDLERS));

            List<Pending> current = List.of(Pending.sequence(id));
            current = walkSequence(playNode.children(ChildRole.PRE_TASKS), current, play);
            current = walkSequence(playNode.children(ChildRole.ROLES), current, play);
            current = walkSequence(playNode.children(ChildRole.TASKS), current, play);
            current = walkSequence(playNode.children(ChildRole.POST_TASKS), current, play);
            current = walkHandlers(play, current);
            linkHandlers(play);
            return current;
        }

        private List<Pending> walkRole(AstNode role, List<Pending> ends, PlayContext play) {
            String id = addUnitNode(role, PdgNodeKind.ROLE, play);
            connect(ends, id);
            List<Pending> current = List.of(Pending.sequence(id));
            current = walkSequence(role.children(ChildRole.ROLES), current, play);
            current = walkSequence(role.children(ChildRole.TASKS), current, play);
            if (play != null) {
                play.handlers.addAll(role.children(ChildRole.HANDLERS));
            }
            return current;
        }

        /**
         * Handlers run after the play body, each only when notified.
         */
        private List<Pending> walkHandlers(PlayContext play, List<Pending> ends) {
            List<Pending> current = ends;
            for (int i = 0; i < play.handlers.size(); i++) {
                current = walkUnit(play.handlers.get(i), current, play, true);
            }
            return current;
        }

        private List<Pending> walkTask(AstNode task, List<Pending> ends, PlayContext play, boolean notified) {
            PdgNodeKind kind = task.kind() == AstKind.HANDLER ? PdgNodeKind.HANDLER : PdgNodeKind.TASK;
            String id = addUnitNode(task, kind, play);
            List<Pending> skips = enter(task, id, ends, notified);
            if (task.loop().isPresent()) {
                edges.add(PdgEdge.of(id, id, PdgEdgeType.LOOP_ITERATE));
            }
            List<Pending> out = new ArrayList<>();
            out.add(Pending.sequence(id));
            out.addAll(skips);
            return out;
        }

        private List<Pending> walkDirective(AstNode directive, List<Pending> ends, PlayContext play, boolean notified) {
            PdgNodeKind kind = directive.kind() == AstKind.ROLE_INCLUDE ? PdgNodeKind.ROLE_INCLUDE : PdgNodeKind.INCLUDE;
            String id = addUnitNode(directive, kind, play);
            List<Pending> skips = enter(directive, id, ends, notified);
            if (directive.loop().isPresent()) {
                edges.add(PdgEdge.of(id, id, PdgEdgeType.LOOP_ITERATE));
            }

            List<Pending> current = List.of(Pending.sequence(id));
            expander.enter(directive);
            try {
                current = walkSequence(controlFlowChildren(directive), current, play);
            } finally {
                expander.leave(directive);
            }
            List<Pending> out = new ArrayList<>(current);
            out.addAll(skips);
            return out;
        }

        /**
         * Block region: body, failures into rescue, then always, then the block exit.
         */
        private List<Pending> walkBlock(AstNode block, List<Pending> ends, PlayContext play, boolean notified) {
            String entry = addNode(PdgNode.builder(newId(), PdgNodeKind.BLOCK_ENTRY)
                    .astNode(block.id())
                    .location(block.location())
                    .label(block.label()));
            unitIds.put(block, entry);
            List<Pending> skips = enter(block, entry, ends, notified);

            int mark = executableIds.size();
            List<Pending> bodyEnds = walkSequence(block.children(ChildRole.BODY), List.of(Pending.sequence(entry)), play);
            List<Pending> failures = executableIds.subList(mark, executableIds.size()).stream()
                    .map(id -> Pending.of(id, PdgEdgeType.BLOCK_FAILURE))
                    .toList();
            if (failures.isEmpty()) {
                // Empty body: rescue still hangs off the block entry.
                failures = List.of(Pending.of(entry, PdgEdgeType.BLOCK_FAILURE));
            }
            List<Pending> afterBody = bodyEnds.stream()
                    .map(p -> p.type() == PdgEdgeType.SEQUENCE ? Pending.of(p.from(), PdgEdgeType.BLOCK_SUCCESS) : p)
                    .toList();

            List<AstNode> rescue = block.children(ChildRole.RESCUE);
            List<AstNode> always = block.children(ChildRole.ALWAYS);
            List<Pending> tail = new ArrayList<>(afterBody);
            if (!rescue.isEmpty()) {
                tail.addAll(walkSequence(rescue, failures, play));
            } else if (!always.isEmpty()) {
                tail.addAll(failures);
            }
            List<Pending> current = always.isEmpty() ? tail : walkSequence(always, tail, play);

            String exit = addNode(PdgNode.builder(newId(), PdgNodeKind.BLOCK_EXIT)
                    .astNode(block.id())
                    .location(block.location())
                    .label(block.label()));
            connect(current, exit);

            List<Pending> out = new ArrayList<>();
            out.add(Pending.sequence(exit));
            out.addAll(skips);
            return out;
        }

        /**
         * Connect the open ends to a unit, through a branch when the unit is guarded.
         * Returns the not-taken ends that bypass the unit.
         */
        private List<Pending> enter(AstNode unit, String target, List<Pending> ends, boolean notified) {
            Optional<AstNode> guard = unit.guard();
            if (guard.isEmpty() && !notified) {
                connect(ends, target);
                return List.of();
            }
            String condition = guard.map(g -> guardText(g.value().orElse(null))).orElse(null);
            StaticGuard staticGuard = guard.map(g -> StaticGuard.evaluate(g.value().orElse(null)))
                    .orElse(StaticGuard.UNKNOWN);
            if (notified) {
                condition = condition == null ? "notified" : "notified and (" + condition + ")";
                if (staticGuard == StaticGuard.ALWAYS_TRUE) {
                    staticGuard = StaticGuard.UNKNOWN;
                }
            }
            List<Pending> skips = new ArrayList<>();
            for (Pending p : ends) {
                if (p.type() == PdgEdgeType.BRANCH) {
                    // Already a not-taken path: it keeps its own label past this unit too.
                    edges.add(PdgEdge.skipInto(p.from(), target, p.guard(), p.staticGuard(), p.via(), staticGuard));
                    skips.add(p);
                } else {
                    edges.add(PdgEdge.branch(p.from(), target, condition, true, staticGuard, p.replacedType()));
                    skips.add(Pending.skipped(p.from(), condition, staticGuard, p.replacedType()));
                }
            }
            return skips;
        }

        private void connect(List<Pending> ends, String target) {
            for (Pending p : ends) {
                edges.add(p.to(target));
            }
        }

        private List<AstNode> controlFlowChildren(AstNode node) {
            return node.children().stream().filter(c -> c.role().isControlFlow()).toList();
        }

        // ---------------------------------------------------------- handlers

        private void linkHandlers(PlayContext play) {
            List<AstNode> handlers = play.units.stream()
                    .filter(AstNode::isHandlerContext)
                    .filter(h -> h.name().isPresent())
                    .toList();
            for (AstNode notifier : play.units) {
                for (String target : notifier.notifyTargets()) {
                    linkNotification(notifier, target, handlers);
                }
            }
        }

        private void linkNotification(AstNode notifier, String target, List<AstNode> handlers) {
            if (TemplateReferenceExtractor.isTemplated(target)) {
                record(DiagnosticType.DEAD_NOTIFICATION, notifier,
                        "Notification '" + target + "' is templated and cannot be matched to a handler");
                return;
            }
            List<AstNode> byName = handlers.stream()
                    .filter(h -> target.equals(h.name().get()) || target.equals(qualifiedName(h)))
                    .toList();
            if (!byName.isEmpty()) {
                MatchConfidence confidence = byName.size() > 1 ? MatchConfidence.AMBIGUOUS : MatchConfidence.NAME;
                byName.forEach(h -> edges.add(PdgEdge.triggers(unitIds.get(notifier), unitIds.get(h), confidence)));
                return;
            }
            List<AstNode> byTopic = handlers.stream()
                    .filter(h -> h.listenTopics().contains(target))
                    .toList();
            if (!byTopic.isEmpty()) {
                byTopic.forEach(h -> edges.add(PdgEdge.triggers(unitIds.get(notifier), unitIds.get(h), MatchConfidence.TOPIC)));
                return;
            }
            record(DiagnosticType.DEAD_NOTIFICATION, notifier, "No handler named or listening to '" + target + "'");
        }

        private String qualifiedName(AstNode handler) {
            return handler.enclosing(AstKind.ROLE)
                    .flatMap(AstNode::name)
                    .map(role -> role + " : " + handler.name().orElse(""))
                    .orElse(null);
        }

        // ---------------------------------------------------------- data flow

        private void addDataFlow(String entry) {
            scopes = scopeResolver.resolveScopes(root);
            controlFlow = new ControlFlowAnalysis(nodes, edges, entry);

            List<AstNode> definitions = root.descendants()
                    .filter(n -> n.kind() == AstKind.VARIABLE_DEFINITION)
                    .toList();
            for (AstNode definition : definitions) {
                String id = addNode(PdgNode.builder(newId(), PdgNodeKind.DEFINITION)
                        .astNode(definition.id())
                        .location(definition.location())
                        .label(definition.name().orElse("") + " (" + definition.tier().map(Enum::name).orElse("") + ")")
                        .owner(pointOf(definition))
                        .variable(definition.name().orElse(null))
                        .keyword(definitionKeyword(definition))
                        .tier(definition.tier().orElse(null))
                        .value(definition.value().orElse(null))
                        .synthetic(definition.isSynthetic()));
                definitionIds.put(definition, id);
            }

            for (Map.Entry<AstNode, String> unit : orderedUnits().entrySet()) {
                scanUnit(unit.getKey(), unit.getValue());
            }
            for (AstNode definition : definitions) {
                definition.value().ifPresent(value -> scan(new UseSite(definitionIds.get(definition), definition,
                        scopes.scopeOf(definition), pointOf(definition), definition), "value", value, false));
            }
        }

        private Map<AstNode, String> orderedUnits() {
            Map<String, AstNode> byId = new HashMap<>();
            unitIds.forEach((ast, id) -> byId.put(id, ast));
            Map<AstNode, String> ordered = new LinkedHashMap<>();
            nodes.stream()
                    .filter(n -> byId.containsKey(n.id()))
                    .forEach(n -> ordered.put(byId.get(n.id()), n.id()));
            return ordered;
        }

        private void scanUnit(AstNode unit, String unitId) {
            UseSite site = new UseSite(unitId, unit, scopes.scopeOf(unit), unitId, null);
            unit.arguments().forEach((key, value) -> scan(site, "args." + key, value, false));

            Set<String> moduleKeys = unit.action().map(Set::of).orElse(Set.of());
            unit.attributes().forEach((key, value) -> {
                if (!isScannedAttribute(unit, key) || moduleKeys.contains(key)) {
                    return;
                }
                scan(site, key, value, EXPRESSION_KEYS.contains(key));
            });
        }

        private boolean isScannedAttribute(AstNode unit, String key) {
            return switch (unit.kind()) {
                case PLAY -> !NOT_SCANNED_PLAY_KEYS.contains(key);
                case ROLE_INCLUDE -> unit.arguments().isEmpty()
                        ? SCANNED_ROLE_ENTRY_KEYS.contains(key)
                        : !NOT_SCANNED_TASK_KEYS.contains(key);
                default -> !NOT_SCANNED_TASK_KEYS.contains(key);
            };
        }

        /**
         * Where references are looked up from and which program point they belong to.
         *
         * @param ownerId PDG node the uses belong to
         * @param point   control-flow node used for flow-sensitive lookup, null when unknown
         * @param self    definition whose own value is scanned, excluded from lookup
         */
        private record UseSite(String ownerId, AstNode ast, Scope scope, String point, AstNode self) {}

        private void scan(UseSite site, String keyword, RawNode raw, boolean expression) {
            if (raw instanceof RawMapping mapping) {
                mapping.entries().forEach((key, value) -> scan(site, keyword + "." + key, value, false));
            } else if (raw instanceof RawSequence sequence) {
                sequence.items().forEach(item -> scan(site, keyword, item, expression));
            } else if (raw instanceof RawScalar scalar && scalar.isString() && !scalar.vaultEncrypted()) {
                String text = scalar.asText();
                TemplateReferences references;
                if (TemplateReferenceExtractor.isTemplated(text)) {
                    references = extractor.extract(text);
                } else if (expression) {
                    references = extractor.extractExpression(text);
                } else {
                    return;
                }
                if (references.isMalformed()) {
                    record(DiagnosticType.PARSE_WARNING, site.ast(),
                            "Malformed template in " + keyword + ": " + references.error());
                }
                if (references.dynamic()) {
                    record(DiagnosticType.UNRESOLVED_VARIABLE, site.ast(),
                            "Dynamically named variable in " + keyword + " cannot be resolved");
                }
                for (String variable : references.variables()) {
                    addUse(site, keyword, variable, scalar.location());
                }
            }
        }

        private void addUse(UseSite site, String keyword, String variable, Location location) {
            String key = site.ownerId() + "|" + keyword + "|" + variable;
            if (useIds.containsKey(key)) {
                return;
            }
            String useId = addNode(PdgNode.builder(newId(), PdgNodeKind.USE)
                    .astNode(site.ast().id())
                    .location(location)
                    .label(variable)
                    .owner(site.ownerId())
                    .variable(variable)
                    .keyword(keyword));
            useIds.put(key, useId);

            List<PdgEdge> reaching = reachingDefinitions(site, keyword, variable, useId);
            edges.addAll(reaching);
            if (reaching.isEmpty() && !isMagic(variable)) {
                record(DiagnosticType.UNRESOLVED_VARIABLE, site.ast(),
                        "Variable '" + variable + "' used in " + keyword + " has no visible definition");
            }
        }

        /**
         * REACHES edges into a use. Lexical tiers resolve by precedence only. Runtime tiers are
         * filtered by control flow; when none of them is exact, the next lower tier contributes too.
         */
        private List<PdgEdge> reachingDefinitions(UseSite site, String keyword, String variable, String useId) {
            NavigableMap<PrecedenceTier, Set<AstNode>> candidates =
                    scopes.candidates(site.scope(), variable, def -> def != site.self());
            List<PdgEdge> result = new ArrayList<>();
            boolean approximate = false;

            for (PrecedenceTier tier : candidates.descendingKeySet()) {
                Set<AstNode> defs = candidates.get(tier);
                if (!tier.isRuntime()) {
                    boolean exact = !approximate && defs.size() == 1;
                    defs.forEach(d -> result.add(PdgEdge.reaches(definitionIds.get(d), useId, variable, exact)));
                    break;
                }
                List<AstNode> live = liveDefinitions(defs, site.point(), RESULT_EXPRESSION_KEYS.contains(keyword));
                if (live.isEmpty()) {
                    continue;
                }
                boolean anyExact = false;
                for (AstNode d : live) {
                    boolean exact = !approximate && live.size() == 1 && dominatesPoint(pointOf(d), site.point());
                    anyExact |= exact;
                    result.add(PdgEdge.reaches(definitionIds.get(d), useId, variable, exact));
                }
                if (anyExact) {
                    break;
                }
                approximate = true;
            }
            return result;
        }

        /**
         * Runtime definitions that may have run before the point and were not overwritten
         * on every path since.
         */
        private List<AstNode> liveDefinitions(Set<AstNode> defs, String point, boolean afterExecution) {
            if (point == null) {
                return List.copyOf(defs);
            }
            List<AstNode> reaching = new ArrayList<>();
            for (AstNode d : defs) {
                String p = pointOf(d);
                if (p == null) {
                    reaching.add(d);
                } else if (p.equals(point)) {
                    if (isLoopVariable(d) || afterExecution && d.isSynthetic()) {
                        reaching.add(d);
                    }
                } else if (controlFlow.reaches(p, point)) {
                    reaching.add(d);
                }
            }
            return reaching.stream()
                    .filter(d -> reaching.stream().noneMatch(later -> overwrites(later, d, point)))
                    .toList();
        }

        private boolean overwrites(AstNode later, AstNode earlier, String point) {
            String pLater = pointOf(later);
            String pEarlier = pointOf(earlier);
            if (later == earlier || pLater == null || pEarlier == null || pLater.equals(pEarlier)) {
                return false;
            }
            return controlFlow.dominates(pLater, point)
                    && controlFlow.reaches(pEarlier, pLater)
                    && !controlFlow.reaches(pLater, pEarlier);
        }

        private boolean dominatesPoint(String definitionPoint, String usePoint) {
            if (definitionPoint == null || usePoint == null) {
                return false;
            }
            return definitionPoint.equals(usePoint) || controlFlow.dominates(definitionPoint, usePoint);
        }

        /**
         * Control-flow node at which a definition takes effect: the nearest laid-out ancestor.
         */
        private String pointOf(AstNode definition) {
            for (AstNode current = definition.parent().orElse(null); current != null;
                 current = current.parent().orElse(null)) {
                String id = unitIds.get(current);
                if (id != null) {
                    return id;
                }
            }
            return null;
        }

        private boolean isLoopVariable(AstNode definition) {
            return definition.parent().map(p -> p.kind() == AstKind.LOOP).orElse(false);
        }

        private String definitionKeyword(AstNode definition) {
            if (isLoopVariable(definition)) {
                return definition.value().isPresent() ? "loop" : "index";
            }
            if (definition.isSynthetic()) {
                return "register";
            }
            return definition.tier().filter(t -> t == PrecedenceTier.SET_FACT).map(t -> "set_fact").orElse(null);
        }

        private boolean isMagic(String variable) {
            return variable.startsWith("ansible_") || MAGIC_VARIABLES.contains(variable);
        }

        // ---------------------------------------------------------- nodes

        private String addUnitNode(AstNode unit, PdgNodeKind kind, PlayContext play) {
            String id = addNode(PdgNode.builder(newId(), kind)
                    .astNode(unit.id())
                    .location(unit.location())
                    .label(unit.label())
                    .action(unit.action().orElse(null))
                    .arguments(unit.arguments())
                    .unanalyzable(unit.isUnanalyzable()));
            unitIds.put(unit, id);
            if (kind.isExecutable()) {
                executableIds.add(id);
            }
            if (play != null) {
                play.units.add(unit);
            }
            unit.unanalyzableReason().ifPresent(reason ->
                    record(DiagnosticType.UNANALYZABLE_NODE, unit, reason));
            return id;
        }

        private String addNode(PdgNode.Builder builder) {
            PdgNode node = builder.build();
            nodes.add(node);
            return node.id();
        }

        private String newId() {
            return "pdg-" + (++nextId);
        }

        private void record(DiagnosticType type, AstNode node, String message) {
            if (type == DiagnosticType.UNRESOLVED_VARIABLE) {
                log.debug("{} at {}: {}", type, node.location().format(), message);
            } else {
                log.warn("{} at {}: {}", type, node.location().format(), message);
            }
            diagnostics.add(Diagnostic.of(type, message, node.location(), node.id()));
        }
    }

    private static String guardText(RawNode condition) {
        if (condition instanceof RawSequence sequence) {
            return sequence.items().stream()
                    .map(PdgBuilder::guardText)
                    .collect(Collectors.joining(" and "));
        }
        if (condition instanceof RawScalar scalar) {
            return scalar.asText();
        }
        return condition == null ? "" : String.valueOf(condition.toPlainValue());
    }
}
