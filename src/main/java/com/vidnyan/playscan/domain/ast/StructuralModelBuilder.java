package com.vidnyan.playscan.domain.ast;

import com.vidnyan.playscan.domain.model.Location;
import com.vidnyan.playscan.domain.raw.RawMapping;
import com.vidnyan.playscan.domain.raw.RawNode;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.raw.RawSequence;
import com.vidnyan.playscan.domain.scope.PrecedenceTier;
import com.vidnyan.playscan.domain.template.TemplateReferenceExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the structural model (AST) from loaded raw trees.
 *
 * Never fails on malformed constructs: a task that cannot be interpreted becomes a node
 * marked unanalyzable and the build goes on. Directives are left unexpanded; their content
 * is grafted later by the PDG builder.
 * One instance per build, ids come from the shared {@link AstIdGenerator}.
 */
@Slf4j
public class StructuralModelBuilder {

    /**
     * Task keys that are not module names.
     */
    static final Set<String> TASK_KEYWORDS = Set.of(
            "name", "when", "loop", "loop_control", "register", "notify", "listen", "tags",
            "vars", "args", "action", "local_action", "become", "become_user", "become_method",
            "become_flags", "become_exe", "no_log", "ignore_errors", "ignore_unreachable",
            "changed_when", "failed_when", "until", "retries", "delay", "delegate_to",
            "delegate_facts", "run_once", "environment", "check_mode", "diff", "any_errors_fatal",
            "async", "poll", "throttle", "timeout", "collections", "module_defaults", "connection",
            "remote_user", "port", "debugger", "block", "rescue", "always");

    private static final Set<String> ROLE_ENTRY_KEYWORDS = Set.of(
            "role", "name", "when", "tags", "vars", "become", "become_user", "become_method",
            "delegate_to", "environment", "no_log", "ignore_errors", "any_errors_fatal",
            "collections", "connection", "remote_user", "check_mode", "diff", "run_once");

    private static final String DEFAULT_LOOP_VAR = "item";

    private final AstIdGenerator ids;

    public StructuralModelBuilder(AstIdGenerator ids) {
        this.ids = ids;
    }

    /**
     * Build a playbook file: a sequence of plays and {@code import_playbook} entries.
     */
    public AstNode buildPlaybook(RawNode root, String file) {
        Location location = root != null ? root.location() : Location.at(file, 1, 1);
        AstNode playbook = AstNode.builder(ids.next(), AstKind.PLAYBOOK)
                .location(location)
                .name(file)
                .build();
        buildIncludedPlays(root).forEach(playbook::addChild);
        log.debug("Built playbook {} with {} plays", file, playbook.children().size());
        return playbook;
    }

    /**
     * Build the plays of a playbook document. The nodes carry role {@link ChildRole#PLAYS}.
     */
    public List<AstNode> buildIncludedPlays(RawNode content) {
        List<AstNode> plays = new ArrayList<>();
        if (content == null || content instanceof RawScalar scalar && scalar.isNull()) {
            return plays;
        }
        if (!(content instanceof RawSequence sequence)) {
            plays.add(unanalyzable(AstKind.PLAY, content, ChildRole.PLAYS, "playbook is not a list of plays"));
            return plays;
        }
        for (RawNode item : sequence.items()) {
            plays.add(buildPlay(item));
        }
        return plays;
    }

    /**
     * Build a role from its loaded main files.
     * Defaults and vars become variable files, meta dependencies run before the tasks.
     */
    public AstNode buildRole(RoleSources sources) {
        Location location = firstKnownLocation(sources)
                .orElse(Location.at(sources.rootPath(), 1, 1));
        AstNode role = AstNode.builder(ids.next(), AstKind.ROLE)
                .location(location)
                .role(ChildRole.INCLUDED)
                .name(sources.roleName())
                .target(sources.rootPath())
                .build();

        sources.defaultsFile().ifPresent(raw ->
                role.addChild(buildVariableFile(raw, PrecedenceTier.ROLE_DEFAULTS, ChildRole.VARS)));
        sources.varsFile().ifPresent(raw ->
                role.addChild(buildVariableFile(raw, PrecedenceTier.ROLE_VARS, ChildRole.VARS)));

        sources.metaFile()
                .filter(RawMapping.class::isInstance)
                .flatMap(meta -> ((RawMapping) meta).get("dependencies"))
                .filter(RawSequence.class::isInstance)
                .ifPresent(deps -> ((RawSequence) deps).items()
                        .forEach(dep -> role.addChild(buildRoleEntry(dep, ChildRole.ROLES))));

        sources.tasksFile().ifPresent(raw -> buildTaskList(raw, ChildRole.TASKS, false).forEach(role::addChild));
        sources.handlersFile().ifPresent(raw -> buildTaskList(raw, ChildRole.HANDLERS, true).forEach(role::addChild));

        log.debug("Built role {} with {} children", sources.roleName(), role.children().size());
        return role;
    }

    /**
     * Build the content of an included task file. The nodes carry role {@link ChildRole#INCLUDED}.
     */
    public List<AstNode> buildIncludedTasks(RawNode content, boolean handlerContext) {
        return buildTaskList(content, ChildRole.INCLUDED, handlerContext);
    }

    /**
     * Build a variable file: every top-level key becomes a definition at the given tier.
     */
    public AstNode buildVariableFile(RawNode content, PrecedenceTier tier, ChildRole childRole) {
        AstNode file = AstNode.builder(ids.next(), AstKind.VARIABLE_FILE)
                .location(content.location())
                .role(childRole)
                .name(content.location().filePath())
                .tier(tier)
                .build();
        addDefinitions(file, content, tier, ChildRole.VARS);
        return file;
    }

    /**
     * Attach variables supplied from outside the script (inventory or extra vars) to a unit root.
     */
    public void attachVariables(AstNode root, RawNode content, PrecedenceTier tier) {
        root.addChild(buildVariableFile(content, tier, ChildRole.VARS));
    }

    // ------------------------------------------------------------------ plays

    private AstNode buildPlay(RawNode raw) {
        if (!(raw instanceof RawMapping play)) {
            return unanalyzable(AstKind.PLAY, raw, ChildRole.PLAYS, "play is not a mapping");
        }
        if (play.containsKey("import_playbook")) {
            Optional<String> target = play.getText("import_playbook");
            AstNode.Builder directive = AstNode.builder(ids.next(), AstKind.IMPORT_DIRECTIVE)
                    .location(play.location())
                    .role(ChildRole.PLAYS)
                    .name(play.getText("name").orElse(null))
                    .action("import_playbook")
                    .target(target.orElse(null))
                    .attributes(play.entries());
            if (target.isEmpty()) {
                directive.unanalyzable("import_playbook without a file name");
            }
            AstNode node = directive.build();
            addGuard(node, play);
            addDefinitions(node, play.get("vars").orElse(null), PrecedenceTier.INCLUDE_PARAMS, ChildRole.VARS);
            return node;
        }

        AstNode node = AstNode.builder(ids.next(), AstKind.PLAY)
                .location(play.location())
                .role(ChildRole.PLAYS)
                .name(play.getText("name").orElse(play.getText("hosts").orElse(null)))
                .attributes(play.entries())
                .build();

        addDefinitions(node, play.get("vars").orElse(null), PrecedenceTier.PLAY_VARS, ChildRole.VARS);
        play.get("vars_prompt").ifPresent(prompts -> addPrompts(node, prompts));
        play.get("vars_files").ifPresent(files -> addVarsFiles(node, files));

        play.get("pre_tasks").ifPresent(section -> buildTaskList(section, ChildRole.PRE_TASKS, false).forEach(node::addChild));
        play.get("roles").filter(RawSequence.class::isInstance).ifPresent(section ->
                ((RawSequence) section).items().forEach(entry -> node.addChild(buildRoleEntry(entry, ChildRole.ROLES))));
        play.get("tasks").ifPresent(section -> buildTaskList(section, ChildRole.TASKS, false).forEach(node::addChild));
        play.get("post_tasks").ifPresent(section -> buildTaskList(section, ChildRole.POST_TASKS, false).forEach(node::addChild));
        play.get("handlers").ifPresent(section -> buildTaskList(section, ChildRole.HANDLERS, true).forEach(node::addChild));
        return node;
    }

    private void addPrompts(AstNode play, RawNode prompts) {
        if (!(prompts instanceof RawSequence sequence)) {
            return;
        }
        for (RawNode item : sequence.items()) {
            if (item instanceof RawMapping prompt && prompt.getText("name").isPresent()) {
                RawNode value = prompt.get("default").orElse(null);
                play.addChild(definition(prompt.getText("name").get(), value, prompt.location(),
                        PrecedenceTier.PLAY_VARS_PROMPT, ChildRole.VARS, false));
            }
        }
    }

    private void addVarsFiles(AstNode play, RawNode files) {
        List<RawNode> entries = files instanceof RawSequence sequence ? sequence.items() : List.of(files);
        for (RawNode entry : entries) {
            // A nested list means "first file found"; only the first candidate is followed.
            RawNode candidate = entry instanceof RawSequence alternatives && !alternatives.isEmpty()
                    ? alternatives.items().get(0) : entry;
            String path = candidate instanceof RawScalar scalar && !scalar.isNull() ? scalar.asText() : null;
            AstNode.Builder directive = AstNode.builder(ids.next(), AstKind.INCLUDE_DIRECTIVE)
                    .location(candidate.location())
                    .role(ChildRole.VARS)
                    .action("vars_files")
                    .target(path)
                    .tier(PrecedenceTier.PLAY_VARS_FILES);
            if (path == null) {
                directive.unanalyzable("vars_files entry is not a file name");
            }
            play.addChild(directive.build());
        }
    }

    // ------------------------------------------------------------------ roles

    private AstNode buildRoleEntry(RawNode raw, ChildRole childRole) {
        if (raw instanceof RawScalar scalar && !scalar.isNull()) {
            return AstNode.builder(ids.next(), AstKind.ROLE_INCLUDE)
                    .location(raw.location())
                    .role(childRole)
                    .action("role")
                    .target(scalar.asText())
                    .build();
        }
        if (!(raw instanceof RawMapping entry)) {
            return unanalyzable(AstKind.ROLE_INCLUDE, raw, childRole, "role entry is neither a name nor a mapping");
        }
        Optional<String> roleName = entry.getText("role").or(() -> entry.getText("name"));
        AstNode.Builder builder = AstNode.builder(ids.next(), AstKind.ROLE_INCLUDE)
                .location(entry.location())
                .role(childRole)
                .action("role")
                .target(roleName.orElse(null))
                .attributes(entry.entries());
        if (roleName.isEmpty()) {
            builder.unanalyzable("role entry without a role name");
        }
        AstNode node = builder.build();

        Map<String, RawNode> params = new LinkedHashMap<>();
        entry.entries().forEach((key, value) -> {
            if (!ROLE_ENTRY_KEYWORDS.contains(key)) {
                params.put(key, value);
            }
        });
        addDefinitions(node, new RawMapping(params, entry.location()), PrecedenceTier.ROLE_PARAMS, ChildRole.VARS);
        addDefinitions(node, entry.get("vars").orElse(null), PrecedenceTier.ROLE_PARAMS, ChildRole.VARS);
        addGuard(node, entry);
        return node;
    }

    // ------------------------------------------------------------------ tasks

    private List<AstNode> buildTaskList(RawNode raw, ChildRole childRole, boolean handlerContext) {
        List<AstNode> nodes = new ArrayList<>();
        if (raw == null || raw instanceof RawScalar scalar && scalar.isNull()) {
            return nodes;
        }
        if (!(raw instanceof RawSequence sequence)) {
            nodes.add(unanalyzable(handlerContext ? AstKind.HANDLER : AstKind.TASK, raw, childRole,
                    "task list is not a sequence"));
            return nodes;
        }
        for (RawNode item : sequence.items()) {
            nodes.add(buildTaskOrBlock(item, childRole, handlerContext));
        }
        return nodes;
    }

    private AstNode buildTaskOrBlock(RawNode raw, ChildRole childRole, boolean handlerContext) {
        if (!(raw instanceof RawMapping mapping)) {
            return unanalyzable(handlerContext ? AstKind.HANDLER : AstKind.TASK, raw, childRole,
                    "task is not a mapping");
        }
        if (mapping.containsKey("block")) {
            return buildBlock(mapping, childRole, handlerContext);
        }
        return buildTask(mapping, childRole, handlerContext);
    }

    private AstNode buildBlock(RawMapping mapping, ChildRole childRole, boolean handlerContext) {
        AstNode block = AstNode.builder(ids.next(), AstKind.BLOCK)
                .location(mapping.location())
                .role(childRole)
                .name(mapping.getText("name").orElse(null))
                .attributes(mapping.entries())
                .handlerContext(handlerContext)
                .build();
        addDefinitions(block, mapping.get("vars").orElse(null), PrecedenceTier.BLOCK_VARS, ChildRole.VARS);
        addGuard(block, mapping);
        buildTaskList(mapping.get("block").orElse(null), ChildRole.BODY, handlerContext).forEach(block::addChild);
        buildTaskList(mapping.get("rescue").orElse(null), ChildRole.RESCUE, handlerContext).forEach(block::addChild);
        buildTaskList(mapping.get("always").orElse(null), ChildRole.ALWAYS, handlerContext).forEach(block::addChild);
        return block;
    }

    private AstNode buildTask(RawMapping mapping, ChildRole childRole, boolean handlerContext) {
        ModuleCall call = resolveModuleCall(mapping);
        String shortName = call.module() != null ? ModuleNames.shortName(call.module()) : null;

        AstKind kind = classify(shortName, handlerContext);
        String target = null;
        String reason = call.problem();
        if (reason == null && kind.isDirective()) {
            target = directiveTarget(shortName, call.arguments());
            if (target == null) {
                reason = call.module() + " without a target";
            }
        }

        AstNode.Builder builder = AstNode.builder(ids.next(), kind)
                .location(mapping.location())
                .role(childRole)
                .name(mapping.getText("name").orElse(null))
                .action(call.module())
                .target(target)
                .attributes(mapping.entries())
                .arguments(call.arguments())
                .handlerContext(handlerContext);
        if (ModuleNames.INCLUDE_VARS.contains(shortName)) {
            builder.tier(PrecedenceTier.INCLUDE_VARS);
        }
        if (reason != null) {
            builder.unanalyzable(reason);
            log.debug("Unanalyzable task at {}: {}", mapping.location(), reason);
        }
        AstNode task = builder.build();

        PrecedenceTier varsTier = kind.isDirective() ? PrecedenceTier.INCLUDE_PARAMS : PrecedenceTier.TASK_VARS;
        addDefinitions(task, mapping.get("vars").orElse(null), varsTier, ChildRole.VARS);
        addGuard(task, mapping);
        addLoop(task, mapping);

        if (reason == null && ModuleNames.SET_FACT.contains(shortName)) {
            call.arguments().forEach((key, value) -> {
                if (!key.equals("cacheable") && !key.equals(FreeFormArguments.RAW_PARAMS)) {
                    task.addChild(definition(key, value, value.location(), PrecedenceTier.SET_FACT,
                            ChildRole.FACTS, false));
                }
            });
        }
        task.registerName().ifPresent(registered -> task.addChild(
                definition(registered, null, mapping.get("register").get().location(),
                        PrecedenceTier.SET_FACT, ChildRole.FACTS, true)));
        return task;
    }

    private static AstKind classify(String shortName, boolean handlerContext) {
        if (shortName == null) {
            return handlerContext ? AstKind.HANDLER : AstKind.TASK;
        }
        if (ModuleNames.INCLUDE_TASKS.contains(shortName) || ModuleNames.INCLUDE_VARS.contains(shortName)) {
            return AstKind.INCLUDE_DIRECTIVE;
        }
        if (ModuleNames.IMPORT_TASKS.contains(shortName)) {
            return AstKind.IMPORT_DIRECTIVE;
        }
        if (ModuleNames.ROLE_INCLUDES.contains(shortName)) {
            return AstKind.ROLE_INCLUDE;
        }
        return handlerContext ? AstKind.HANDLER : AstKind.TASK;
    }

    private static String directiveTarget(String shortName, Map<String, RawNode> args) {
        List<String> keys = ModuleNames.ROLE_INCLUDES.contains(shortName)
                ? List.of("name", "role")
                : List.of(FreeFormArguments.RAW_PARAMS, "file", "name");
        for (String key : keys) {
            RawNode node = args.get(key);
            if (node instanceof RawScalar scalar && !scalar.isNull() && !scalar.asText().isBlank()) {
                return scalar.asText();
            }
        }
        return null;
    }

    /**
     * Find the module and its arguments among the task keys.
     */
    private ModuleCall resolveModuleCall(RawMapping mapping) {
        List<String> candidates = new ArrayList<>();
        for (String key : mapping.entries().keySet()) {
            if (!TASK_KEYWORDS.contains(key) && !key.startsWith("with_")) {
                candidates.add(key);
            }
        }
        Optional<RawNode> actionForm = mapping.get("action").or(() -> mapping.get("local_action"));

        ModuleCall call;
        if (actionForm.isPresent()) {
            if (!candidates.isEmpty()) {
                return ModuleCall.problem(null, "conflicting action and module " + candidates.get(0));
            }
            call = parseActionForm(actionForm.get());
        } else if (candidates.isEmpty()) {
            return ModuleCall.problem(null, "no module found in task");
        } else if (candidates.size() > 1) {
            return ModuleCall.problem(candidates.get(0), "conflicting modules " + String.join(", ", candidates));
        } else {
            String module = candidates.get(0);
            call = parseArguments(module, mapping.entries().get(module));
        }

        if (call.problem() == null && mapping.containsKey("args")) {
            RawNode extra = mapping.entries().get("args");
            if (extra instanceof RawMapping extraArgs) {
                Map<String, RawNode> merged = new LinkedHashMap<>(call.arguments());
                extraArgs.entries().forEach(merged::putIfAbsent);
                call = new ModuleCall(call.module(), merged, null);
            } else if (!(extra instanceof RawScalar scalar && scalar.isNull())) {
                return ModuleCall.problem(call.module(), "args is not a mapping");
            }
        }
        return call;
    }

    private ModuleCall parseActionForm(RawNode action) {
        if (action instanceof RawMapping mapping) {
            Optional<String> module = mapping.getText("module");
            if (module.isEmpty()) {
                return ModuleCall.problem(null, "action mapping without module");
            }
            Map<String, RawNode> args = new LinkedHashMap<>(mapping.entries());
            args.remove("module");
            return new ModuleCall(module.get(), args, null);
        }
        if (action instanceof RawScalar scalar && scalar.isString()) {
            String text = scalar.asText().trim();
            int space = text.indexOf(' ');
            String module = space < 0 ? text : text.substring(0, space);
            if (module.isEmpty()) {
                return ModuleCall.problem(null, "empty action");
            }
            String rest = space < 0 ? "" : text.substring(space + 1);
            return parseArguments(module, RawScalar.of(rest, scalar.location()));
        }
        return ModuleCall.problem(null, "action has the wrong shape");
    }

    private static ModuleCall parseArguments(String module, RawNode value) {
        if (value instanceof RawMapping mapping) {
            return new ModuleCall(module, mapping.entries(), null);
        }
        if (value == null || value instanceof RawScalar scalar && scalar.isNull()) {
            return new ModuleCall(module, Map.of(), null);
        }
        if (value instanceof RawScalar scalar && !scalar.vaultEncrypted()) {
            try {
                return new ModuleCall(module, FreeFormArguments.parse(scalar.asText(), scalar.location()), null);
            } catch (IllegalArgumentException e) {
                return ModuleCall.problem(module, e.getMessage());
            }
        }
        return ModuleCall.problem(module, "arguments of " + module + " have the wrong shape");
    }

    // ------------------------------------------------------------------ children

    private void addGuard(AstNode owner, RawMapping mapping) {
        mapping.get("when").ifPresent(condition -> owner.addChild(
                AstNode.builder(ids.next(), AstKind.CONDITIONAL)
                        .location(condition.location())
                        .role(ChildRole.GUARD)
                        .name("when")
                        .value(condition)
                        .build()));
    }

    private void addLoop(AstNode task, RawMapping mapping) {
        String loopKey = mapping.containsKey("loop") ? "loop" : mapping.entries().keySet().stream()
                .filter(k -> k.startsWith("with_"))
                .findFirst()
                .orElse(null);
        if (loopKey == null) {
            return;
        }
        RawNode items = mapping.entries().get(loopKey);
        AstNode loop = AstNode.builder(ids.next(), AstKind.LOOP)
                .location(items.location())
                .role(ChildRole.LOOP)
                .name(loopKey)
                .value(items)
                .attributes(Map.of("with", RawScalar.of(loopKey, items.location())))
                .build();

        Optional<RawMapping> control = mapping.get("loop_control")
                .filter(RawMapping.class::isInstance)
                .map(RawMapping.class::cast);
        String loopVar = control.flatMap(c -> c.getText("loop_var")).orElse(DEFAULT_LOOP_VAR);
        loop.addChild(definition(loopVar, items, items.location(), PrecedenceTier.SET_FACT, ChildRole.VARS, true));
        control.flatMap(c -> c.getText("index_var")).ifPresent(indexVar ->
                loop.addChild(definition(indexVar, null, items.location(), PrecedenceTier.SET_FACT,
                        ChildRole.VARS, true)));
        task.addChild(loop);
    }

    private void addDefinitions(AstNode owner, RawNode vars, PrecedenceTier tier, ChildRole childRole) {
        if (vars == null) {
            return;
        }
        if (vars instanceof RawMapping mapping) {
            mapping.entries().forEach((name, value) ->
                    owner.addChild(definition(name, value, value.location(), tier, childRole, false)));
        } else if (vars instanceof RawSequence sequence) {
            // Legacy list-of-mappings form.
            sequence.items().forEach(item -> addDefinitions(owner, item, tier, childRole));
        } else if (!(vars instanceof RawScalar scalar && scalar.isNull())) {
            log.debug("Ignoring variables of wrong shape at {}", vars.location());
        }
    }

    private AstNode definition(String name, RawNode value, Location location, PrecedenceTier tier,
                               ChildRole childRole, boolean synthetic) {
        AstNode def = AstNode.builder(ids.next(), AstKind.VARIABLE_DEFINITION)
                .location(location)
                .role(childRole)
                .name(name)
                .tier(tier)
                .value(value)
                .synthetic(synthetic)
                .build();
        if (value instanceof RawScalar scalar
                && (scalar.vaultEncrypted() || !TemplateReferenceExtractor.isTemplated(scalar.asText()))) {
            def.addChild(AstNode.builder(ids.next(), AstKind.LITERAL)
                    .location(scalar.location())
                    .role(ChildRole.VALUE)
                    .value(scalar)
                    .build());
        }
        return def;
    }

    private AstNode unanalyzable(AstKind kind, RawNode raw, ChildRole childRole, String reason) {
        log.debug("Unanalyzable {} at {}: {}", kind, raw != null ? raw.location() : Location.unknown(), reason);
        return AstNode.builder(ids.next(), kind)
                .location(raw != null ? raw.location() : null)
                .role(childRole)
                .unanalyzable(reason)
                .build();
    }

    private static Optional<Location> firstKnownLocation(RoleSources sources) {
        return sources.tasksFile()
                .or(sources::handlersFile)
                .or(sources::defaultsFile)
                .or(sources::varsFile)
                .or(sources::metaFile)
                .map(RawNode::location);
    }

    private record ModuleCall(String module, Map<String, RawNode> arguments, String problem) {
        static ModuleCall problem(String module, String problem) {
            return new ModuleCall(module, Map.of(), problem);
        }
    }
}
