package com.vidnyan.playscan.domain.scope;

import com.vidnyan.playscan.adapter.out.yaml.SnakeYamlRawTreeLoader;
import com.vidnyan.playscan.domain.ast.AstIdGenerator;
import com.vidnyan.playscan.domain.ast.AstNode;
import com.vidnyan.playscan.domain.ast.ChildRole;
import com.vidnyan.playscan.domain.ast.StructuralModelBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NavigableMap;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopeResolverTest {

    private static final String PLAYBOOK = """
            - hosts: all
              vars:
                port: 80
                mode: plain
              tasks:
                - name: override
                  debug: msg={{ port }}
                  vars:
                    port: 8080
                - name: plain
                  debug: msg={{ port }}
                - name: remember
                  set_fact:
                    mode: tls
                - name: grouped
                  vars:
                    level: 3
                  block:
                    - name: inner
                      debug: msg={{ level }}
                - name: each
                  debug: msg={{ item }}
                  loop: [1, 2]
            """;

    private final AstNode playbook = new StructuralModelBuilder(new AstIdGenerator())
            .buildPlaybook(new SnakeYamlRawTreeLoader().parse(PLAYBOOK, "site.yml"), "site.yml");
    private final ScopeTree tree = new ScopeResolver().resolveScopes(playbook);
    private final List<AstNode> tasks = playbook.children(ChildRole.PLAYS).get(0).children(ChildRole.TASKS);

    @Test
    void taskVarsWinOverPlayVars() {
        Set<AstNode> defs = tree.resolve(tree.scopeOf(tasks.get(0)), "port");

        assertEquals(1, defs.size());
        assertEquals(PrecedenceTier.TASK_VARS, defs.iterator().next().tier().orElseThrow());
    }

    @Test
    void siblingTaskVarsAreNotVisible() {
        Set<AstNode> defs = tree.resolve(tree.scopeOf(tasks.get(1)), "port");

        assertEquals(PrecedenceTier.PLAY_VARS, defs.iterator().next().tier().orElseThrow());
    }

    @Test
    void factsAreRegisteredOnTheUnitRoot() {
        Set<AstNode> fromRoot = tree.resolve(tree.root(), "mode");
        NavigableMap<PrecedenceTier, Set<AstNode>> fromTask =
                tree.candidates(tree.scopeOf(tasks.get(1)), "mode", def -> true);

        assertEquals(PrecedenceTier.SET_FACT, fromRoot.iterator().next().tier().orElseThrow());
        assertEquals(List.of(PrecedenceTier.PLAY_VARS, PrecedenceTier.SET_FACT), List.copyOf(fromTask.keySet()));
    }

    @Test
    void blockVarsReachTheBody() {
        AstNode inner = tasks.get(3).children(ChildRole.BODY).get(0);

        assertEquals(1, tree.resolve(tree.scopeOf(inner), "level").size());
        assertTrue(tree.resolve(tree.scopeOf(tasks.get(1)), "level").isEmpty());
    }

    @Test
    void loopVariableStaysOnItsTask() {
        assertEquals(1, tree.resolve(tree.scopeOf(tasks.get(4)), "item").size());
        assertTrue(tree.resolve(tree.scopeOf(tasks.get(1)), "item").isEmpty());
    }

    @Test
    void filterHidesDefinitions() {
        Set<AstNode> defs = tree.resolve(tree.scopeOf(tasks.get(0)), "port",
                def -> def.tier().orElseThrow() != PrecedenceTier.TASK_VARS);

        assertEquals(PrecedenceTier.PLAY_VARS, defs.iterator().next().tier().orElseThrow());
    }
}
