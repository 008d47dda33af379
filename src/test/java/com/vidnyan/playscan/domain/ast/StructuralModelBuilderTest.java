package com.vidnyan.playscan.domain.ast;

import com.vidnyan.playscan.adapter.out.yaml.SnakeYamlRawTreeLoader;
import com.vidnyan.playscan.domain.raw.RawScalar;
import com.vidnyan.playscan.domain.scope.PrecedenceTier;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class StructuralModelBuilderTest {

    private final SnakeYamlRawTreeLoader loader = new SnakeYamlRawTreeLoader();
    private final StructuralModelBuilder builder = new StructuralModelBuilder(new AstIdGenerator());

    @Test
    void buildsPlayWithSectionsInOrder() {
        AstNode playbook = build("""
                - name: web servers
                  hosts: web
                  vars:
                    http_port: 80
                  pre_tasks:
                    - ping:
                  roles:
                    - common
                  tasks:
                    - name: install
                      apt: name=nginx
                  handlers:
                    - name: restart
                      service: name=nginx state=restarted
                """);

        assertEquals(AstKind.PLAYBOOK, playbook.kind());
        AstNode play = playbook.children(ChildRole.PLAYS).get(0);
        assertEquals("web servers", play.name().orElseThrow());
        assertEquals(1, play.children(ChildRole.PRE_TASKS).size());
        assertEquals(AstKind.ROLE_INCLUDE, play.children(ChildRole.ROLES).get(0).kind());
        assertEquals("common", play.children(ChildRole.ROLES).get(0).target().orElseThrow());
        assertEquals(AstKind.HANDLER, play.children(ChildRole.HANDLERS).get(0).kind());

        AstNode portVar = play.children(ChildRole.VARS).get(0);
        assertEquals(AstKind.VARIABLE_DEFINITION, portVar.kind());
        assertEquals(PrecedenceTier.PLAY_VARS, portVar.tier().orElseThrow());
        assertEquals(AstKind.LITERAL, portVar.children(ChildRole.VALUE).get(0).kind());
    }

    @Test
    void resolvesModuleAndMergesArgs() {
        AstNode task = firstTask("""
                - hosts: all
                  tasks:
                    - name: fetch
                      ansible.builtin.get_url:
                        url: https://example.com/app.tgz
                      args:
                        dest: /tmp/app.tgz
                """);

        assertEquals(AstKind.TASK, task.kind());
        assertEquals("ansible.builtin.get_url", task.action().orElseThrow());
        assertEquals("get_url", task.module().orElseThrow());
        assertEquals(List.of("url", "dest"), List.copyOf(task.arguments().keySet()));
    }

    @Test
    void actionFormIsParsed() {
        AstNode task = firstTask("""
                - hosts: all
                  tasks:
                    - action: copy src=a dest=/b
                """);

        assertEquals("copy", task.action().orElseThrow());
        assertEquals("/b", ((RawScalar) task.arguments().get("dest")).asText());
    }

    @Test
    void registerLoopAndGuardBecomeChildren() {
        AstNode task = firstTask("""
                - hosts: all
                  tasks:
                    - name: users
                      user: name={{ account }}
                      loop: "{{ accounts }}"
                      loop_control:
                        loop_var: account
                        index_var: idx
                      register: created
                      when: manage_users
                """);

        assertTrue(task.guard().isPresent());
        AstNode loop = task.loop().orElseThrow();
        List<String> loopVars = loop.children().stream().map(c -> c.name().orElseThrow()).toList();
        assertEquals(List.of("account", "idx"), loopVars);
        assertTrue(loop.children().stream().allMatch(AstNode::isSynthetic));

        AstNode registered = task.children(ChildRole.FACTS).get(0);
        assertEquals("created", registered.name().orElseThrow());
        assertEquals(PrecedenceTier.SET_FACT, registered.tier().orElseThrow());
        assertTrue(registered.isSynthetic());
        assertTrue(registered.value().isEmpty());
    }

    @Test
    void setFactDefinesEachKey() {
        AstNode task = firstTask("""
                - hosts: all
                  tasks:
                    - set_fact:
                        db_user: app
                        cacheable: true
                """);

        List<AstNode> facts = task.children(ChildRole.FACTS);
        assertEquals(1, facts.size());
        assertEquals("db_user", facts.get(0).name().orElseThrow());
        assertFalse(facts.get(0).isSynthetic());
    }

    @Test
    void blockKeepsBodyRescueAndAlways() {
        AstNode block = firstTask("""
                - hosts: all
                  tasks:
                    - name: guarded
                      block:
                        - command: /bin/a
                        - command: /bin/b
                      rescue:
                        - debug: msg=failed
                      always:
                        - debug: msg=done
                """);

        assertEquals(AstKind.BLOCK, block.kind());
        assertEquals(2, block.children(ChildRole.BODY).size());
        assertEquals(1, block.children(ChildRole.RESCUE).size());
        assertEquals(1, block.children(ChildRole.ALWAYS).size());
    }

    @Test
    void includeDirectivesCarryTheirTarget() {
        AstNode include = firstTask("""
                - hosts: all
                  tasks:
                    - include_tasks: setup.yml
                """);
        AstNode role = firstTask("""
                - hosts: all
                  tasks:
                    - include_role:
                        name: hardening
                """);

        assertEquals(AstKind.INCLUDE_DIRECTIVE, include.kind());
        assertEquals("setup.yml", include.target().orElseThrow());
        assertEquals(AstKind.ROLE_INCLUDE, role.kind());
        assertEquals("hardening", role.target().orElseThrow());
    }

    @Test
    void malformedTasksAreKeptAsUnanalyzable() {
        AstNode playbook = build("""
                - hosts: all
                  tasks:
                    - just a string
                    - name: nothing to run
                    - include_tasks:
                """);

        List<AstNode> tasks = playbook.children(ChildRole.PLAYS).get(0).children(ChildRole.TASKS);
        assertEquals(3, tasks.size());
        assertTrue(tasks.stream().allMatch(AstNode::isUnanalyzable));
        assertTrue(tasks.get(1).unanalyzableReason().orElseThrow().contains("no module"));
    }

    @Test
    void roleDefaultsAndVarsHaveTheirTiers() {
        RoleSources sources = RoleSources.builder("db", "/project/roles/db")
                .defaults(loader.parse("db_port: 5432\n", "/project/roles/db/defaults/main.yml"))
                .vars(loader.parse("db_name: app\n", "/project/roles/db/vars/main.yml"))
                .meta(loader.parse("dependencies:\n  - common\n", "/project/roles/db/meta/main.yml"))
                .tasks(loader.parse("- command: /bin/true\n", "/project/roles/db/tasks/main.yml"))
                .build();

        AstNode role = builder.buildRole(sources);

        List<AstNode> files = role.children(ChildRole.VARS);
        assertEquals(PrecedenceTier.ROLE_DEFAULTS, files.get(0).tier().orElseThrow());
        assertEquals(PrecedenceTier.ROLE_VARS, files.get(1).tier().orElseThrow());
        assertEquals("common", role.children(ChildRole.ROLES).get(0).target().orElseThrow());
        assertEquals(1, role.children(ChildRole.TASKS).size());
        assertEquals("/project/roles/db", role.target().orElseThrow());
    }

    @Test
    void graftedIncludeKeepsTheTree() {
        // Arrange
        AstNode playbook = build("""
                - hosts: all
                  tasks:
                    - include_tasks: setup.yml
                    - block:
                        - name: inner
                          command: /bin/true
                """);
        AstNode include = playbook.children(ChildRole.PLAYS).get(0).children(ChildRole.TASKS).get(0);
        List<AstNode> loaded = builder.buildIncludedTasks(loader.parse("""
                - name: from file
                  command: /bin/false
                  register: outcome
                """, "setup.yml"), false);

        // Act
        include.graft(loaded);

        // Assert
        assertTrue(include.isExpanded());
        assertSame(include, loaded.get(0).parent().orElseThrow());
        Set<AstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        playbook.descendants().forEach(node -> {
            assertTrue(seen.add(node), node.label() + " appears twice");
            node.children().forEach(child -> assertSame(node, child.parent().orElseThrow()));
        });
        assertTrue(playbook.parent().isEmpty());
        assertThrows(IllegalStateException.class, () -> include.graft(List.of()));
    }

    @Test
    void nodeCannotBeGraftedUnderASecondParent() {
        AstNode playbook = build("""
                - hosts: all
                  tasks:
                    - include_tasks: one.yml
                    - include_tasks: two.yml
                """);
        List<AstNode> tasks = playbook.children(ChildRole.PLAYS).get(0).children(ChildRole.TASKS);
        List<AstNode> loaded = builder.buildIncludedTasks(loader.parse("- ping:\n", "one.yml"), false);
        tasks.get(0).graft(loaded);

        assertThrows(IllegalStateException.class, () -> tasks.get(1).graft(loaded));
        assertSame(tasks.get(0), loaded.get(0).parent().orElseThrow());
    }

    private AstNode build(String yaml) {
        return builder.buildPlaybook(loader.parse(yaml, "site.yml"), "site.yml");
    }

    private AstNode firstTask(String yaml) {
        return build(yaml).children(ChildRole.PLAYS).get(0).children(ChildRole.TASKS).get(0);
    }
}
