package com.vidnyan.playscan.support;

import com.vidnyan.playscan.adapter.out.yaml.SnakeYamlRawTreeLoader;
import com.vidnyan.playscan.domain.ast.RoleSources;
import com.vidnyan.playscan.domain.error.RawTreeLoadException;
import com.vidnyan.playscan.domain.error.RoleNotFoundException;
import com.vidnyan.playscan.domain.graph.AnalysisUnit;
import com.vidnyan.playscan.domain.graph.PdgBuildResult;
import com.vidnyan.playscan.domain.graph.PdgBuilder;
import com.vidnyan.playscan.domain.graph.ScriptSource;
import com.vidnyan.playscan.domain.raw.RawNode;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Script files and roles held in memory, parsed with the real YAML loader.
 * Roles live under {@code /project/roles/<name>}.
 */
public class InMemoryScriptSource implements ScriptSource {

    public static final Path PLAYBOOK = Path.of("/project/site.yml");

    private final SnakeYamlRawTreeLoader loader = new SnakeYamlRawTreeLoader();
    private final Map<Path, String> files = new HashMap<>();
    private final Map<String, Map<String, String>> roles = new HashMap<>();

    public InMemoryScriptSource file(String path, String content) {
        files.put(Path.of(path).normalize(), content);
        return this;
    }

    /**
     * Add a role section, e.g. {@code role("web", "tasks", "...")}.
     */
    public InMemoryScriptSource role(String name, String section, String content) {
        roles.computeIfAbsent(name, n -> new HashMap<>()).put(section, content);
        return this;
    }

    @Override
    public boolean exists(Path file) {
        return files.containsKey(file.normalize());
    }

    @Override
    public RawNode load(Path file) {
        String content = files.get(file.normalize());
        if (content == null) {
            throw new RawTreeLoadException(file, "no such file", null);
        }
        return loader.parse(content, file.toString());
    }

    @Override
    public RoleSources loadRole(String roleName, Path baseDir) {
        Map<String, String> sections = roles.get(roleName);
        if (sections == null) {
            throw new RoleNotFoundException(roleName, List.of(baseDir.resolve("roles")));
        }
        String root = "/project/roles/" + roleName;
        return RoleSources.builder(roleName, root)
                .tasks(section(root, sections, "tasks"))
                .handlers(section(root, sections, "handlers"))
                .defaults(section(root, sections, "defaults"))
                .vars(section(root, sections, "vars"))
                .meta(section(root, sections, "meta"))
                .build();
    }

    private RawNode section(String root, Map<String, String> sections, String name) {
        String content = sections.get(name);
        return content == null ? null : loader.parse(content, root + "/" + name + "/main.yml");
    }

    /**
     * Build the graph of a playbook held at {@link #PLAYBOOK}.
     */
    public static PdgBuildResult buildPlaybook(String content) {
        InMemoryScriptSource source = new InMemoryScriptSource().file(PLAYBOOK.toString(), content);
        return new PdgBuilder().build(AnalysisUnit.playbook(PLAYBOOK, source));
    }

    public PdgBuildResult build() {
        return new PdgBuilder().build(AnalysisUnit.playbook(PLAYBOOK, this));
    }

    public PdgBuildResult buildRole(String roleName) {
        return new PdgBuilder().build(AnalysisUnit.role(Path.of("/project/roles/" + roleName), this));
    }
}
