package com.vidnyan.playscan.domain.ast;

import com.vidnyan.playscan.domain.raw.RawNode;

import java.util.Optional;

/**
 * Loaded main files of a role. Every file is optional.
 */
public record RoleSources(
    String roleName,
    String rootPath,
    RawNode tasks,
    RawNode handlers,
    RawNode defaults,
    RawNode vars,
    RawNode meta
) {

    public Optional<RawNode> tasksFile() { return Optional.ofNullable(tasks); }
    public Optional<RawNode> handlersFile() { return Optional.ofNullable(handlers); }
    public Optional<RawNode> defaultsFile() { return Optional.ofNullable(defaults); }
    public Optional<RawNode> varsFile() { return Optional.ofNullable(vars); }
    public Optional<RawNode> metaFile() { return Optional.ofNullable(meta); }

    public static Builder builder(String roleName, String rootPath) {
        return new Builder(roleName, rootPath);
    }

    public static class Builder {
        private final String roleName;
        private final String rootPath;
        private RawNode tasks;
        private RawNode handlers;
        private RawNode defaults;
        private RawNode vars;
        private RawNode meta;

        private Builder(String roleName, String rootPath) {
            this.roleName = roleName;
            this.rootPath = rootPath;
        }

        public Builder tasks(RawNode n) { this.tasks = n; return this; }
        public Builder handlers(RawNode n) { this.handlers = n; return this; }
        public Builder defaults(RawNode n) { this.defaults = n; return this; }
        public Builder vars(RawNode n) { this.vars = n; return this; }
        public Builder meta(RawNode n) { this.meta = n; return this; }

        public RoleSources build() {
            return new RoleSources(roleName, rootPath, tasks, handlers, defaults, vars, meta);
        }
    }
}
