package com.vidnyan.playscan.application.service;

import com.vidnyan.playscan.application.port.out.RawTreeLoader;
import com.vidnyan.playscan.application.port.out.RoleResolver;
import com.vidnyan.playscan.application.port.out.RoleResolver.RoleFiles;
import com.vidnyan.playscan.domain.ast.RoleSources;
import com.vidnyan.playscan.domain.graph.ScriptSource;
import com.vidnyan.playscan.domain.raw.RawNode;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Script source backed by the loader and role resolver ports.
 */
public class PortScriptSource implements ScriptSource {

    private final RawTreeLoader loader;
    private final RoleResolver roleResolver;

    public PortScriptSource(RawTreeLoader loader, RoleResolver roleResolver) {
        this.loader = loader;
        this.roleResolver = roleResolver;
    }

    @Override
    public boolean exists(Path file) {
        return Files.isRegularFile(file);
    }

    @Override
    public RawNode load(Path file) {
        return loader.load(file);
    }

    @Override
    public RoleSources loadRole(String roleName, Path baseDir) {
        RoleFiles files = roleResolver.resolve(roleName, baseDir);
        return RoleSources.builder(files.roleName(), files.rootPath().toString())
                .tasks(loadSection(files, RoleFiles.TASKS))
                .handlers(loadSection(files, RoleFiles.HANDLERS))
                .defaults(loadSection(files, RoleFiles.DEFAULTS))
                .vars(loadSection(files, RoleFiles.VARS))
                .meta(loadSection(files, RoleFiles.META))
                .build();
    }

    private RawNode loadSection(RoleFiles files, String section) {
        return files.mainFile(section).map(loader::load).orElse(null);
    }
}
