package com.tessera.security;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** {@link WorkspaceDirectory} held in memory. */
public class InMemoryWorkspaceDirectory implements WorkspaceDirectory {

    private final Map<String, WorkspaceSettings> workspaces = new ConcurrentHashMap<>();

    public InMemoryWorkspaceDirectory put(WorkspaceSettings settings) {
        workspaces.put(settings.workspaceId(), settings);
        return this;
    }

    @Override
    public Optional<WorkspaceSettings> find(String workspaceId) {
        return workspaceId == null
                ? Optional.empty()
                : Optional.ofNullable(workspaces.get(workspaceId));
    }
}
