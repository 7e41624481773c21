package com.tessera.security;

import java.util.Optional;

/** Lookup of workspace settings. */
public interface WorkspaceDirectory {

    Optional<WorkspaceSettings> find(String workspaceId);
}
