package com.tessera.security;

import java.util.Optional;

/** Lookup of role memberships, backed by whatever holds workspace and project members. */
public interface MembershipDirectory {

    Optional<RoleMembership> find(ContextType contextType, String contextId, String userId);
}
