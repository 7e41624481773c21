package com.tessera.security;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** {@link MembershipDirectory} held in memory; one membership per (context, user). */
public class InMemoryMembershipDirectory implements MembershipDirectory {

    private record Key(ContextType contextType, String contextId, String userId) {}

    private final Map<Key, RoleMembership> memberships = new ConcurrentHashMap<>();

    /** Adds a membership, replacing the user's previous role in that context. */
    public InMemoryMembershipDirectory grant(RoleMembership membership) {
        memberships.put(
                new Key(membership.contextType(), membership.contextId(), membership.userId()),
                membership);
        return this;
    }

    public void revoke(ContextType contextType, String contextId, String userId) {
        memberships.remove(new Key(contextType, contextId, userId));
    }

    @Override
    public Optional<RoleMembership> find(ContextType contextType, String contextId, String userId) {
        return Optional.ofNullable(memberships.get(new Key(contextType, contextId, userId)));
    }
}
