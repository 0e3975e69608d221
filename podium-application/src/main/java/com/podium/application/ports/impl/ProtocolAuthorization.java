package com.podium.application.ports.impl;

import com.podium.application.market.OutpostRegistry;
import com.podium.application.ports.AuthorizationPort;
import com.podium.domain.account.Address;

import java.util.Objects;

/**
 * Admin is fixed at startup; outpost ownership is read from the registry.
 */
public final class ProtocolAuthorization implements AuthorizationPort {

    private final Address admin;
    private final OutpostRegistry outposts;

    public ProtocolAuthorization(Address admin, OutpostRegistry outposts) {
        this.admin = Objects.requireNonNull(admin, "admin");
        this.outposts = Objects.requireNonNull(outposts, "outposts");
    }

    @Override
    public boolean isAdmin(Address caller) {
        return admin.equals(caller);
    }

    @Override
    public boolean isOwner(Address caller, Address outpost) {
        if (caller == null || outpost == null) return false;
        return outposts.find(outpost).map(o -> o.isOwner(caller)).orElse(false);
    }

    public Address admin() {
        return admin;
    }
}
