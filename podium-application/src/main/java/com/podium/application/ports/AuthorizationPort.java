package com.podium.application.ports;

import com.podium.domain.account.Address;

/**
 * Answers who may do what. Identity of the caller is established by the host.
 */
public interface AuthorizationPort {

    boolean isAdmin(Address caller);

    boolean isOwner(Address caller, Address outpost);
}
