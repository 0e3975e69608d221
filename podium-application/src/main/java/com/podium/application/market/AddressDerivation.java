package com.podium.application.market;

import com.podium.domain.account.Address;
import org.bouncycastle.crypto.digests.KeccakDigest;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Deterministic object addresses: keccak256 over the creator address bytes,
 * a domain separator and a name.
 */
public final class AddressDerivation {

    public static final String OUTPOST_SEPARATOR = "PodiumOutposts::";
    public static final String ENGINE_SEPARATOR = "PodiumEngine::";

    /** Creator of the engine-owned accounts. */
    private static final Address ENGINE_ROOT = Address.of("0x0");

    private AddressDerivation() {}

    public static Address outpost(Address creator, String name) {
        Objects.requireNonNull(creator, "creator");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Outpost name is blank");
        }
        return derive(creator, OUTPOST_SEPARATOR, name.trim());
    }

    /** Account holding minted passes between mint and delivery. */
    public static Address escrowAccount() {
        return derive(ENGINE_ROOT, ENGINE_SEPARATOR, "escrow");
    }

    /** Settlement account mirroring the redemption vault. */
    public static Address vaultAccount() {
        return derive(ENGINE_ROOT, ENGINE_SEPARATOR, "vault");
    }

    static Address derive(Address creator, String separator, String name) {
        KeccakDigest digest = new KeccakDigest(256);
        byte[] creatorBytes = creator.bytes();
        byte[] sep = separator.getBytes(StandardCharsets.UTF_8);
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        digest.update(creatorBytes, 0, creatorBytes.length);
        digest.update(sep, 0, sep.length);
        digest.update(nameBytes, 0, nameBytes.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Address.of(out);
    }
}
