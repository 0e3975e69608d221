package com.podium.application.market;

import com.podium.domain.MarketError;
import com.podium.domain.MarketException;
import com.podium.domain.account.Address;
import com.podium.domain.config.ProtocolConfig;
import com.podium.domain.ledger.PassSupplyLedger;
import com.podium.domain.ledger.RedemptionVault;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Shared state of one market engine instance.
 *
 * <p>Created once by the host and handed to every service. Holds the protocol
 * config snapshot, the vault, the supply book, the outpost table, the pass
 * handles and the entity locks.
 */
public final class MarketContext {

    private final AtomicReference<ProtocolConfig> config;
    private final RedemptionVault vault;
    private final PassSupplyLedger supply;
    private final OutpostRegistry outposts;
    private final PassAssetRegistry assets;
    private final EntityLocks locks;
    private final Address escrowAccount;
    private final Address vaultAccount;

    public MarketContext(ProtocolConfig initialConfig,
                         RedemptionVault vault,
                         PassSupplyLedger supply,
                         OutpostRegistry outposts,
                         PassAssetRegistry assets,
                         EntityLocks locks) {
        this.config = new AtomicReference<>(Objects.requireNonNull(initialConfig, "initialConfig"));
        this.vault = Objects.requireNonNull(vault, "vault");
        this.supply = Objects.requireNonNull(supply, "supply");
        this.outposts = Objects.requireNonNull(outposts, "outposts");
        this.assets = Objects.requireNonNull(assets, "assets");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.escrowAccount = AddressDerivation.escrowAccount();
        this.vaultAccount = AddressDerivation.vaultAccount();
    }

    /** Snapshot for one call. Later admin updates do not affect it. */
    public ProtocolConfig config() {
        return config.get();
    }

    /** @return the config now in effect */
    public ProtocolConfig updateConfig(UnaryOperator<ProtocolConfig> change) {
        return config.updateAndGet(change);
    }

    public RedemptionVault vault() { return vault; }
    public PassSupplyLedger supply() { return supply; }
    public OutpostRegistry outposts() { return outposts; }
    public PassAssetRegistry assets() { return assets; }
    public EntityLocks locks() { return locks; }
    public Address escrowAccount() { return escrowAccount; }
    public Address vaultAccount() { return vaultAccount; }

    public boolean isEngineAccount(Address account) {
        return vaultAccount.equals(account) || escrowAccount.equals(account);
    }

    /**
     * Rejects the vault and escrow accounts as a party to a call. Null parties are skipped.
     *
     * @throws MarketException {@code NOT_OWNER} naming the offending role
     */
    public void requireExternal(String role, Address... parties) {
        for (Address party : parties) {
            if (party != null && isEngineAccount(party)) {
                throw new MarketException(MarketError.NOT_OWNER,
                        role + " cannot be an engine account: " + party);
            }
        }
    }
}
