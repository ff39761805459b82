package com.kawari.proxy.core.rotation;

import com.kawari.proxy.core.constants.RotationStrategy;
import com.kawari.proxy.core.exceptions.ConfigException;
import com.kawari.proxy.core.selection.Selectors;
import com.kawari.proxy.spi.SelectionStrategy;
import java.util.List;

/**
 * Read-only set of client identities (User-Agent values) with the selection cursor.
 */
public class IdentityPool {
    private final List<String> identities;
    private final boolean rotate;
    private final String fixedIdentity;
    private final SelectionStrategy<String> selector;

    /**
     * Creates a pool over the built-in default identities.
     *
     * @param strategy selection strategy used when rotating.
     * @return a rotating pool.
     */
    public static IdentityPool defaults(RotationStrategy strategy) {
        return new IdentityPool(DefaultIdentities.USER_AGENTS, strategy, true, null);
    }

    /**
     * Creates a pool.
     *
     * @param identities    ordered identities; {@code null} or empty selects nothing and is rejected.
     * @param strategy      selection strategy used when rotating.
     * @param rotate        whether {@link #next()} rotates at all.
     * @param fixedIdentity identity returned when not rotating; {@code null} means the first entry.
     * @throws ConfigException if the pool is empty or contains blank entries.
     */
    public IdentityPool(List<String> identities, RotationStrategy strategy, boolean rotate, String fixedIdentity) {
        if (identities == null || identities.isEmpty()) {
            throw new ConfigException("Identity pool must contain at least one entry");
        }
        for (String identity : identities) {
            if (identity == null || identity.isBlank()) {
                throw new ConfigException("Identity pool contains a blank entry");
            }
        }
        if (fixedIdentity != null && fixedIdentity.isBlank()) {
            throw new ConfigException("Fixed identity must not be blank");
        }
        this.identities = List.copyOf(identities);
        this.rotate = rotate;
        this.fixedIdentity = fixedIdentity != null ? fixedIdentity : this.identities.get(0);
        this.selector = Selectors.forStrategy(strategy);
    }

    /**
     * Returns the identity for the next attempt.
     *
     * @return a member of the pool, or the fixed identity when rotation is disabled.
     */
    public String next() {
        if (!rotate) {
            return fixedIdentity;
        }
        return selector.select(identities);
    }

    public int size() {
        return identities.size();
    }

    public List<String> identities() {
        return identities;
    }

    public boolean contains(String identity) {
        return identities.contains(identity);
    }
}
