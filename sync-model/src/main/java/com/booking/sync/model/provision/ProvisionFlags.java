package com.booking.sync.model.provision;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable set of artifact kinds a provisioning call touches.
 * {@link SyncProvision#ALL} expands to tracking tables, stored procedures, triggers and scope;
 * {@link SyncProvision#TABLE} is only ever present when requested explicitly.
 */
public final class ProvisionFlags implements Serializable {

    private static final Set<SyncProvision> ALL = Collections.unmodifiableSet(EnumSet.of(
            SyncProvision.TRACKING_TABLE,
            SyncProvision.STORED_PROCEDURES,
            SyncProvision.TRIGGERS,
            SyncProvision.SCOPE
    ));

    private final EnumSet<SyncProvision> flags;

    private ProvisionFlags(EnumSet<SyncProvision> flags) {
        this.flags = flags;
    }

    public static ProvisionFlags of(SyncProvision first, SyncProvision... rest) {
        EnumSet<SyncProvision> flags = EnumSet.noneOf(SyncProvision.class);

        ProvisionFlags.add(flags, first);

        for (SyncProvision provision : rest) {
            ProvisionFlags.add(flags, provision);
        }

        return new ProvisionFlags(flags);
    }

    public static ProvisionFlags all() {
        return ProvisionFlags.of(SyncProvision.ALL);
    }

    public static ProvisionFlags none() {
        return new ProvisionFlags(EnumSet.noneOf(SyncProvision.class));
    }

    public ProvisionFlags with(SyncProvision provision) {
        EnumSet<SyncProvision> flags = EnumSet.copyOf(this.flags);

        ProvisionFlags.add(flags, provision);

        return new ProvisionFlags(flags);
    }

    public boolean has(SyncProvision provision) {
        if (provision == SyncProvision.ALL) {
            return this.flags.containsAll(ProvisionFlags.ALL);
        }
        return this.flags.contains(provision);
    }

    public boolean isEmpty() {
        return this.flags.isEmpty();
    }

    public Set<SyncProvision> toSet() {
        return Collections.unmodifiableSet(this.flags);
    }

    private static void add(EnumSet<SyncProvision> flags, SyncProvision provision) {
        if (provision == SyncProvision.ALL) {
            flags.addAll(ProvisionFlags.ALL);
        } else {
            flags.add(provision);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (ProvisionFlags.class.isInstance(other)) {
            return this.flags.equals(ProvisionFlags.class.cast(other).flags);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return this.flags.hashCode();
    }

    @Override
    public String toString() {
        return this.flags.toString();
    }
}
