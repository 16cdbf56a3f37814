package io.github.eutro.cfgopt.cse;

import com.google.common.base.Preconditions;

/**
 * Options for common subexpression elimination. Instances are immutable;
 * the {@code with...} methods return modified copies.
 */
public final class CseConfig {
    /**
     * Whether to check the consistency of every analysis set after it is merged or killed from,
     * by default. Set with the {@code CFGOPT_CHECK_INVARIANTS} environment variable.
     */
    public static boolean CHECK_INVARIANTS = System.getenv("CFGOPT_CHECK_INVARIANTS") != null;

    public static final CseConfig DEFAULT = new CseConfig(true, "%d.cse_temp", CHECK_INVARIANTS);

    private final boolean hoistAcrossBranches;
    private final String temporaryNameFormat;
    private final boolean checkInvariants;

    private CseConfig(boolean hoistAcrossBranches, String temporaryNameFormat, boolean checkInvariants) {
        this.hoistAcrossBranches = hoistAcrossBranches;
        this.temporaryNameFormat = temporaryNameFormat;
        this.checkInvariants = checkInvariants;
    }

    /**
     * Whether a value computed in several branches may be computed once in a block
     * dominating all of them instead. When false, only occurrences dominated by the
     * first computation are shared.
     *
     * @return Whether hoisting is enabled.
     */
    public boolean hoistAcrossBranches() {
        return hoistAcrossBranches;
    }

    /**
     * The format of temporary variable names, given a counter that starts at 1 for each graph.
     *
     * @return The format string.
     */
    public String temporaryNameFormat() {
        return temporaryNameFormat;
    }

    public boolean checkInvariants() {
        return checkInvariants;
    }

    public CseConfig withHoistAcrossBranches(boolean hoistAcrossBranches) {
        return new CseConfig(hoistAcrossBranches, temporaryNameFormat, checkInvariants);
    }

    public CseConfig withTemporaryNameFormat(String temporaryNameFormat) {
        Preconditions.checkArgument(temporaryNameFormat.contains("%d"), "format has no counter: %s", temporaryNameFormat);
        return new CseConfig(hoistAcrossBranches, temporaryNameFormat, checkInvariants);
    }

    public CseConfig withCheckInvariants(boolean checkInvariants) {
        return new CseConfig(hoistAcrossBranches, temporaryNameFormat, checkInvariants);
    }

    @Override
    public String toString() {
        return "CseConfig{hoistAcrossBranches=" + hoistAcrossBranches
                + ", temporaryNameFormat=" + temporaryNameFormat
                + ", checkInvariants=" + checkInvariants + "}";
    }
}
