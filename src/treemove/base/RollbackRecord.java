package treemove.base;

import java.util.OptionalDouble;

/**
 * The information needed to undo one rearrangement, see {@link SprMove#rollback}.
 * <p>
 * Branch lengths are not tracked yet: the four length fields are always empty and
 * {@link #hasBranchLengths()} returns false, so a rollback restores the topology only.
 */
public final class RollbackRecord {

    private final RearrangeType type;
    private final boolean rooted;

    /** The node that was pruned. */
    private final RootedNode pruneEdge;
    /** The sister of the pruned node before the move, ie. the edge to regraft onto when undoing. */
    private final RootedNode regraftEdge;

    // TODO: fill these once nodes carry edge lengths
    private final OptionalDouble pruneLength = OptionalDouble.empty();
    private final OptionalDouble pruneLeftLength = OptionalDouble.empty();
    private final OptionalDouble pruneRightLength = OptionalDouble.empty();
    private final OptionalDouble regraftLength = OptionalDouble.empty();

    RollbackRecord(RearrangeType type, boolean rooted, RootedNode pruneEdge, RootedNode regraftEdge) {
        this.type = type;
        this.rooted = rooted;
        this.pruneEdge = pruneEdge;
        this.regraftEdge = regraftEdge;
    }

    public RearrangeType getType() {
        return type;
    }

    public boolean isRooted() {
        return rooted;
    }

    public RootedNode getPruneEdge() {
        return pruneEdge;
    }

    public RootedNode getRegraftEdge() {
        return regraftEdge;
    }

    public OptionalDouble getPruneLength() {
        return pruneLength;
    }

    public OptionalDouble getPruneLeftLength() {
        return pruneLeftLength;
    }

    public OptionalDouble getPruneRightLength() {
        return pruneRightLength;
    }

    public OptionalDouble getRegraftLength() {
        return regraftLength;
    }

    public boolean hasBranchLengths() {
        return pruneLength.isPresent();
    }

    @Override
    public String toString() {
        return type + " (prune " + pruneEdge + ", regraft " + regraftEdge + ")";
    }
}
