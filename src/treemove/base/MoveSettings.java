package treemove.base;

/**
 * This is a container class for the parameters of the topology moves.
 */
public class MoveSettings {

    public static final String RESTORE_PROPERTY = "treemove.restoreOnFailedRegraft";
    public static final String MIN_RADIUS_PROPERTY = "treemove.minRadius";
    public static final String MAX_RADIUS_PROPERTY = "treemove.maxRadius";

    /**
     * If an SPR move fails after its prune step, put the pruned subtree back where it was.
     * If false the tree is left pruned and the caller must reattach the fragment.
     */
    public boolean restoreOnFailedRegraft;

    /**
     * Smallest distance, counted from the parent of the pruned node, of a regraft target in an SPR round.
     */
    public int minRadius;

    /**
     * Largest distance of a regraft target in an SPR round.
     */
    public int maxRadius;

    public MoveSettings(boolean restoreOnFailedRegraft, int minRadius, int maxRadius) {
        if (maxRadius < minRadius)
            throw new IllegalArgumentException("Invalid radius range: " + minRadius + ".." + maxRadius);
        this.restoreOnFailedRegraft = restoreOnFailedRegraft;
        this.minRadius = minRadius;
        this.maxRadius = maxRadius;
    }

    /**
     * The default settings, overridden by the {@code treemove.*} system properties where present.
     */
    public static MoveSettings defaults() {
        return new MoveSettings(
                booleanProperty(RESTORE_PROPERTY, true),
                intProperty(MIN_RADIUS_PROPERTY, 1),
                intProperty(MAX_RADIUS_PROPERTY, 3));
    }

    private static boolean booleanProperty(String key, boolean def) {
        String value = System.getProperty(key);
        if (value == null)
            return def;
        if (value.equalsIgnoreCase("true"))
            return true;
        if (value.equalsIgnoreCase("false"))
            return false;
        throw new IllegalArgumentException("Invalid value for " + key + ": " + value);
    }

    private static int intProperty(String key, int def) {
        String value = System.getProperty(key);
        if (value == null)
            return def;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "restoreOnFailedRegraft=" + restoreOnFailedRegraft
                + ", radius=" + minRadius + ".." + maxRadius;
    }
}
