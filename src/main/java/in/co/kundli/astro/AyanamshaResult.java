package in.co.kundli.astro;

/**
 * Outcome of resolving an ayanamsha request: what was asked for, what was applied and the value in degrees.
 */
public class AyanamshaResult {
    private final Ayanamsha requested;
    private final Ayanamsha applied;
    private final double value;

    public AyanamshaResult(Ayanamsha requested, Ayanamsha applied, double value) {
        this.requested = requested;
        this.applied = applied;
        this.value = value;
    }

    public Ayanamsha getRequested() {
        return requested;
    }

    public Ayanamsha getApplied() {
        return applied;
    }

    public double getValue() {
        return value;
    }

    public boolean isFallback() {
        return requested != applied;
    }
}
