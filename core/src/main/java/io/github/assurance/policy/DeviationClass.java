package io.github.assurance.policy;

/**
 * Verdict of comparing one sample against one baseline level.
 *
 * <ul>
 *   <li><b>STABLE</b>: deviation below the fraction threshold (or no usable baseline)</li>
 *   <li><b>NEAR_DROP</b>: just past the threshold, inside the near band - weak signal</li>
 *   <li><b>DROP</b>: definite drop below the severe level</li>
 *   <li><b>SEVERE_DROP</b>: deviation at or past the severity fraction</li>
 * </ul>
 */
public enum DeviationClass {
    STABLE,
    NEAR_DROP,
    DROP,
    SEVERE_DROP;

    /**
     * Whether this verdict counts as a drop in a quorum vote.
     */
    public boolean isDrop() {
        return this != STABLE;
    }
}
