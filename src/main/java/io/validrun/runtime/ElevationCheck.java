package io.validrun.runtime;

/**
 * Tells whether the current process runs with administrative rights.
 */
@FunctionalInterface
public interface ElevationCheck {
    boolean isElevated();

    static ElevationCheck fixed(boolean elevated) {
        return () -> elevated;
    }
}
