package io.validrun.discovery;

import java.nio.file.Path;

/**
 * A loaded manifest together with the file it came from.
 */
public record Discovered<T>(T manifest, Path manifestPath) {
    public Path folder() {
        return manifestPath.getParent();
    }
}
