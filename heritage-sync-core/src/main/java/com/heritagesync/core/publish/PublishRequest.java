package com.heritagesync.core.publish;

import com.heritagesync.core.model.HeritageSite;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Dataset to publish and where to publish it.
 *
 * @param sites validated sites
 * @param primary primary dataset location
 * @param secondary additional locations receiving the same bytes
 */
public record PublishRequest(
    List<HeritageSite> sites,
    Path primary,
    List<Path> secondary
) {
    public PublishRequest {
        Objects.requireNonNull(sites, "sites must not be null");
        Objects.requireNonNull(primary, "primary must not be null");
        sites = List.copyOf(sites);
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
    }

    /**
     * Returns every distinct target, primary first.
     *
     * @return normalized absolute target paths
     */
    public List<Path> targets() {
        Set<Path> targets = new LinkedHashSet<>();
        targets.add(primary.toAbsolutePath().normalize());
        for (Path path : secondary) {
            targets.add(path.toAbsolutePath().normalize());
        }
        return new ArrayList<>(targets);
    }
}
