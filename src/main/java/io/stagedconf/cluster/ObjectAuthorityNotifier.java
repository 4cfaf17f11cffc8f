package io.stagedconf.cluster;

/**
 * Fire-and-forget signal that the set of objects changed and authority over them should be
 * redistributed across the zone.
 */
@FunctionalInterface
public interface ObjectAuthorityNotifier {
    void updateObjectAuthority();
}
