package com.shiplock.core.model;

/**
 * One entry of the control plane's build listing, as seen on a single poll.
 *
 * @param handle    build id
 * @param revision  revision the build was made from, or {@code null} if the listing omits it
 * @param rawStatus status token exactly as reported, possibly empty
 */
public record BuildRecord(BuildHandle handle, String revision, String rawStatus) {

    public boolean matches(BuildHandle other) {
        return handle.equals(other);
    }
}
