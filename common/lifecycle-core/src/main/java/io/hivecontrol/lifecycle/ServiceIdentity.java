package io.hivecontrol.lifecycle;

/**
 * Fleet-unique identity ({@code sid}) of the current worker. Used to address control commands and
 * to tag heartbeats.
 */
public record ServiceIdentity(String sid) {

    public ServiceIdentity {
        if (sid == null || sid.isBlank()) {
            throw new IllegalArgumentException("sid must not be null or blank");
        }
        sid = sid.trim();
    }

    /**
     * Exact comparison; a padded or differently cased candidate addresses another worker.
     */
    public boolean matches(String candidate) {
        return sid.equals(candidate);
    }

    @Override
    public String toString() {
        return sid;
    }
}
