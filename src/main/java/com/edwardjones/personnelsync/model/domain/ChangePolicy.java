package com.edwardjones.personnelsync.model.domain;

/**
 * Categories of change a destination refuses to receive.
 */
public record ChangePolicy(boolean disableAdd, boolean disableUpdate, boolean disableDelete) {

    public static final ChangePolicy ALLOW_ALL = new ChangePolicy(false, false, false);
}
