package com.edwardjones.personnelsync.model.domain;

/**
 * Maps one source attribute onto the key the destination expects.
 *
 * {@code caseSensitive} is carried through from configuration but matching is always
 * case-insensitive on the compare key.
 */
public record AttributeMapping(
    String sourceKey,
    String destinationKey,
    boolean required,
    boolean caseSensitive
) {

    public static AttributeMapping optional(String sourceKey, String destinationKey) {
        return new AttributeMapping(sourceKey, destinationKey, false, false);
    }

    public static AttributeMapping required(String sourceKey, String destinationKey) {
        return new AttributeMapping(sourceKey, destinationKey, true, false);
    }
}
