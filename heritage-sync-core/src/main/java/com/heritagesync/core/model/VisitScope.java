package com.heritagesync.core.model;

import java.util.Objects;

/**
 * Scope a per-user visit is recorded against: a whole property or one of its components.
 *
 * <p>Downstream tracking stores the scope as a single string key. A whole-property scope is
 * encoded as {@value #PROPERTY_PREFIX} followed by the site id; a component scope is the bare
 * component id. Real component ids therefore never start with {@value #PROPERTY_PREFIX}.
 *
 * <pre>{@code
 * VisitScope.decode("property:438");   // PropertyScope[siteId=438]
 * VisitScope.decode("Q29583927");      // ComponentScope[componentId=Q29583927]
 * new VisitScope.PropertyScope("438").encode();  // "property:438"
 * }</pre>
 */
public interface VisitScope {

    /**
     * Reserved prefix of whole-property visit keys.
     */
    String PROPERTY_PREFIX = "property:";

    /**
     * Encodes this scope as a visit key.
     *
     * @return visit key
     */
    String encode();

    /**
     * Decodes a visit key.
     *
     * @param key visit key
     * @return decoded scope
     * @throws IllegalArgumentException if the key is blank or a property key without site id
     */
    static VisitScope decode(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Visit key must not be blank");
        }
        if (isReserved(key)) {
            String siteId = key.substring(PROPERTY_PREFIX.length());
            if (siteId.isBlank()) {
                throw new IllegalArgumentException("Property visit key has no site id: " + key);
            }
            return new PropertyScope(siteId);
        }
        return new ComponentScope(key);
    }

    /**
     * Returns true if {@code componentId} collides with the reserved property prefix.
     *
     * @param componentId candidate component id
     * @return true if reserved
     */
    static boolean isReserved(String componentId) {
        return componentId != null && componentId.startsWith(PROPERTY_PREFIX);
    }

    /**
     * Visit recorded against a whole property.
     *
     * @param siteId property id
     */
    record PropertyScope(String siteId) implements VisitScope {
        public PropertyScope {
            Objects.requireNonNull(siteId, "siteId must not be null");
        }

        @Override
        public String encode() {
            return PROPERTY_PREFIX + siteId;
        }
    }

    /**
     * Visit recorded against one component.
     *
     * @param componentId component id
     */
    record ComponentScope(String componentId) implements VisitScope {
        public ComponentScope {
            Objects.requireNonNull(componentId, "componentId must not be null");
            if (isReserved(componentId)) {
                throw new IllegalArgumentException("Component id uses reserved prefix: " + componentId);
            }
        }

        @Override
        public String encode() {
            return componentId;
        }
    }
}
