package com.payment.stripe.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed mapping from discriminator value to concrete class for one union type.
 *
 * @param <T> the union supertype
 */
public final class DiscriminatorRegistry<T> {

    private final Class<T> unionType;
    private final String field;
    private final Map<String, Class<? extends T>> variants;

    private DiscriminatorRegistry(Class<T> unionType, String field, Map<String, Class<? extends T>> variants) {
        this.unionType = unionType;
        this.field = field;
        this.variants = Collections.unmodifiableMap(new LinkedHashMap<>(variants));
    }

    public static <T> Builder<T> builder(Class<T> unionType) {
        return new Builder<>(unionType);
    }

    public Class<T> getUnionType() {
        return unionType;
    }

    public String getField() {
        return field;
    }

    public Optional<Class<? extends T>> lookup(String discriminator) {
        return Optional.ofNullable(variants.get(discriminator));
    }

    public Set<String> knownDiscriminators() {
        return variants.keySet();
    }

    public static final class Builder<T> {

        private final Class<T> unionType;
        private final Map<String, Class<? extends T>> variants = new LinkedHashMap<>();
        private String field = "object";

        private Builder(Class<T> unionType) {
            this.unionType = unionType;
        }

        public Builder<T> field(String field) {
            this.field = field;
            return this;
        }

        public Builder<T> variant(String discriminator, Class<? extends T> type) {
            if (variants.putIfAbsent(discriminator, type) != null) {
                throw new IllegalArgumentException("Duplicate discriminator '" + discriminator + "' for " + unionType.getSimpleName());
            }
            return this;
        }

        public DiscriminatorRegistry<T> build() {
            return new DiscriminatorRegistry<>(unionType, field, variants);
        }
    }
}
