package com.openforge.rxmate.pharmacy;

import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/** Filter building blocks shared by the flexible query tools. */
final class PharmacySpecifications {

    private PharmacySpecifications() {}

    /** Case-insensitive substring match; matches everything when {@code value} is null. */
    static <T> Specification<T> containsIgnoreCase(String attribute, String value) {
        if (value == null) return null;
        String pattern = "%" + value.toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get(attribute)), pattern);
    }

    static <T> Specification<T> equalTo(String attribute, Object value) {
        if (value == null) return null;
        return (root, query, cb) -> cb.equal(root.get(attribute), value);
    }

    /** AND of the non-null parts; everything when none are given. */
    @SafeVarargs
    static <T> Specification<T> allOf(Specification<T>... parts) {
        Specification<T> combined = Specification.where(null);
        for (Specification<T> part : parts) {
            if (part != null) combined = combined.and(part);
        }
        return combined;
    }

    /** OR of the non-null parts, or null when none are given. */
    @SafeVarargs
    static <T> Specification<T> anyOf(Specification<T>... parts) {
        Specification<T> combined = null;
        for (Specification<T> part : parts) {
            if (part == null) continue;
            combined = combined == null ? Specification.where(part) : combined.or(part);
        }
        return combined;
    }
}
