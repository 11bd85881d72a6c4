package com.cred.freestyle.promotions.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Supported promotion types.
 *
 * @author Promotions Team
 */
public enum PromotionType {

    /**
     * Percentage off the product price.
     */
    PERCENT,

    /**
     * Fixed amount off the product price.
     */
    DISCOUNT,

    /**
     * Buy one, get one.
     */
    BOGO;

    /**
     * Resolve a type from its exact (case-sensitive) name.
     *
     * @param name Type name, e.g. "BOGO"
     * @return the type, or empty if the name is unknown
     */
    public static Optional<PromotionType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equals(name))
                .findFirst();
    }

    /**
     * Names of all types, sorted alphabetically (used in error messages).
     */
    public static List<String> allowedNames() {
        return Arrays.stream(values())
                .map(Enum::name)
                .sorted()
                .collect(Collectors.toList());
    }
}
