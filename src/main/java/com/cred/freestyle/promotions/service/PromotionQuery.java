package com.cred.freestyle.promotions.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Raw list filters as received in the query string. A null field means the
 * parameter was not supplied; an empty string means it was supplied empty.
 *
 * Filters are mutually exclusive: only the first supplied one, in
 * {@link Filter} declaration order, is applied.
 *
 * @author Promotions Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionQuery {

    private static final Set<String> TRUE_VALUES = Set.of("true", "1", "yes");
    private static final Set<String> FALSE_VALUES = Set.of("false", "0", "no");

    private String id;
    private String active;
    private String name;
    private String productId;
    private String promotionType;

    /**
     * List filters in precedence order.
     */
    public enum Filter {
        ID("id"),
        ACTIVE("active"),
        NAME("name"),
        PRODUCT_ID("product_id"),
        PROMOTION_TYPE("promotion_type"),
        NONE("all");

        private final String parameter;

        Filter(String parameter) {
            this.parameter = parameter;
        }

        /**
         * @return the query-string parameter name
         */
        public String getParameter() {
            return parameter;
        }
    }

    public static PromotionQuery all() {
        return new PromotionQuery();
    }

    /**
     * Determine the filter to apply: the first supplied parameter wins.
     *
     * @return the applied filter, or {@link Filter#NONE} when no parameter was supplied
     */
    public Filter appliedFilter() {
        if (id != null) {
            return Filter.ID;
        }
        if (active != null) {
            return Filter.ACTIVE;
        }
        if (name != null) {
            return Filter.NAME;
        }
        if (productId != null) {
            return Filter.PRODUCT_ID;
        }
        if (promotionType != null) {
            return Filter.PROMOTION_TYPE;
        }
        return Filter.NONE;
    }

    /**
     * Strict boolean parse, case-insensitive and trimmed.
     * Accepts true/1/yes and false/0/no.
     *
     * @param raw Raw parameter value
     * @return the flag, or empty if the value is not recognised
     */
    public static Optional<Boolean> parseStrictBoolean(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(normalized)) {
            return Optional.of(Boolean.TRUE);
        }
        if (FALSE_VALUES.contains(normalized)) {
            return Optional.of(Boolean.FALSE);
        }
        return Optional.empty();
    }
}
