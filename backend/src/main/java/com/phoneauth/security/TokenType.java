package com.phoneauth.security;

/**
 * Purpose of a token, carried in the {@code token_type} claim.
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }

    /**
     * @param claimValue value of the {@code token_type} claim, may be null
     * @return the matching type, or null if the value is unknown
     */
    public static TokenType fromClaim(String claimValue) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(claimValue)) {
                return type;
            }
        }
        return null;
    }
}
