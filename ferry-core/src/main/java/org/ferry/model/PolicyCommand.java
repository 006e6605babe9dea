package org.ferry.model;

/**
 * Command a row-level security policy applies to, with the single-letter code used by pg_policy.polcmd.
 */
public enum PolicyCommand {
    SELECT("r"),
    INSERT("a"),
    UPDATE("w"),
    DELETE("d"),
    ALL("*");

    private final String catalogCode;

    PolicyCommand(String catalogCode) {
        this.catalogCode = catalogCode;
    }

    public String getCatalogCode() {
        return catalogCode;
    }

    public static PolicyCommand fromCatalogCode(String code) {
        for (PolicyCommand command : values()) {
            if (command.catalogCode.equals(code)) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unknown policy command code: " + code);
    }
}
