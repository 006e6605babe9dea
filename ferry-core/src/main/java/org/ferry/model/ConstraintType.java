package org.ferry.model;

public enum ConstraintType {
    PRIMARY_KEY("p"),
    UNIQUE("u"),
    FOREIGN_KEY("f"),
    CHECK("c"),
    EXCLUSION("x");

    private final String catalogCode;

    ConstraintType(String catalogCode) {
        this.catalogCode = catalogCode;
    }

    public String getCatalogCode() {
        return catalogCode;
    }

    /**
     * Key constraints must exist before rows are loaded so that conflict handling can rely on them.
     */
    public boolean isKey() {
        return this == PRIMARY_KEY || this == UNIQUE;
    }

    public static ConstraintType fromCatalogCode(String code) {
        for (ConstraintType type : values()) {
            if (type.catalogCode.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown constraint type code: " + code);
    }
}
