package bytebeat.types;

public enum PrimitiveType {
    INT("int"),
    FLOAT("float"),
    BOOL("bool");

    private final String keyword;

    PrimitiveType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    public static PrimitiveType fromKeyword(String keyword) {
        for (PrimitiveType t : values()) {
            if (t.keyword.equals(keyword)) return t;
        }
        return null;
    }

    @Override
    public String toString() {
        return keyword;
    }
}
