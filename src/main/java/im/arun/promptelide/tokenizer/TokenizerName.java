package im.arun.promptelide.tokenizer;

public enum TokenizerName {
    CL100K("cl100k_base"),
    O200K("o200k_base"),
    MOCK("mock"),
    APPROXIMATE("approximate");

    private final String id;

    TokenizerName(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Accepts either the encoding id ({@code cl100k_base}) or the constant name ({@code cl100k}).
     */
    public static TokenizerName fromId(String value) {
        for (TokenizerName name : values()) {
            if (name.id.equalsIgnoreCase(value) || name.name().equalsIgnoreCase(value)) {
                return name;
            }
        }
        throw new IllegalArgumentException("Unknown tokenizer: " + value
                + " (expected one of cl100k_base, o200k_base, mock, approximate)");
    }

    @Override
    public String toString() {
        return id;
    }
}
