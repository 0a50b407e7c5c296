package tree.suffix;

import java.util.EnumSet;
import java.util.function.Supplier;

/**
 * Construction algorithm selector. Both strategies produce trees with the same shape for the
 * same text; only node ids and child iteration order may differ.
 */
public enum BuildStrategy {
    NAIVE("naive", NaiveBuilder::new),
    UKKONEN("ukkonen", UkkonenBuilder::new);

    private final String token;
    private final Supplier<SuffixTreeBuilder> builder;

    BuildStrategy(String token, Supplier<SuffixTreeBuilder> builder) {
        this.token = token;
        this.builder = builder;
    }

    public String token() { return token; }

    SuffixTreeBuilder newBuilder() {
        return builder.get();
    }

    public static BuildStrategy fromString(String value) {
        return EnumSet.allOf(BuildStrategy.class).stream()
                .filter(type -> type.token.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown build strategy: " + value));
    }
}
