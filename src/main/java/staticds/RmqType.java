package staticds;

import java.util.EnumSet;
import java.util.function.Function;

public enum RmqType {
    FISCHER_HEUN("fischer-heun", RMQFischerHeun::new),
    SPARSE_TABLE("sparse-table", RMQSparseTable::new);

    private final String token;
    private final Function<int[], RangeMinimumQuery> factory;

    RmqType(String token, Function<int[], RangeMinimumQuery> factory) {
        this.token = token;
        this.factory = factory;
    }

    public String token() { return token; }

    public RangeMinimumQuery create(int[] data) {
        return factory.apply(data);
    }

    public static RmqType fromString(String value) {
        return EnumSet.allOf(RmqType.class).stream()
                .filter(type -> type.token.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown RMQ type: " + value));
    }
}
