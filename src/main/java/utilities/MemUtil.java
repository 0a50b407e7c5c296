package utilities;

import org.openjdk.jol.info.GraphLayout;
import org.openjdk.jol.vm.VM;
import tree.suffix.SuffixTree;

import java.util.Locale;

public final class MemUtil {

    private MemUtil() {}

    // Detailed JOL report for a suffix tree, optionally including the class footprint table.
    public static String jolMemoryReport(SuffixTree tree, boolean includeFootprintTable) {
        StringBuilder sb = new StringBuilder(4_096);

        // VM details (useful to interpret alignment, header sizes, and compressed oops status)
        sb.append("=== JOL / VM details ===\n");
        sb.append(VM.current().details()).append('\n');

        GraphLayout total = GraphLayout.parseInstance(tree);
        sb.append("\n=== SuffixTree total ===\n");
        sb.append("Text length       : ").append(tree.length()).append('\n');
        sb.append("Nodes             : ").append(tree.nodeCount()).append('\n');
        sb.append("Total bytes       : ").append(total.totalSize()).append(" B\n");
        sb.append("Total bytes (MiB) : ")
                .append(String.format(Locale.ROOT, "%.3f", total.totalSize() / (1024.0 * 1024.0)))
                .append(" MiB\n");
        if (tree.length() > 0) {
            sb.append("Bytes per symbol  : ")
                    .append(String.format(Locale.ROOT, "%.1f", total.totalSize() / (double) tree.length()))
                    .append('\n');
        }

        if (includeFootprintTable) {
            // Class-by-class histogram
            sb.append("\n--- Class footprint ---\n");
            sb.append(total.toFootprint()).append('\n');
        }
        return sb.toString();
    }
}
