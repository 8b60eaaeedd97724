package io.github.graydavid.lazycache.core;

import static io.github.graydavid.lazycache.core.TestData.filledArray;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import io.github.graydavid.lazycache.operations.ArithmeticOperations;

public class TraceFormatterTest {
    private final ConstructionContext context = ConstructionContext.builder().build();

    private static String prefix(Node node) {
        return node.getHash().toHexPrefix(3);
    }

    @Test
    public void formatsLeafOnOneLine() {
        LeafNode leaf = context.newLeaf(filledArray(3, 1), false);

        assertThat(TraceFormatter.standard().format(leaf), is("<lazy " + prefix(leaf) + " double[](shape=(3,))>"));
    }

    @Test
    public void formatsInlinableLeafWithItsLiteral() {
        LeafNode leaf = context.newLeaf("foo", false);

        assertThat(TraceFormatter.standard().format(leaf), is("<lazy " + prefix(leaf) + " \"foo\">"));
    }

    @Test
    public void formatsOperationsAsInputsFollowedByProgram() {
        LeafNode x = context.newLeaf(filledArray(3, 1), false);
        LeafNode y = context.newLeaf(filledArray(3, 1), false);
        OperationNode sum = context.newOperation(ArithmeticOperations.ADD, List.of(x, y));
        OperationNode root = context.newOperation(ArithmeticOperations.MULTIPLY,
                List.of(sum, context.newLeaf(4, false)));

        String trace = TraceFormatter.standard().format(root);

        String expected = String.join("\n",
                "<lazy " + prefix(root),
                "  input:",
                "    v0: " + prefix(x) + " double[](shape=(3,))",
                "    v1: " + prefix(y) + " double[](shape=(3,))",
                "  program:",
                "    e0: " + prefix(sum) + " (v0 + v1)",
                "    e1: " + prefix(root) + " (e0 * 4)",
                ">");
        assertThat(trace, is(expected));
    }

    @Test
    public void formatsProgramsWithoutInputsWithEmptyInputSection() {
        OperationNode root = context.newOperation(ArithmeticOperations.SUBTRACT,
                List.of(context.newLeaf(3, false), context.newLeaf(2.5, false)));

        String trace = TraceFormatter.standard().format(root);

        assertThat(trace, is(String.join("\n", "<lazy " + prefix(root), "  input:", "  program:",
                "    e0: " + prefix(root) + " (3 - 2.5)", ">")));
    }

    @Test
    public void formatsCallNotationAndLongValuesAsInputs() {
        LeafNode text = context.newLeaf("much too long to inline", false);
        OperationNode root = context.newOperation(Operation.call("upper", arguments -> null), List.of(text));

        String trace = TraceFormatter.standard().format(root);

        assertThat(trace, is(String.join("\n", "<lazy " + prefix(root), "  input:",
                "    v0: " + prefix(text) + " \"much too long to inline\"", "  program:",
                "    e0: " + prefix(root) + " upper(v0)", ">")));
    }

    @Test
    public void inputsAreSortedByBindingNameAsText() {
        List<Node> arguments = new ArrayList<>();
        for (int i = 0; i < 11; ++i) {
            arguments.add(context.newLeaf(filledArray(1, i), false));
        }
        OperationNode root = context.newOperation(Operation.call("sum", args -> 0), arguments);

        List<String> inputNames = Arrays.stream(TraceFormatter.standard().format(root).split("\n"))
                .filter(line -> line.startsWith("    v"))
                .map(line -> line.trim().substring(0, line.trim().indexOf(':')))
                .collect(Collectors.toList());

        assertThat(inputNames, contains("v0", "v1", "v10", "v2", "v3", "v4", "v5", "v6", "v7", "v8", "v9"));
    }

    @Test
    public void customHashPrefixLengthsAreRespected() {
        LeafNode leaf = context.newLeaf(filledArray(1, 1), false);
        TraceFormatter formatter = TraceFormatter.builder().hashPrefixBytes(8).build();

        assertThat(formatter.format(leaf),
                is("<lazy " + leaf.getHash().toHexPrefix(8) + " double[](shape=(1,))>"));
        assertThat(leaf.getHash().toHexPrefix(8).length(), is(16));
    }

    @Test
    public void builderThrowsExceptionGivenNonPositivePrefixLength() {
        assertThrows(IllegalArgumentException.class, () -> TraceFormatter.builder().hashPrefixBytes(0));
        assertThrows(IllegalArgumentException.class, () -> TraceFormatter.builder().hashPrefixBytes(-1));
    }

    @Test
    public void standardUsesDefaultPrefixLength() {
        LeafNode leaf = context.newLeaf(1, false);

        TraceFormatter explicitDefault = TraceFormatter.builder()
                .hashPrefixBytes(TraceFormatter.DEFAULT_HASH_PREFIX_BYTES)
                .build();

        assertThat(TraceFormatter.standard().format(leaf), is(explicitDefault.format(leaf)));
        assertThat(prefix(leaf).length(), is(6));
    }
}
