package io.github.cyfko.odatafilter.core.printing;

import io.github.cyfko.odatafilter.core.config.PrinterConfig;
import io.github.cyfko.odatafilter.core.model.FilterQueryOption;
import io.github.cyfko.odatafilter.core.model.RangeVariable;
import io.github.cyfko.odatafilter.core.tree.BinaryOperatorNode;
import io.github.cyfko.odatafilter.core.tree.FunctionCallNode;
import io.github.cyfko.odatafilter.core.tree.LiteralNode;
import io.github.cyfko.odatafilter.core.tree.PropertyAccessNode;
import io.github.cyfko.odatafilter.core.tree.QueryNode;
import io.github.cyfko.odatafilter.core.tree.QueryNodeVisitor;
import io.github.cyfko.odatafilter.core.tree.RangeVariableReferenceNode;
import io.github.cyfko.odatafilter.core.tree.UnaryOperatorNode;

import java.util.Objects;

/**
 * Renders a parsed filter as an indented, line-oriented diagnostic dump.
 * <p>
 * Each node prints a header line with its kind, followed by one {@code Key = value} line per attribute,
 * indented one level deeper. A child node follows its {@code Key = } line, with its header at the
 * attribute level. Lines end with {@code \n}; the indentation unit comes from {@link PrinterConfig}.
 * </p>
 *
 * <p>The output depends only on the tree, so two renders of equal trees are byte-identical.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * QueryNodePrinter printer = new QueryNodePrinter();
 * String dump = printer.render(parser.parse("geo.distance(Home, Office) lt 0.5"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class QueryNodePrinter {

    private static final String NEWLINE = "\n";

    private final PrinterConfig config;

    public QueryNodePrinter() {
        this(PrinterConfig.defaults());
    }

    public QueryNodePrinter(PrinterConfig config) {
        this.config = Objects.requireNonNull(config, "Printer config cannot be null");
    }

    public PrinterConfig getConfig() {
        return config;
    }

    /**
     * Renders a whole filter: the item type, the bound range variable and the expression tree.
     *
     * @param filter the parsed filter
     * @return the dump, terminated by a newline
     */
    public String render(FilterQueryOption filter) {
        Objects.requireNonNull(filter, "Filter cannot be null");
        StringBuilder out = new StringBuilder();
        line(out, 0, "FilterQueryOption");
        attribute(out, 1, "ItemType", filter.itemType());
        attribute(out, 1, "Parameter", "");
        rangeVariable(out, 1, filter.rangeVariable());
        attribute(out, 1, "Expression", "");
        filter.expression().accept(new NodeWriter(out, 1));
        return out.toString();
    }

    /**
     * Renders a single node and its subtree, with the node header at the first column.
     *
     * @param node the node to render
     * @return the dump, terminated by a newline
     */
    public String render(QueryNode node) {
        Objects.requireNonNull(node, "Node cannot be null");
        StringBuilder out = new StringBuilder();
        node.accept(new NodeWriter(out, 0));
        return out.toString();
    }

    private void rangeVariable(StringBuilder out, int depth, RangeVariable variable) {
        line(out, depth, "EntityRangeVariable");
        attribute(out, depth + 1, "Name", variable.name());
        attribute(out, depth + 1, "NavigationSource", variable.navigationSource());
        attribute(out, depth + 1, "TypeReference", variable.typeReference());
    }

    private void attribute(StringBuilder out, int depth, String key, Object value) {
        line(out, depth, key + " = " + escape(String.valueOf(value)));
    }

    /**
     * Escapes backslashes and control characters so that every attribute stays on its own line.
     */
    static String escape(String value) {
        StringBuilder escaped = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement;
            switch (c) {
                case '\\' -> replacement = "\\\\";
                case '\n' -> replacement = "\\n";
                case '\r' -> replacement = "\\r";
                case '\t' -> replacement = "\\t";
                default -> replacement = Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : null;
            }
            if (replacement == null) {
                if (escaped != null) {
                    escaped.append(c);
                }
                continue;
            }
            if (escaped == null) {
                escaped = new StringBuilder(value.length() + 8).append(value, 0, i);
            }
            escaped.append(replacement);
        }
        return escaped == null ? value : escaped.toString();
    }

    private void line(StringBuilder out, int depth, String text) {
        out.append(config.getIndentUnit().repeat(depth)).append(text).append(NEWLINE);
    }

    /**
     * Writes one node header at {@code depth} and its attributes one level deeper.
     */
    private final class NodeWriter implements QueryNodeVisitor<Void> {
        private final StringBuilder out;
        private final int depth;

        NodeWriter(StringBuilder out, int depth) {
            this.out = out;
            this.depth = depth;
        }

        @Override
        public Void visit(RangeVariableReferenceNode node) {
            line(out, depth, "EntityRangeVariableReferenceNode");
            attribute(out, depth + 1, "Name", node.name());
            attribute(out, depth + 1, "NavigationSource", node.rangeVariable().navigationSource());
            attribute(out, depth + 1, "TypeReference", node.typeReference());
            return null;
        }

        @Override
        public Void visit(PropertyAccessNode node) {
            line(out, depth, "SingleValuePropertyAccessNode");
            attribute(out, depth + 1, "Property", node.propertyName());
            attribute(out, depth + 1, "TypeReference", node.typeReference());
            child(depth + 1, "Source", node.source());
            return null;
        }

        @Override
        public Void visit(FunctionCallNode node) {
            line(out, depth, "SingleValueFunctionCallNode");
            attribute(out, depth + 1, "Name", node.name());
            attribute(out, depth + 1, "Return Type", node.returnType());
            attribute(out, depth + 1, "Function",
                    node.matchedSignature().builtIn() ? "" : node.matchedSignature());
            attribute(out, depth + 1, "Arguments", "");
            for (QueryNode argument : node.arguments()) {
                argument.accept(new NodeWriter(out, depth + 2));
            }
            return null;
        }

        @Override
        public Void visit(BinaryOperatorNode node) {
            line(out, depth, "BinaryOperatorNode");
            attribute(out, depth + 1, "TypeReference", node.typeReference());
            attribute(out, depth + 1, "OperatorKind", node.operatorKind().displayName());
            child(depth + 1, "Left", node.left());
            child(depth + 1, "Right", node.right());
            return null;
        }

        @Override
        public Void visit(UnaryOperatorNode node) {
            line(out, depth, "UnaryOperatorNode");
            attribute(out, depth + 1, "TypeReference", node.typeReference());
            attribute(out, depth + 1, "OperatorKind", node.operatorKind().displayName());
            child(depth + 1, "Operand", node.operand());
            return null;
        }

        @Override
        public Void visit(LiteralNode node) {
            line(out, depth, "ConstantNode");
            attribute(out, depth + 1, "LiteralText", node.literalText());
            attribute(out, depth + 1, "TypeReference", node.typeReference());
            attribute(out, depth + 1, "Value", String.valueOf(node.value()));
            return null;
        }

        private void child(int childDepth, String key, QueryNode child) {
            attribute(out, childDepth, key, "");
            child.accept(new NodeWriter(out, childDepth));
        }
    }
}
