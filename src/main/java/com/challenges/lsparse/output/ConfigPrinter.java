package com.challenges.lsparse.output;

import com.challenges.lsparse.ast.BooleanOperator;
import com.challenges.lsparse.ast.Node;
import com.challenges.lsparse.ast.Node.ArrayNode;
import com.challenges.lsparse.ast.Node.Attribute;
import com.challenges.lsparse.ast.Node.BareWord;
import com.challenges.lsparse.ast.Node.BooleanExpression;
import com.challenges.lsparse.ast.Node.BooleanLiteral;
import com.challenges.lsparse.ast.Node.Branch;
import com.challenges.lsparse.ast.Node.CompareExpression;
import com.challenges.lsparse.ast.Node.Condition;
import com.challenges.lsparse.ast.Node.Config;
import com.challenges.lsparse.ast.Node.ElseCondition;
import com.challenges.lsparse.ast.Node.ElseIfCondition;
import com.challenges.lsparse.ast.Node.Expression;
import com.challenges.lsparse.ast.Node.HashEntry;
import com.challenges.lsparse.ast.Node.HashNode;
import com.challenges.lsparse.ast.Node.IfCondition;
import com.challenges.lsparse.ast.Node.MembershipExpression;
import com.challenges.lsparse.ast.Node.MethodCall;
import com.challenges.lsparse.ast.Node.NegativeExpression;
import com.challenges.lsparse.ast.Node.NumberLiteral;
import com.challenges.lsparse.ast.Node.Plugin;
import com.challenges.lsparse.ast.Node.PluginSection;
import com.challenges.lsparse.ast.Node.RegexExpression;
import com.challenges.lsparse.ast.Node.RegexLiteral;
import com.challenges.lsparse.ast.Node.Selector;
import com.challenges.lsparse.ast.Node.Statement;
import com.challenges.lsparse.ast.Node.StringLiteral;
import com.challenges.lsparse.ast.Node.Value;
import com.challenges.lsparse.ast.NodeVisitor;
import org.eclipse.collections.api.list.ImmutableList;

import java.util.stream.Collectors;

/**
 * Renders a syntax tree back into configuration text.
 *
 * <p>Output is canonical rather than faithful: comments are gone, nesting is indented by
 * two spaces per level, and literals are written from their original lexemes.
 */
public class ConfigPrinter {
    private static final int INDENT_STEP = 2;

    public String toText(Node node) {
        return toText(node, 0);
    }

    public String toText(Node node, int indent) {
        return node.accept(new Renderer(indent));
    }

    private String render(Node node, int indent) {
        return node.accept(new Renderer(indent));
    }

    private final class Renderer implements NodeVisitor<String> {
        private final int indent;
        private final String indentStr;

        Renderer(int indent) {
            this.indent = indent;
            this.indentStr = " ".repeat(indent);
        }

        // Literals

        @Override
        public String visit(StringLiteral node) {
            return node.lexeme();
        }

        @Override
        public String visit(BareWord node) {
            return node.value();
        }

        @Override
        public String visit(NumberLiteral node) {
            return node.lexeme();
        }

        @Override
        public String visit(BooleanLiteral node) {
            return Boolean.toString(node.value());
        }

        @Override
        public String visit(RegexLiteral node) {
            return node.lexeme();
        }

        @Override
        public String visit(Selector node) {
            return node.raw();
        }

        @Override
        public String visit(MethodCall node) {
            return node.name() + "(" + inline(node.arguments()) + ")";
        }

        // Collections

        @Override
        public String visit(ArrayNode node) {
            return "[" + inline(node.elements()) + "]";
        }

        @Override
        public String visit(HashNode node) {
            StringBuilder sb = new StringBuilder();
            sb.append(indentStr).append("{\n");
            for (HashEntry entry : node.entries()) {
                sb.append(render(entry, indent + INDENT_STEP));
            }
            sb.append(indentStr).append("}");
            return sb.toString();
        }

        @Override
        public String visit(HashEntry node) {
            return assignment(render(node.key(), 0), node.value());
        }

        @Override
        public String visit(Attribute node) {
            return assignment(render(node.name(), 0), node.value());
        }

        @Override
        public String visit(Plugin node) {
            StringBuilder sb = new StringBuilder();
            sb.append(indentStr).append(node.name()).append(" {\n");
            for (Attribute attribute : node.attributes()) {
                sb.append(render(attribute, indent + INDENT_STEP));
            }
            sb.append(indentStr).append("}");
            return sb.toString();
        }

        // Expressions

        @Override
        public String visit(CompareExpression node) {
            return render(node.left(), 0) + " " + node.operator().symbol() + " " + render(node.right(), 0);
        }

        @Override
        public String visit(RegexExpression node) {
            return render(node.left(), 0) + " " + node.operator().symbol() + " " + render(node.pattern(), 0);
        }

        @Override
        public String visit(MembershipExpression node) {
            return render(node.value(), 0) + " " + node.operator().symbol() + " " + render(node.collection(), 0);
        }

        @Override
        public String visit(NegativeExpression node) {
            String inner = render(node.expression(), 0);
            if (node.expression() instanceof Selector) {
                return NegativeExpression.OPERATOR + inner;
            }
            return NegativeExpression.OPERATOR + "(" + inner + ")";
        }

        @Override
        public String visit(BooleanExpression node) {
            String result = operand(node.left(), node.operator(), false)
                + " " + node.operator().symbol() + " "
                + operand(node.right(), node.operator(), true);
            return node.explicitParens() ? "(" + result + ")" : result;
        }

        // Conditionals

        @Override
        public String visit(IfCondition node) {
            return indentStr + "if " + render(node.expression(), 0) + " {\n" + body(node) + indentStr + "}\n";
        }

        @Override
        public String visit(ElseIfCondition node) {
            return " else if " + render(node.expression(), 0) + " {\n" + body(node) + indentStr + "}\n";
        }

        @Override
        public String visit(ElseCondition node) {
            return " else {\n" + body(node) + indentStr + "}\n";
        }

        /** Joins the conditions so that each {@code else} follows the previous closing brace. */
        @Override
        public String visit(Branch node) {
            StringBuilder sb = new StringBuilder();
            for (Condition condition : node.conditions()) {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '\n') {
                    sb.setLength(sb.length() - 1);
                }
                sb.append(render(condition, indent));
            }
            return sb.toString();
        }

        // Sections

        @Override
        public String visit(PluginSection node) {
            StringBuilder sb = new StringBuilder();
            sb.append(indentStr).append(node.type().keyword()).append(" {\n");
            ImmutableList<Statement> body = node.body();
            for (int i = 0; i < body.size(); i++) {
                appendLine(sb, render(body.get(i), indent + INDENT_STEP));
                if (i < body.size() - 1) {
                    sb.append("\n");
                }
            }
            sb.append(indentStr).append("}");
            return sb.toString();
        }

        @Override
        public String visit(Config node) {
            StringBuilder sb = new StringBuilder();
            for (PluginSection section : node.sections()) {
                if (sb.length() > 0) {
                    sb.append("\n");
                }
                sb.append(render(section, indent)).append("\n");
            }
            return sb.toString();
        }

        // Helpers

        private String assignment(String name, Value value) {
            StringBuilder sb = new StringBuilder();
            sb.append(indentStr).append(name).append(" => ");
            if (value instanceof HashNode || value instanceof Plugin) {
                // opening brace stays on the line of the name
                sb.append(render(value, indent).stripLeading());
            } else {
                sb.append(render(value, indent));
            }
            return sb.append("\n").toString();
        }

        private String body(Condition condition) {
            StringBuilder sb = new StringBuilder();
            for (Statement statement : condition.body()) {
                appendLine(sb, render(statement, indent + INDENT_STEP));
            }
            return sb.toString();
        }

        private String inline(ImmutableList<? extends Node> items) {
            return items.castToList().stream()
                .map(item -> render(item, indent).stripLeading())
                .collect(Collectors.joining(", "));
        }

        private String operand(Expression operand, BooleanOperator parent, boolean rightHand) {
            String text = render(operand, 0);
            if (!(operand instanceof BooleanExpression)) {
                return text;
            }
            BooleanExpression child = (BooleanExpression) operand;
            if (child.explicitParens()) {
                return text;
            }
            int childPrecedence = child.operator().precedence();
            if (childPrecedence < parent.precedence() || (rightHand && childPrecedence == parent.precedence())) {
                return "(" + text + ")";
            }
            return text;
        }

        private void appendLine(StringBuilder sb, String text) {
            sb.append(text);
            if (!text.endsWith("\n")) {
                sb.append("\n");
            }
        }
    }
}
