package com.challenges.lsparse.ast;

import com.challenges.lsparse.ast.Node.ArrayNode;
import com.challenges.lsparse.ast.Node.Attribute;
import com.challenges.lsparse.ast.Node.BareWord;
import com.challenges.lsparse.ast.Node.BooleanExpression;
import com.challenges.lsparse.ast.Node.BooleanLiteral;
import com.challenges.lsparse.ast.Node.Branch;
import com.challenges.lsparse.ast.Node.CompareExpression;
import com.challenges.lsparse.ast.Node.Config;
import com.challenges.lsparse.ast.Node.ElseCondition;
import com.challenges.lsparse.ast.Node.ElseIfCondition;
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
import com.challenges.lsparse.ast.Node.StringLiteral;

/**
 * One method per node kind, so every consumer of the tree handles every kind.
 */
public interface NodeVisitor<R> {
    R visit(StringLiteral node);

    R visit(BareWord node);

    R visit(NumberLiteral node);

    R visit(BooleanLiteral node);

    R visit(RegexLiteral node);

    R visit(Selector node);

    R visit(MethodCall node);

    R visit(ArrayNode node);

    R visit(HashNode node);

    R visit(HashEntry node);

    R visit(Attribute node);

    R visit(Plugin node);

    R visit(CompareExpression node);

    R visit(RegexExpression node);

    R visit(MembershipExpression node);

    R visit(NegativeExpression node);

    R visit(BooleanExpression node);

    R visit(IfCondition node);

    R visit(ElseIfCondition node);

    R visit(ElseCondition node);

    R visit(Branch node);

    R visit(PluginSection node);

    R visit(Config node);
}
