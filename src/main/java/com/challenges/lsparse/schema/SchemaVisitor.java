package com.challenges.lsparse.schema;

import com.challenges.lsparse.schema.NodeSchema.ArraySchema;
import com.challenges.lsparse.schema.NodeSchema.AttributeSchema;
import com.challenges.lsparse.schema.NodeSchema.BareWordSchema;
import com.challenges.lsparse.schema.NodeSchema.BooleanExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.BooleanSchema;
import com.challenges.lsparse.schema.NodeSchema.BranchSchema;
import com.challenges.lsparse.schema.NodeSchema.CompareExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.ConfigSchema;
import com.challenges.lsparse.schema.NodeSchema.ElseConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.ElseIfConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.HashEntrySchema;
import com.challenges.lsparse.schema.NodeSchema.HashSchema;
import com.challenges.lsparse.schema.NodeSchema.IfConditionSchema;
import com.challenges.lsparse.schema.NodeSchema.InExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.MethodCallSchema;
import com.challenges.lsparse.schema.NodeSchema.NegativeExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.NotInExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.NumberSchema;
import com.challenges.lsparse.schema.NodeSchema.PluginSchema;
import com.challenges.lsparse.schema.NodeSchema.PluginSectionSchema;
import com.challenges.lsparse.schema.NodeSchema.RegexExpressionSchema;
import com.challenges.lsparse.schema.NodeSchema.RegexpSchema;
import com.challenges.lsparse.schema.NodeSchema.SelectorSchema;
import com.challenges.lsparse.schema.NodeSchema.StringSchema;

public interface SchemaVisitor<R> {
    R visit(StringSchema schema);

    R visit(BareWordSchema schema);

    R visit(NumberSchema schema);

    R visit(BooleanSchema schema);

    R visit(RegexpSchema schema);

    R visit(SelectorSchema schema);

    R visit(MethodCallSchema schema);

    R visit(ArraySchema schema);

    R visit(HashSchema schema);

    R visit(HashEntrySchema schema);

    R visit(AttributeSchema schema);

    R visit(PluginSchema schema);

    R visit(CompareExpressionSchema schema);

    R visit(RegexExpressionSchema schema);

    R visit(InExpressionSchema schema);

    R visit(NotInExpressionSchema schema);

    R visit(NegativeExpressionSchema schema);

    R visit(BooleanExpressionSchema schema);

    R visit(IfConditionSchema schema);

    R visit(ElseIfConditionSchema schema);

    R visit(ElseConditionSchema schema);

    R visit(BranchSchema schema);

    R visit(PluginSectionSchema schema);

    R visit(ConfigSchema schema);
}
