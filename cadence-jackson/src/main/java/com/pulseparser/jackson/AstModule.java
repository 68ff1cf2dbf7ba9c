package com.pulseparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.pulseparser.ast.*;
import com.pulseparser.jackson.mixins.NodeMixin;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the AST classes.
 *
 * This module handles:
 * - Polymorphic type handling via NodeMixin
 * - Writing optional child nodes as explicit nulls
 * - Leaving out spans when the mapper is built without them
 */
public class AstModule extends SimpleModule {

    private final boolean includeSpans;

    public AstModule() {
        this(true);
    }

    public AstModule(boolean includeSpans) {
        super("AstModule", new Version(1, 0, 0, null, "com.pulseparser", "cadence-jackson"));
        this.includeSpans = includeSpans;
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(SetDeclaration.class, NodeMixin.class);
        context.setMixInAnnotations(TypeNode.class, NodeMixin.class);

        // Optional fields are written even when absent
        context.setMixInAnnotations(CalibrationDefinition.class, ReturnTypeMixin.class);
        context.setMixInAnnotations(ExternDeclaration.class, ReturnTypeMixin.class);
        context.setMixInAnnotations(ClassicalDeclaration.class, ClassicalDeclarationMixin.class);
        context.setMixInAnnotations(RangeDefinition.class, RangeDefinitionMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ReturnStatementMixin.class);

        if (!includeSpans) {
            context.addBeanSerializerModifier(new SpanExclusionModifier());
        }
    }

    // ==================== Serialization Mixins ====================

    // defcal and extern without "-> type"
    private abstract static class ReturnTypeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract TypeNode returnType();
    }

    // Declaration without "= value"
    private abstract static class ClassicalDeclarationMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression initExpression();
    }

    // [start:end] has no step
    private abstract static class RangeDefinitionMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression step();
    }

    // Bare "return;"
    private abstract static class ReturnStatementMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression expression();
    }

    // ==================== Serializer Modifier ====================

    private static class SpanExclusionModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> filtered = new ArrayList<>(beanProperties.size());
            for (BeanPropertyWriter prop : beanProperties) {
                if (!"span".equals(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }
}
