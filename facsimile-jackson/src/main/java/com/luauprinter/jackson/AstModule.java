package com.luauprinter.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.luauprinter.ast.*;
import com.luauprinter.jackson.mixins.NodeMixin;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module for the syntax tree records.
 *
 * <ul>
 *   <li>every node interface is polymorphic through {@link NodeMixin}, and
 *       every concrete node record is registered under its simple name;</li>
 *   <li>number literals go through {@link LuauNumberSerializer}.</li>
 * </ul>
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.luauprinter", "facsimile-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(TypeAnnotation.class, NodeMixin.class);
        context.setMixInAnnotations(TypePack.class, NodeMixin.class);

        context.setMixInAnnotations(NumberExpression.class, NumberExpressionMixin.class);

        List<NamedType> subtypes = new ArrayList<>();
        collectNodeRecords(Node.class, subtypes);
        context.registerSubtypes(subtypes.toArray(new NamedType[0]));
    }

    /**
     * Walks the sealed hierarchy below {@code type}, collecting the records.
     */
    static void collectNodeRecords(Class<?> type, List<NamedType> out) {
        if (type.isRecord()) {
            out.add(new NamedType(type, type.getSimpleName()));
            return;
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            return;
        }
        for (Class<?> subclass : permitted) {
            collectNodeRecords(subclass, out);
        }
    }

    // ==================== Mixins ====================

    private abstract static class NumberExpressionMixin {
        @JsonSerialize(using = LuauNumberSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract double value();
    }
}
