package com.luauprinter.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic handling for the node interfaces: the concrete record is named
 * by a {@code kind} property holding its simple class name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
public abstract class NodeMixin {
}
