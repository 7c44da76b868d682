package com.luauprinter.ast;

public record ArgumentName(String name, SourceLocation location) {
}
