package com.luauprinter;

import com.luauprinter.ast.Block;
import com.luauprinter.ast.Node;
import com.luauprinter.cst.CstNodeMap;
import com.luauprinter.printer.CanonicalFormatting;
import com.luauprinter.printer.ExactFormatting;
import com.luauprinter.printer.Formatting;
import com.luauprinter.printer.Printer;
import com.luauprinter.printer.StringSourceWriter;

/**
 * Entry points for turning source or trees back into text.
 *
 * <p>With an enabled {@link CstNodeMap} the output reproduces the original
 * spelling and layout; without one, constructs are printed in a canonical
 * form that reparses to the same tree.
 */
public final class Transpiler {

    private Transpiler() {
    }

    public static TranspileResult transpile(String source) {
        return transpile(source, ParseOptions.defaults(), false);
    }

    /**
     * Parses and prints {@code source}. Never throws on invalid input: the
     * first syntax error is returned in the result.
     */
    public static TranspileResult transpile(String source, ParseOptions options, boolean withTypes) {
        ParseResult result = Parser.parse(source, options);
        if (result.hasErrors()) {
            return TranspileResult.failure(result.errors().get(0));
        }
        String code = withTypes
            ? transpileWithTypes(result.root(), result.cstNodeMap())
            : transpile(result.root(), result.cstNodeMap());
        return TranspileResult.success(code);
    }

    public static String transpile(Block root) {
        return transpile(root, CstNodeMap.disabled());
    }

    /**
     * Prints a tree without type annotations, type aliases or type assertions.
     */
    public static String transpile(Block root, CstNodeMap cstNodeMap) {
        return print(root, cstNodeMap, false);
    }

    public static String transpileWithTypes(Block root) {
        return transpileWithTypes(root, CstNodeMap.disabled());
    }

    public static String transpileWithTypes(Block root, CstNodeMap cstNodeMap) {
        return print(root, cstNodeMap, true);
    }

    /**
     * Canonical rendering of a single node, types included. The output starts
     * at the node's own position, so no leading blank lines are produced.
     */
    public static String toString(Node node) {
        StringSourceWriter writer = new StringSourceWriter(node.location().start());
        new Printer(writer, new CanonicalFormatting(), true).visitNode(node);
        return writer.str();
    }

    private static String print(Block root, CstNodeMap cstNodeMap, boolean writeTypes) {
        StringSourceWriter writer = new StringSourceWriter();
        Printer printer = new Printer(writer, formattingFor(cstNodeMap), writeTypes);
        printer.visitBlock(root);
        return writer.str();
    }

    private static Formatting formattingFor(CstNodeMap cstNodeMap) {
        return cstNodeMap.isEnabled() ? new ExactFormatting(cstNodeMap) : new CanonicalFormatting();
    }
}
