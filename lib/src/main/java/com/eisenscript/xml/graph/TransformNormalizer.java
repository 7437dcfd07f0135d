package com.eisenscript.xml.graph;

import com.eisenscript.xml.loader.ast.TransformNode;
import java.util.List;
import java.util.Locale;

/**
 * Maps transform mnemonics to EisenXML operation codes.
 *
 * <pre>
 * x -> tx      rx -> rx
 * y -> ty      ry -> ry
 * z -> tz      rz -> rz
 * s n -> sa n  s n n n -> s n n n
 * </pre>
 */
public final class TransformNormalizer {

    private TransformNormalizer() {}

    public static String canonicalOp(String id, int valueCount) {
        String op = id.toLowerCase(Locale.ROOT);
        switch (op) {
            case "x":
            case "y":
            case "z":
                return "t" + op;
            case "s":
                return valueCount == 1 ? "sa" : "s";
            case "rx":
            case "ry":
            case "rz":
                return op;
            default:
                throw new IllegalArgumentException("Not a geometry transform: " + id);
        }
    }

    public static String canonicalOp(TransformNode transform) {
        return canonicalOp(transform.getId(), transform.getValues().size());
    }

    /** Joins each transform as {@code "<op> <values...>"} in source order. */
    public static String serialize(List<TransformNode> transforms) {
        StringBuilder builder = new StringBuilder();
        for (TransformNode transform : transforms) {
            builder.append(canonicalOp(transform)).append(' ');
            for (String value : transform.getValues()) {
                builder.append(value).append(' ');
            }
        }
        return builder.toString().strip();
    }
}
