package com.wireframe.compiler.ir.schema;

/**
 * Value domains a property can declare.
 */
public enum PropertyType {
    /** Any scalar; numbers and booleans are accepted and read as text. */
    STRING,
    /** A number, or a string that parses as one. */
    NUMBER,
    /** A boolean, or the strings {@code true}/{@code false}. */
    BOOLEAN,
    /** One of a closed list of string values. */
    ENUM,
    /** A spacing token ({@code none..xl}) or a non-negative pixel number. */
    SPACING,
    /** A color token, hex value or boolean flag. Left unresolved. */
    COLOR
}
