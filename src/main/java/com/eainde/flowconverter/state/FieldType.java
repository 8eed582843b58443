package com.eainde.flowconverter.state;

/**
 * Semantic type of a shared-state field, with its Python annotation.
 */
public enum FieldType {
    STRING("str"),
    INTEGER("int"),
    FLOAT("float"),
    BOOLEAN("bool"),
    LIST("List[Any]"),
    MAP("Dict[str, Any]"),
    ANY("Any");

    private final String pythonAnnotation;

    FieldType(String pythonAnnotation) {
        this.pythonAnnotation = pythonAnnotation;
    }

    public String pythonAnnotation() {
        return pythonAnnotation;
    }
}
