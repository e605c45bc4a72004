package info.isaksson.erland.composetoflutter.ir;

public enum DeclarationKind {
    CLASS,
    DATA_CLASS,
    SEALED_CLASS,
    ENUM_CLASS,
    INTERFACE,
    OBJECT,
    FUNCTION,
    PROPERTY;

    public boolean isClassLike() {
        return this != FUNCTION && this != PROPERTY;
    }
}
