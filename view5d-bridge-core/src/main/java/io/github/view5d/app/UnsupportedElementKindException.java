package io.github.view5d.app;

/**
 * Thrown when an array's element kind has no primitive the viewer accepts.
 */
public class UnsupportedElementKindException extends IllegalArgumentException {

    private final ElementKind kind;

    /**
     * @param kind the rejected element kind
     */
    public UnsupportedElementKindException(ElementKind kind) {
        super("Element kind " + kind + " cannot be passed to the viewer");
        this.kind = kind;
    }

    public ElementKind getKind() {
        return kind;
    }
}
