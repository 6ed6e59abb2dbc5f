package io.datajob4j.core;

/**
 * The script finished but left neither {@code output} nor {@code input} holding a table.
 */
public class TransformOutputException extends TransformException {

    private final String producedType;

    public TransformOutputException(String producedType) {
        super("Script output must be a table (array of row objects or table(...)), got: " + producedType);
        this.producedType = producedType;
    }

    public String producedType() {
        return producedType;
    }
}
