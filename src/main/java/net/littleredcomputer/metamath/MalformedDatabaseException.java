package net.littleredcomputer.metamath;

/** Thrown by {@link MetamathReader} when the source text is not a database it accepts. */
public class MalformedDatabaseException extends IllegalArgumentException {
    private final int offset;

    public MalformedDatabaseException(int offset, String message) {
        super(String.format("at offset %d: %s", offset, message));
        this.offset = offset;
    }

    public MalformedDatabaseException(int offset, String message, Throwable cause) {
        super(String.format("at offset %d: %s", offset, message), cause);
        this.offset = offset;
    }

    public int offset() {
        return offset;
    }
}
