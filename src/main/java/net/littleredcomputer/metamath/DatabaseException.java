package net.littleredcomputer.metamath;

/** Integrity violations of a {@link Database}. */
public abstract class DatabaseException extends RuntimeException {
    private final String label;

    DatabaseException(String label, String message) {
        super(message);
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static class UnknownLabel extends DatabaseException {
        public UnknownLabel(String label) {
            super(label, "unknown label " + label);
        }
    }

    public static class DuplicateLabel extends DatabaseException {
        public DuplicateLabel(String label) {
            super(label, "duplicate label " + label);
        }
    }

    public static class ForwardReference extends DatabaseException {
        private final String cited;

        public ForwardReference(String label, String cited) {
            super(label, label + " cites " + cited + ", which does not precede it");
            this.cited = cited;
        }

        public String cited() {
            return cited;
        }
    }
}
