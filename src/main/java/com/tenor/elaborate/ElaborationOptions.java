package com.tenor.elaborate;

/** Resource guards for the import graph. */
public final class ElaborationOptions {

    public static final int DEFAULT_MAX_IMPORT_FILES = 256;
    public static final int DEFAULT_MAX_IMPORT_DEPTH = 64;

    private int maxImportFiles = DEFAULT_MAX_IMPORT_FILES;
    private int maxImportDepth = DEFAULT_MAX_IMPORT_DEPTH;

    public static ElaborationOptions defaults() {
        return new ElaborationOptions();
    }

    /** Defaults overridden by {@code tenor.elab.maxImportFiles} / {@code tenor.elab.maxImportDepth}. */
    public static ElaborationOptions fromSystemProperties() {
        return new ElaborationOptions()
                .maxImportFiles(Integer.getInteger("tenor.elab.maxImportFiles", DEFAULT_MAX_IMPORT_FILES))
                .maxImportDepth(Integer.getInteger("tenor.elab.maxImportDepth", DEFAULT_MAX_IMPORT_DEPTH));
    }

    public int maxImportFiles() { return maxImportFiles; }
    public int maxImportDepth() { return maxImportDepth; }

    public ElaborationOptions maxImportFiles(int n) {
        if (n < 1) throw new IllegalArgumentException("maxImportFiles must be >= 1");
        this.maxImportFiles = n;
        return this;
    }

    public ElaborationOptions maxImportDepth(int n) {
        if (n < 1) throw new IllegalArgumentException("maxImportDepth must be >= 1");
        this.maxImportDepth = n;
        return this;
    }
}
