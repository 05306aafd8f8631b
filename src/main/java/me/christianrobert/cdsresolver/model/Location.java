package me.christianrobert.cdsresolver.model;

/**
 * Source position of a node or name: file plus 1-based line and column.
 * Locations are compared by identity when diagnostics are de-duplicated.
 */
public class Location {
    private final String file;
    private final int line;
    private final int col;

    public Location(String file, int line, int col) {
        this.file = file;
        this.line = line;
        this.col = col;
    }

    public String getFile() { return file; }
    public int getLine() { return line; }
    public int getCol() { return col; }

    /**
     * Returns a copy of this location; used for inferred nodes that must not
     * share the not-found marker of the location they were derived from.
     */
    public Location weak() {
        return new Location(file, line, col);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + col;
    }
}
