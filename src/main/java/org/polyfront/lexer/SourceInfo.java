package org.polyfront.lexer;

/**
 * The SourceInfo class is the position handle attached to every token and,
 * transitively, to every leaf of a CST or Generic AST.
 * <p>
 * A "fake" SourceInfo is synthesized by lowering for nodes that have no
 * direct source counterpart (a temporary identifier, an implicit return).
 * Fake infos have no file position and answer {@code true} to {@link #isFake()}.
 */
public final class SourceInfo {
    public final String text;
    public final String fileName;
    public final int line;
    public final int column;
    // Character offset of the token in the source, -1 for fake infos
    public final int offset;

    public SourceInfo(String text, String fileName, int line, int column, int offset) {
        this.text = text;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    /**
     * Creates a synthesized position carrying only a descriptive text.
     *
     * @param text the text the synthesized token stands for
     * @return a fake SourceInfo
     */
    public static SourceInfo fake(String text) {
        return new SourceInfo(text, null, -1, -1, -1);
    }

    public boolean isFake() {
        return offset < 0;
    }

    /**
     * Returns a copy of this position with another text, keeping the location.
     * Used when a token is split or renamed but still points at the same place.
     */
    public SourceInfo withText(String newText) {
        return new SourceInfo(newText, fileName, line, column, offset);
    }

    public String location() {
        if (isFake()) {
            return "<fake " + text + ">";
        }
        return fileName + " line " + line + ", column " + column;
    }

    @Override
    public String toString() {
        return "SourceInfo{" + "text='" + text + '\'' + ", " + location() + '}';
    }
}
