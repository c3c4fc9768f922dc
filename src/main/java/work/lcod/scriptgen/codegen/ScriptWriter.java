package work.lcod.scriptgen.codegen;

/**
 * Line-oriented text buffer with fixed-width indentation. Lines end with {@code \n} on every platform.
 */
final class ScriptWriter {
    private final StringBuilder buffer = new StringBuilder();
    private final int indentWidth;

    ScriptWriter(int indentWidth) {
        this.indentWidth = Math.max(0, indentWidth);
    }

    ScriptWriter line(int indent, String text) {
        buffer.append(" ".repeat(indent * indentWidth)).append(text).append('\n');
        return this;
    }

    ScriptWriter line(String text) {
        return line(0, text);
    }

    ScriptWriter blank() {
        buffer.append('\n');
        return this;
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
