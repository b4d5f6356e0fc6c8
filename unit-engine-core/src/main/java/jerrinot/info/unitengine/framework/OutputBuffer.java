package jerrinot.info.unitengine.framework;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.UnaryOperator;

/**
 * Captures {@code System.out} while a test runs. Test code may open nested levels; the level count must be
 * back where capturing started when it stops, and {@code System.out} must still be the capturing stream.
 */
final class OutputBuffer {

    static final String UNBALANCED_MESSAGE =
            "Test code or tested code did not (only) close its own output buffers";

    private final Deque<ByteArrayOutputStream> levels = new ArrayDeque<>();
    private PrintStream original;
    private PrintStream capturing;
    private int startLevel;

    void start() {
        if (capturing != null) {
            throw new EngineException("Output capturing already started");
        }
        original = System.out;
        levels.push(new ByteArrayOutputStream());
        startLevel = levels.size();
        capturing = new PrintStream(new OutputStream() {
            @Override
            public void write(int b) {
                ByteArrayOutputStream top = levels.peek();
                if (top != null) {
                    top.write(b);
                }
            }

            @Override
            public void write(byte[] b, int off, int len) {
                ByteArrayOutputStream top = levels.peek();
                if (top != null) {
                    top.write(b, off, len);
                }
            }
        }, true, StandardCharsets.UTF_8);
        System.setOut(capturing);
    }

    int getLevel() { return levels.size(); }

    boolean isCapturing() { return capturing != null; }

    void push() {
        levels.push(new ByteArrayOutputStream());
    }

    /**
     * Closes the innermost level and returns what was written to it.
     */
    String pop() {
        ByteArrayOutputStream top = levels.poll();
        if (top == null) {
            throw new EngineException("No output level open");
        }
        return top.toString(StandardCharsets.UTF_8);
    }

    /**
     * Restores {@code System.out} and returns the captured output, passed through the callback when one is set.
     *
     * @throws RiskyTestError when levels were left open, closed too often, or {@code System.out} was replaced
     */
    String stop(UnaryOperator<String> callback) {
        if (capturing == null) {
            return "";
        }
        boolean balanced = levels.size() == startLevel && System.out == capturing;
        String captured = balanced ? levels.getLast().toString(StandardCharsets.UTF_8) : "";
        capturing.flush();
        levels.clear();
        System.setOut(original);
        capturing = null;
        original = null;
        if (!balanced) {
            throw new RiskyTestError(UNBALANCED_MESSAGE);
        }
        return callback != null ? callback.apply(captured) : captured;
    }
}
