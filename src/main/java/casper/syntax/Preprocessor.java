package casper.syntax;

import casper.error.IndentationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns significant indentation into explicit block markers. Each logical
 * line whose indentation is deeper than the innermost open block is prefixed
 * with {@link #INDENT}; each block closed by a shallower line adds one
 * {@link #DEDENT}. Blank and comment-only lines become empty lines so that
 * line numbers survive for later diagnostics.
 */
public final class Preprocessor {

    private static final Logger logger = LoggerFactory.getLogger(Preprocessor.class);

    public static final char INDENT = '\u21E8';
    public static final char DEDENT = '\u21E6';

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
    private static final Pattern LINE_PATTERN = Pattern.compile("^([ \\t]*)(.*)$");
    private static final Pattern IGNORABLE_LINE = Pattern.compile("^[ \\t]*(//.*)?$");

    private Preprocessor() {
    }

    public static String withIndentsAndDedents(String source) {
        Deque<Integer> depths = new ArrayDeque<>();
        depths.push(0);
        StringBuilder result = new StringBuilder();

        String[] lines = LINE_BREAK.split(source, -1);
        int lineCount = lines.length;
        // a trailing newline does not start another line
        if (lineCount > 0 && lines[lineCount - 1].isEmpty()) {
            lineCount--;
        }

        for (int i = 0; i < lineCount; i++) {
            String line = lines[i];
            if (IGNORABLE_LINE.matcher(line).matches()) {
                result.append('\n');
                continue;
            }

            Matcher matcher = LINE_PATTERN.matcher(line);
            matcher.matches();
            int depth = matcher.group(1).length();

            if (depth > depths.peek()) {
                depths.push(depth);
                result.append(INDENT);
            } else {
                while (depth < depths.peek()) {
                    depths.pop();
                    result.append(DEDENT);
                }
                if (depth != depths.peek()) {
                    throw new IndentationError(i + 1, depth);
                }
            }
            result.append(line).append('\n');
        }

        while (depths.size() > 1) {
            depths.pop();
            result.append(DEDENT);
        }

        logger.debug("Preprocessed {} source lines", lineCount);
        return result.toString();
    }
}
