package org.dxworks.mathframe.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Low-level scanning over raw LaTeX source. Offsets are absolute positions in {@code text};
 * {@code end} is exclusive.
 */
final class LatexTextUtils {

    private LatexTextUtils() {
        // utility class
    }

    static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Index of the brace closing the one at {@code openIdx}, or -1. Escaped braces do not count.
     */
    static int findMatchingBrace(String text, int openIdx, int end) {
        int depth = 0;
        for (int i = openIdx; i < end; i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * True if {@code text} has the control word {@code \name} at {@code pos}, not followed by another letter.
     */
    static boolean startsWithCommand(String text, int pos, int end, String name) {
        int after = pos + 1 + name.length();
        if (after > end || text.charAt(pos) != '\\' || !text.startsWith(name, pos + 1)) {
            return false;
        }
        return after == end || !isLetter(text.charAt(after));
    }

    /**
     * Index of the {@code \end{...}} closing an environment whose body starts at {@code bodyStart},
     * skipping nested environments, or -1 if it never closes.
     */
    static int findEnvironmentEnd(String text, int bodyStart, int end) {
        int depth = 0;
        for (int i = bodyStart; i < end; i++) {
            char c = text.charAt(i);
            if (c != '\\') {
                continue;
            }
            if (startsWithCommand(text, i, end, "begin")) {
                depth++;
            } else if (startsWithCommand(text, i, end, "end")) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
            i++;
        }
        return -1;
    }

    /**
     * Splits a matrix body into rows at top-level {@code \\} and each row into cells at
     * top-level {@code &}. Returns {start, end} ranges per cell.
     */
    static List<List<int[]>> splitMatrixBody(String text, int start, int end) {
        List<List<int[]>> rows = new ArrayList<>();
        List<int[]> row = new ArrayList<>();
        int braceDepth = 0;
        int envDepth = 0;
        int cellStart = start;
        int i = start;
        while (i < end) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < end) {
                char next = text.charAt(i + 1);
                if (next == '\\' && braceDepth == 0 && envDepth == 0) {
                    row.add(new int[]{cellStart, i});
                    rows.add(row);
                    row = new ArrayList<>();
                    i += 2;
                    cellStart = i;
                    continue;
                }
                if (startsWithCommand(text, i, end, "begin")) {
                    envDepth++;
                } else if (startsWithCommand(text, i, end, "end")) {
                    envDepth--;
                }
                i += 2;
                continue;
            }
            if (c == '{') {
                braceDepth++;
            } else if (c == '}') {
                braceDepth--;
            } else if (c == '&' && braceDepth == 0 && envDepth == 0) {
                row.add(new int[]{cellStart, i});
                cellStart = i + 1;
            }
            i++;
        }
        row.add(new int[]{cellStart, end});
        rows.add(row);
        return rows;
    }

    static boolean isBlank(String text, int start, int end) {
        for (int i = start; i < end; i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
