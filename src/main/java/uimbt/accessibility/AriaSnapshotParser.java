package uimbt.accessibility;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parses the indented accessibility snapshot text into an {@link AriaNode}
 * tree.
 *
 * <p>Line grammar, one node per line, children indented deeper:
 * <pre>
 * - navigation "Main":
 *   - link "Devices":
 *     - /url: "#!/devices"
 *   - button "Menu" [expanded] [level=2]
 *   - text: Free text
 * </pre>
 * Lines whose role starts with {@code /} are annotations: they set an
 * attribute on the enclosing node instead of becoming a child. Names are
 * optional; attributes come as {@code [key=value]} or bare {@code [flag]}
 * groups, optionally comma-separated inside one bracket. YAML single-quoted
 * lines are unwrapped.
 *
 * <p>Parsing never throws: malformed lines are skipped and a snapshot that
 * yields nothing parses to {@code null}.
 */
public class AriaSnapshotParser {

    private static final Logger log = LoggerFactory.getLogger(AriaSnapshotParser.class);

    private record Frame(int indent, AriaNode node) {}

    /**
     * @param snapshot the textual snapshot, may be null
     * @return the synthetic document root, or {@code null} when nothing could be parsed
     */
    public AriaNode parse(String snapshot) {
        if (snapshot == null || snapshot.isBlank()) return null;
        try {
            return doParse(snapshot);
        } catch (RuntimeException e) {
            log.debug("Accessibility snapshot could not be parsed: {}", e.getMessage());
            return null;
        }
    }

    private AriaNode doParse(String snapshot) {
        AriaNode root = AriaNode.root();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(-1, root));
        int parsed = 0;

        for (String rawLine : snapshot.split("\\r?\\n")) {
            if (rawLine.isBlank()) continue;
            int indent = indentOf(rawLine);
            String line = rawLine.strip();
            if (!line.startsWith("-")) {
                log.debug("Skipping non-item snapshot line: {}", line);
                continue;
            }
            String content = unquoteYaml(line.substring(1).strip());
            if (content.isEmpty()) continue;

            while (stack.peek().indent() >= indent) {
                stack.pop();
            }
            AriaNode enclosing = stack.peek().node();

            int colon = headerEnd(content);
            String header = colon < 0 ? content : content.substring(0, colon).strip();
            String inline = colon < 0 ? null : content.substring(colon + 1).strip();

            if (header.startsWith("/")) {
                // ── Annotation: attaches to the enclosing node ──────────────
                String key = header.substring(1).strip();
                if (!key.isEmpty() && inline != null) {
                    enclosing.setAttribute(key, unquoteValue(inline));
                    parsed++;
                }
                continue;
            }

            String value = inline == null || inline.isEmpty() ? null : unquoteValue(inline);
            AriaNode node;
            if ("text".equals(header) && value != null) {
                node = enclosing.addChild("text", value);
            } else {
                node = parseHeader(enclosing, header);
                if (node == null) continue;
                if (value != null) node.setText(value);
            }
            stack.push(new Frame(indent, node));
            parsed++;
        }
        return parsed == 0 ? null : root;
    }

    // ── Header: role "name" [attr=val] ───────────────────────────────────────

    private AriaNode parseHeader(AriaNode parent, String header) {
        int i = 0;
        int n = header.length();
        while (i < n && !Character.isWhitespace(header.charAt(i)) && header.charAt(i) != '[') i++;
        String role = header.substring(0, i);
        if (role.isEmpty()) return null;

        i = skipSpaces(header, i);
        String name = "";
        if (i < n && (header.charAt(i) == '"' || header.charAt(i) == '/')) {
            char close = header.charAt(i);
            int end = closingIndex(header, i + 1, close);
            name = close == '"'
                    ? unescape(header.substring(i + 1, end))
                    : header.substring(i, Math.min(end + 1, n));
            i = end + 1;
        }

        AriaNode node = parent.addChild(role, name);
        while (i < n) {
            i = skipSpaces(header, i);
            if (i >= n || header.charAt(i) != '[') break;
            int end = header.indexOf(']', i);
            if (end < 0) end = n;
            for (String attr : header.substring(i + 1, end).split(",")) {
                addAttribute(node, attr.strip());
            }
            i = end + 1;
        }
        return node;
    }

    private static void addAttribute(AriaNode node, String attr) {
        if (attr.isEmpty()) return;
        int eq = attr.indexOf('=');
        if (eq < 0) {
            node.setAttribute(attr, "true");
        } else {
            node.setAttribute(attr.substring(0, eq).strip(), unquoteValue(attr.substring(eq + 1).strip()));
        }
    }

    // ── Lexical helpers ──────────────────────────────────────────────────────

    private static int indentOf(String line) {
        int indent = 0;
        for (char c : line.toCharArray()) {
            if (c == ' ') indent++;
            else if (c == '\t') indent += 2;
            else break;
        }
        return indent;
    }

    private static int skipSpaces(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
        return i;
    }

    /** Index of the closing delimiter, honouring backslash escapes; end of string if missing. */
    private static int closingIndex(String s, int from, char close) {
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') { i++; continue; }
            if (c == close) return i;
        }
        return s.length();
    }

    /** Position of the header/value separating colon, outside quotes and brackets. */
    private static int headerEnd(String content) {
        boolean inQuotes = false;
        int brackets = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (inQuotes) {
                if (c == '\\') i++;
                else if (c == '"') inQuotes = false;
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == '[') {
                brackets++;
            } else if (c == ']') {
                brackets = Math.max(0, brackets - 1);
            } else if (c == ':' && brackets == 0) {
                return i;
            }
        }
        return -1;
    }

    /** Unwraps a YAML single-quoted scalar, e.g. {@code 'link "a: b"':}. */
    private static String unquoteYaml(String content) {
        if (!content.startsWith("'")) return content;
        StringBuilder sb = new StringBuilder();
        int i = 1;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c == '\'') {
                if (i + 1 < content.length() && content.charAt(i + 1) == '\'') {
                    sb.append('\'');
                    i += 2;
                    continue;
                }
                return sb + content.substring(i + 1);
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    private static String unquoteValue(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return unescape(value.substring(1, value.length() - 1));
        }
        return value;
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) return s;
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(++i);
                sb.append(next == 'n' ? ' ' : next);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
