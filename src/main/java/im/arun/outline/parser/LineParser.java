package im.arun.outline.parser;

import im.arun.outline.model.ElementNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a single snapshot line into an {@link ElementNode} stub.
 * Lines without a recognisable "- kind" prefix are skipped, never reported.
 */
public class LineParser {

    private static final Pattern ELEMENT_PATTERN = Pattern.compile("^\\s*-\\s*([a-z]+)(.*)$");
    private static final Pattern REF_PATTERN = Pattern.compile("\\[ref=([^\\]]+)\\]");
    private static final String POINTER_MARKER = "[cursor=pointer]";

    /**
     * Parse one line.
     *
     * @param line       Raw line, indentation included
     * @param lineNumber Zero-based position of the line in the snapshot
     * @return The node stub, or empty for blank and malformed lines
     */
    public Optional<ElementNode> parse(String line, int lineNumber) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        Matcher elementMatcher = ELEMENT_PATTERN.matcher(line);
        if (!elementMatcher.matches()) {
            return Optional.empty();
        }

        String kindToken = elementMatcher.group(1);
        String rest = elementMatcher.group(2);

        // A token glued to more letters or digits ("-abc123") is not a role
        if (!rest.isEmpty() && Character.isLetterOrDigit(rest.charAt(0))) {
            return Optional.empty();
        }

        boolean interactive = line.contains(POINTER_MARKER);

        String referenceId = null;
        String text = rest;
        // The trailing marker is the element's own; earlier ones belong to the visible text
        Matcher refMatcher = REF_PATTERN.matcher(rest);
        int markerStart = -1;
        while (refMatcher.find()) {
            referenceId = refMatcher.group(1).trim();
            markerStart = refMatcher.start();
        }
        if (markerStart >= 0) {
            text = rest.substring(0, markerStart);
        }

        ElementNode node = new ElementNode(
            kindToken,
            referenceId == null || referenceId.isEmpty() ? null : referenceId,
            cleanText(text),
            countIndent(line),
            lineNumber
        );
        node.setInteractive(interactive);
        return Optional.of(node);
    }

    private int countIndent(String line) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            indent++;
        }
        return indent;
    }

    private String cleanText(String raw) {
        String text = raw.replace(POINTER_MARKER, "").trim();
        // "- text: value" style lines put the value after a colon
        if (text.startsWith(":")) {
            text = text.substring(1).trim();
        }
        // Trailing colon only announces nested children
        if (text.endsWith(":")) {
            text = text.substring(0, text.length() - 1).trim();
        }
        return text.isEmpty() ? null : text;
    }
}
