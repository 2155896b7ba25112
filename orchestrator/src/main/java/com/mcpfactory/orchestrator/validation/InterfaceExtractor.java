package com.mcpfactory.orchestrator.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-pattern extraction over an MCP server entry point.
 *
 * This is not a parser. Regions are located with regexes and their extent
 * is found by bracket matching that skips string literals and comments, so
 * nested arrays such as {@code required: ['a']} inside a tool definition do
 * not cut the tools block short.
 */
public final class InterfaceExtractor {

    private static final Pattern LIST_TOOLS_HANDLER = Pattern.compile(
            "setRequestHandler\\(\\s*ListToolsRequestSchema");
    private static final Pattern TOOLS_ARRAY = Pattern.compile("\\btools\\s*:\\s*\\[");
    private static final Pattern TOOL_NAME = Pattern.compile("\\bname:\\s*['\"]([^'\"]+)['\"]");

    private static final Pattern CASE_LABEL = Pattern.compile("case\\s*['\"]([^'\"]+)['\"]\\s*:");
    private static final Pattern NAME_COMPARISON = Pattern.compile(
            "request\\.params\\.name\\s*===?\\s*['\"]([^'\"]+)['\"]");

    private static final Pattern INPUT_SCHEMA = Pattern.compile("\\binputSchema\\s*:\\s*\\{");
    private static final Pattern TYPE_KEY = Pattern.compile("^(?:type|\"type\"|'type')\\s*:");

    private InterfaceExtractor() {}

    // ------------------------------------------------------------------
    // Tool names
    // ------------------------------------------------------------------

    /**
     * Names declared in the first {@code tools: [ ... ]} block. The search
     * starts at the ListTools handler when there is one.
     */
    public static Set<String> declaredTools(String source) {
        Set<String> names = new LinkedHashSet<>();
        Matcher handler = LIST_TOOLS_HANDLER.matcher(source);
        int from = handler.find() ? handler.start() : 0;

        Matcher tools = TOOLS_ARRAY.matcher(source);
        if (!tools.find(from) && (from == 0 || !tools.find(0))) {
            return names;
        }
        String block = enclosed(source, tools.end() - 1);

        Matcher m = TOOL_NAME.matcher(block);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    /**
     * Names the call handler dispatches on: {@code case 'x':} labels and
     * {@code request.params.name === 'x'} comparisons, anywhere in the source.
     */
    public static Set<String> handledTools(String source) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = CASE_LABEL.matcher(source);
        while (m.find()) {
            names.add(m.group(1));
        }
        m = NAME_COMPARISON.matcher(source);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    // ------------------------------------------------------------------
    // Input schemas
    // ------------------------------------------------------------------

    /** Body of every {@code inputSchema: { ... }} literal, braces excluded, in source order. */
    public static List<String> inputSchemas(String source) {
        List<String> bodies = new ArrayList<>();
        Matcher m = INPUT_SCHEMA.matcher(source);
        while (m.find()) {
            bodies.add(enclosed(source, m.end() - 1));
        }
        return bodies;
    }

    /** True if the object body has a {@code type} key at its own nesting level. */
    public static boolean hasTopLevelType(String objectBody) {
        int depth = 0;
        boolean atKeyPosition = true;
        int i = 0;
        while (i < objectBody.length()) {
            char c = objectBody.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                if (depth == 0 && atKeyPosition
                        && TYPE_KEY.matcher(objectBody.substring(i)).lookingAt()) {
                    return true;
                }
                i = skipString(objectBody, i);
                atKeyPosition = false;
                continue;
            }
            if (c == '/' && i + 1 < objectBody.length()
                    && (objectBody.charAt(i + 1) == '/' || objectBody.charAt(i + 1) == '*')) {
                i = skipComment(objectBody, i);
                continue;
            }
            switch (c) {
                case '{', '[', '(' -> depth++;
                case '}', ']', ')' -> depth--;
                case ',' -> {
                    if (depth == 0) atKeyPosition = true;
                }
                default -> {
                    if (depth == 0 && atKeyPosition && !Character.isWhitespace(c)) {
                        if (TYPE_KEY.matcher(objectBody.substring(i)).lookingAt()) {
                            return true;
                        }
                        atKeyPosition = false;
                    }
                }
            }
            i++;
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Bracket matching
    // ------------------------------------------------------------------

    /**
     * Text strictly between the bracket at {@code openIdx} and its partner.
     * An unbalanced bracket runs to the end of the source.
     */
    static String enclosed(String source, int openIdx) {
        int close = matchingClose(source, openIdx);
        return source.substring(openIdx + 1, close < 0 ? source.length() : close);
    }

    /** Index of the bracket closing the one at {@code openIdx}, or -1. */
    static int matchingClose(String source, int openIdx) {
        int depth = 0;
        int i = openIdx;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = skipString(source, i);
                continue;
            }
            if (c == '/' && i + 1 < source.length()
                    && (source.charAt(i + 1) == '/' || source.charAt(i + 1) == '*')) {
                i = skipComment(source, i);
                continue;
            }
            if (c == '{' || c == '[' || c == '(') {
                depth++;
            } else if (c == '}' || c == ']' || c == ')') {
                depth--;
                if (depth == 0) return i;
            }
            i++;
        }
        return -1;
    }

    /** Index just past the string literal starting at {@code start}. */
    private static int skipString(String s, int start) {
        char quote = s.charAt(start);
        int i = start + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            // An unterminated quote ends at the line break, except in template literals.
            if (c == '\n' && quote != '`') return i;
            i++;
        }
        return s.length();
    }

    /** Index just past the comment starting at {@code start}. */
    private static int skipComment(String s, int start) {
        if (s.charAt(start + 1) == '/') {
            int eol = s.indexOf('\n', start);
            return eol < 0 ? s.length() : eol;
        }
        int end = s.indexOf("*/", start + 2);
        return end < 0 ? s.length() : end + 2;
    }
}
