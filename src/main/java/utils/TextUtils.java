package utils;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TextUtils {

    private static final Pattern RESULT_PATTERN = Pattern.compile("<result>\\s*(.*?)\\s*</result>", Pattern.DOTALL);

    /**
     * Content of the last &lt;result&gt; span, or null when there is none.
     */
    public static String extractResult(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = RESULT_PATTERN.matcher(text);
        String last = null;
        while (m.find()) {
            last = m.group(1);
        }
        return last == null ? null : last.trim();
    }

    /**
     * a; a and b; a, b, and c
     */
    public static String joinFancy(List<String> items) {
        if (items.isEmpty()) {
            return "";
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        if (items.size() == 2) {
            return items.get(0) + " and " + items.get(1);
        }
        return String.join(", ", items.subList(0, items.size() - 1)) + ", and " + items.get(items.size() - 1);
    }

    /**
     * Collapses whitespace runs and drops spaces just inside parentheses.
     * Quoted strings are copied unchanged.
     */
    public static String normalizeWs(String text) {
        String trimmed = text.trim();
        StringBuilder sb = new StringBuilder(trimmed.length());
        boolean quoted = false;
        boolean pendingSpace = false;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (quoted) {
                sb.append(c);
                if (c == '\\' && i + 1 < trimmed.length()) {
                    sb.append(trimmed.charAt(++i));
                } else if (c == '"') {
                    quoted = false;
                }
                continue;
            }
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                continue;
            }
            if (pendingSpace && c != ')' && sb.length() > 0 && sb.charAt(sb.length() - 1) != '(') {
                sb.append(' ');
            }
            pendingSpace = false;
            sb.append(c);
            if (c == '"') {
                quoted = true;
            }
        }
        return sb.toString();
    }
}
