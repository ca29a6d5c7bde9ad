package fun.fengwk.rp.core.service.flow;

import java.util.Map;

/**
 * Fills {@code {name}} placeholders of a selector from flow variables.
 *
 * <p>{@code {{} and {@code }}} produce literal braces.
 *
 * @author fengwk
 */
public final class SelectorTemplate {

    private SelectorTemplate() {
    }

    public static String format(String selector, Map<String, ?> variables) {
        if (selector == null) {
            return null;
        }
        StringBuilder result = new StringBuilder(selector.length());
        int i = 0;
        while (i < selector.length()) {
            char c = selector.charAt(i);
            if (c == '{') {
                if (i + 1 < selector.length() && selector.charAt(i + 1) == '{') {
                    result.append('{');
                    i += 2;
                    continue;
                }
                int end = selector.indexOf('}', i + 1);
                if (end < 0) {
                    throw formatError(selector, "single '{' encountered");
                }
                String name = selector.substring(i + 1, end).trim();
                if (name.isEmpty()) {
                    throw formatError(selector, "empty placeholder");
                }
                if (variables == null || !variables.containsKey(name)) {
                    throw formatError(selector, "missing variable '" + name + "'");
                }
                result.append(variables.get(name));
                i = end + 1;
            } else if (c == '}') {
                if (i + 1 < selector.length() && selector.charAt(i + 1) == '}') {
                    result.append('}');
                    i += 2;
                    continue;
                }
                throw formatError(selector, "single '}' encountered");
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    private static IllegalArgumentException formatError(String selector, String reason) {
        return new IllegalArgumentException("Error formatting selector: " + selector + ". Error: " + reason);
    }

}
