package com.deepansh.adventure.session;

/**
 * Turns the engine's per-item descriptor into a short display name.
 *
 * The engine prints inventory objects in its debug form, e.g.
 * {@code "Obj39: brass lantern Parent4 Sibling0 Child0 Attributes [14] Properties [...]"}.
 * That format is undocumented, so this is a best-effort heuristic and the only
 * place that knows about it:
 * <ol>
 *   <li>if the descriptor contains "parent" (any case), take the text before it,
 *       then the part after the first colon if there is one;</li>
 *   <li>else if it contains a colon, take the field between the first colon and
 *       the next one (or the end);</li>
 *   <li>else return it as is.</li>
 * </ol>
 * Results are trimmed. Descriptors of other shapes come back imperfect, never null.
 */
public final class InventoryParser {

    private static final String PARENT_MARKER = "parent";

    private InventoryParser() {
    }

    public static String displayName(String descriptor) {
        if (descriptor == null) {
            return "";
        }

        int parentIdx = descriptor.toLowerCase().indexOf(PARENT_MARKER);
        if (parentIdx >= 0) {
            return afterFirstColon(descriptor.substring(0, parentIdx).trim());
        }
        return secondField(descriptor);
    }

    private static String afterFirstColon(String text) {
        int colon = text.indexOf(':');
        return colon >= 0 ? text.substring(colon + 1).trim() : text;
    }

    private static String secondField(String text) {
        int colon = text.indexOf(':');
        if (colon < 0) {
            return text;
        }
        int next = text.indexOf(':', colon + 1);
        return (next >= 0 ? text.substring(colon + 1, next) : text.substring(colon + 1)).trim();
    }
}
