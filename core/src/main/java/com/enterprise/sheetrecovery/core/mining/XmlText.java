package com.enterprise.sheetrecovery.core.mining;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-level access to spreadsheet markup. Tolerates truncated and malformed documents,
 * which a real XML parser would reject.
 */
final class XmlText {

    static final Pattern TEXT_ELEMENT = Pattern.compile("<t(?:\\s[^>]*)?>([^<]*)</t>");
    private static final Pattern SHARED_ITEM = Pattern.compile("<si(?:\\s[^>]*)?>(.*?)</si>", Pattern.DOTALL);
    private static final Pattern ENTITY = Pattern.compile("&(#x[0-9A-Fa-f]+|#\\d+|lt|gt|amp|quot|apos);");
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private XmlText() {
    }

    /** Unescaped bodies of every {@code <t>} element, in document order. */
    static List<String> textElements(String markup) {
        List<String> bodies = new ArrayList<>();
        Matcher m = TEXT_ELEMENT.matcher(markup);
        while (m.find()) {
            bodies.add(unescape(m.group(1)));
        }
        return bodies;
    }

    /** One entry per {@code <si>} item, rich-text runs concatenated. */
    static List<String> sharedItems(String markup) {
        List<String> items = new ArrayList<>();
        Matcher m = SHARED_ITEM.matcher(markup);
        while (m.find()) {
            items.add(String.join("", textElements(m.group(1))));
        }
        return items;
    }

    static String stripTags(String markup) {
        return TAG.matcher(markup).replaceAll(" ");
    }

    static String unescape(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        Matcher m = ENTITY.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(resolve(m.group(1), m.group())));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String resolve(String entity, String original) {
        switch (entity) {
            case "lt":
                return "<";
            case "gt":
                return ">";
            case "amp":
                return "&";
            case "quot":
                return "\"";
            case "apos":
                return "'";
            default:
                break;
        }
        try {
            int codePoint = entity.startsWith("#x")
                    ? Integer.parseInt(entity.substring(2), 16)
                    : Integer.parseInt(entity.substring(1));
            return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : original;
        } catch (NumberFormatException e) {
            return original;
        }
    }
}
