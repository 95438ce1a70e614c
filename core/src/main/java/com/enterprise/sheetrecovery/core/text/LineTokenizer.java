package com.enterprise.sheetrecovery.core.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line into trimmed fields. A double or single quote anywhere in a field starts a
 * quoted section that runs to the matching quote; the quote characters themselves are dropped,
 * the delimiter inside is literal and a doubled quote stands for one quote character.
 * Unterminated quotes swallow the rest of the line into the field.
 */
public class LineTokenizer {

    public List<String> tokenize(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        char quote = 0;

        int n = line.length();
        for (int i = 0; i < n; i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == quote) {
                    if (i + 1 < n && line.charAt(i + 1) == quote) {
                        current.append(c);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                inQuotes = true;
                quote = c;
            } else if (c == delimiter) {
                fields.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString().trim());
        return fields;
    }
}
