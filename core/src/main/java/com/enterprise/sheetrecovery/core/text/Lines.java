package com.enterprise.sheetrecovery.core.text;

import java.util.List;
import java.util.regex.Pattern;

final class Lines {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\n|\\r");

    private Lines() {
    }

    static List<String> split(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(LINE_BREAK.split(text, -1));
    }
}
