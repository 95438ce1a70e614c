package com.enterprise.sheetrecovery.core.mining;

import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.text.CellNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Recovers literal text from a shared-string part and lays it out as a table.
 */
public class StringPoolMiner {

    private static final Logger log = LoggerFactory.getLogger(StringPoolMiner.class);

    static final int MIN_TOKENS = 5;
    static final int MAX_TOKENS = 50;
    static final int HEADER_WIDTH = 10;

    private static final Pattern SYSTEM_TOKEN =
            Pattern.compile("^xl/|\\.xml$|^PK|^Content|^Types|sharedStrings", Pattern.CASE_INSENSITIVE);
    private static final Pattern STRICT_CHARS = Pattern.compile("^[가-힣a-zA-Z0-9\\-_()\\[\\]{}.,]+$");
    private static final Pattern DIGITS_AND_DOTS = Pattern.compile("^[0-9.]+$");
    private static final Pattern MEANINGFUL_CHAR = Pattern.compile("[가-힣a-zA-Z0-9]");
    private static final Pattern CLEAR_CONTROL = Pattern.compile("[\\x00-\\x08\\x0E-\\x1F\\x7F-\\x9F]");
    private static final Pattern LENIENT_SYSTEM = Pattern.compile("^PK$|^xl$|xml$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final List<Pattern> SUPPLEMENT_PATTERNS = List.of(
            Pattern.compile("[가-힣]+"),
            Pattern.compile("[a-zA-Z]{2,}"),
            Pattern.compile("[0-9]{4,}"),
            Pattern.compile("[가-힣a-zA-Z0-9]+"));

    private static final Pattern KOREAN_RUN = Pattern.compile("[가-힣]{2,}");
    private static final Pattern DOMAIN_KEYWORD = Pattern.compile("주문|배송|연락|전화|주소|번호|회사|고객|상품");
    private static final Pattern LONG_NUMBER = Pattern.compile("\\d{4,}");

    private final CellNormalizer normalizer;

    public StringPoolMiner(CellNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Text of every {@code <t>} element; when there are none, filtered words of the markup.
     * Fewer than {@value #MIN_TOKENS} tokens are topped up from pattern scans of the tag-free
     * text, deduplicated and capped at {@value #MAX_TOKENS}.
     */
    public List<String> extract(String markup) {
        List<String> tokens = new ArrayList<>();
        for (String body : XmlText.textElements(markup)) {
            if (!body.isBlank()) {
                tokens.add(body.trim());
            }
        }

        String stripped = XmlText.stripTags(markup);
        if (tokens.isEmpty()) {
            tokens = new ArrayList<>(filteredWords(stripped));
            log.debug("Recovered {} word token(s) from untagged string pool", tokens.size());
        }
        if (tokens.size() < MIN_TOKENS) {
            Set<String> merged = new LinkedHashSet<>(tokens);
            supplement(stripped, merged);
            tokens = merged.stream().limit(MAX_TOKENS).collect(Collectors.toList());
        }
        return tokens;
    }

    public boolean hasMeaningfulContent(List<String> tokens) {
        return tokens.stream().anyMatch(StringPoolMiner::isMeaningful);
    }

    static boolean isMeaningful(String token) {
        return KOREAN_RUN.matcher(token).find()
                || DOMAIN_KEYWORD.matcher(token).find()
                || LONG_NUMBER.matcher(token).find();
    }

    /**
     * First {@value #HEADER_WIDTH} tokens become the header; the rest fill rows of that width.
     */
    public Table layout(List<String> tokens) {
        int width = Math.min(tokens.size(), HEADER_WIDTH);
        List<List<CellValue>> rows = new ArrayList<>();
        List<CellValue> header = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            header.add(CellValue.string(normalizer.header(tokens.get(i), i)));
        }
        rows.add(header);
        for (int start = width; start < tokens.size(); start += width) {
            List<CellValue> row = new ArrayList<>(width);
            for (String token : tokens.subList(start, Math.min(start + width, tokens.size()))) {
                row.add(CellValue.string(token));
            }
            rows.add(row);
        }
        return Table.of(rows);
    }

    // ─── Word filters ───────────────────────────────────────────────────────

    private static Set<String> filteredWords(String stripped) {
        List<String> words = List.of(WHITESPACE_RUN.split(stripped.trim()));
        List<Predicate<String>> levels = List.of(
                StringPoolMiner::strict, StringPoolMiner::medium, StringPoolMiner::lenient);

        Set<String> tokens = new LinkedHashSet<>();
        for (Predicate<String> level : levels) {
            tokens = filter(words, level);
            if (tokens.size() >= MIN_TOKENS) {
                break;
            }
        }
        return tokens;
    }

    private static Set<String> filter(List<String> words, Predicate<String> level) {
        Set<String> kept = new LinkedHashSet<>();
        for (String word : words) {
            if (level.test(word)) {
                kept.add(word);
                if (kept.size() == MAX_TOKENS) {
                    break;
                }
            }
        }
        return kept;
    }

    private static boolean strict(String word) {
        return word.length() >= 2 && word.length() <= 50
                && STRICT_CHARS.matcher(word).matches()
                && !DIGITS_AND_DOTS.matcher(word).matches()
                && !SYSTEM_TOKEN.matcher(word).find();
    }

    private static boolean medium(String word) {
        return word.length() >= 2 && word.length() <= 50
                && MEANINGFUL_CHAR.matcher(word).find()
                && !SYSTEM_TOKEN.matcher(word).find()
                && !CLEAR_CONTROL.matcher(word).find();
    }

    private static boolean lenient(String word) {
        return !word.isEmpty() && word.length() <= 100
                && MEANINGFUL_CHAR.matcher(word).find()
                && !LENIENT_SYSTEM.matcher(word).find();
    }

    private static void supplement(String text, Set<String> tokens) {
        for (Pattern pattern : SUPPLEMENT_PATTERNS) {
            List<String> found = new ArrayList<>();
            Matcher m = pattern.matcher(text);
            while (m.find()) {
                if (!LENIENT_SYSTEM.matcher(m.group()).find()) {
                    found.add(m.group());
                }
            }
            if (!found.isEmpty()) {
                for (String token : found) {
                    if (tokens.size() >= MAX_TOKENS) {
                        return;
                    }
                    tokens.add(token);
                }
                return;
            }
        }
    }
}
