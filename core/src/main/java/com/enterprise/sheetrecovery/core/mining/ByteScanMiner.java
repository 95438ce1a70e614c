package com.enterprise.sheetrecovery.core.mining;

import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.text.CellNormalizer;
import com.enterprise.sheetrecovery.core.util.FileNames;
import com.enterprise.sheetrecovery.core.util.TextDecoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort token mining over the raw input. The buffer is decoded under several charsets
 * and each decoding is searched for Korean runs, business keywords, English words and
 * number shapes that show up in order and shipping sheets.
 */
public class ByteScanMiner {

    private static final Logger log = LoggerFactory.getLogger(ByteScanMiner.class);

    public static final List<String> HEADER = List.of("발견된 텍스트", "타입", "길이", "설명");

    public static final int MAX_TOKENS = 100;
    static final int MAX_WORDS_PER_ENCODING = 20;
    static final int MAX_NUMBERS_PER_SHAPE = 10;
    static final int MAX_KOREAN_RUN = 20;

    private static final List<Charset> ENCODINGS = List.of(
            TextDecoding.EUC_KR,
            TextDecoding.MS949,
            StandardCharsets.UTF_8,
            StandardCharsets.UTF_16LE,
            StandardCharsets.ISO_8859_1,
            StandardCharsets.US_ASCII);

    static final List<String> BUSINESS_KEYWORDS = List.of(
            "주문번호", "송장번호", "운송장", "배송", "택배",
            "연락처", "전화번호", "휴대폰", "핸드폰",
            "주소", "도로명", "지번", "우편번호",
            "수량", "금액", "가격", "합계", "총액",
            "고객", "업체", "회사", "상호", "법인",
            "날짜", "시간", "년", "월", "일",
            "상품", "제품", "품목", "아이템",
            "부내사업", "지정송하인", "오쎄");

    private static final Set<String> ENGLISH_STOPLIST = Set.of(
            "pk", "xml", "content", "types", "rels", "docprops", "app", "core", "workbook",
            "worksheet", "sharedstrings", "styles", "deflate", "gzip", "ascii", "utf", "latin");

    private static final Pattern KOREAN_RUN = Pattern.compile("[가-힣]{2,}");
    private static final Pattern ENGLISH_WORD = Pattern.compile("(?<![A-Za-z])[A-Za-z]{3,50}(?![A-Za-z])");
    private static final List<Pattern> NUMBER_SHAPES = List.of(
            Pattern.compile("\\b\\d{2,4}-\\d{2,4}-\\d{4}\\b"),
            Pattern.compile("\\b\\d{5}\\b"),
            Pattern.compile("\\b20\\d{8,10}\\b"),
            Pattern.compile("\\d{4,}"));

    private static final Pattern FILENAME_SEPARATORS = Pattern.compile("[_\\-\\[\\]().\\s]+");
    private static final Pattern FILENAME_KOREAN = Pattern.compile("[가-힣]");
    private static final Pattern FILENAME_ENGLISH = Pattern.compile("[a-zA-Z]{2,}");
    private static final Pattern FILENAME_NUMBER = Pattern.compile("\\d{4,}");

    private final CellNormalizer normalizer;
    private final TokenClassifier classifier;

    public ByteScanMiner(CellNormalizer normalizer, TokenClassifier classifier) {
        this.normalizer = normalizer;
        this.classifier = classifier;
    }

    /**
     * Distinct tokens in discovery order, at most {@value #MAX_TOKENS}. Tokens of the sanitized
     * filename follow those found in the buffer.
     */
    public List<String> mine(byte[] bytes, String filename) {
        Set<String> tokens = new LinkedHashSet<>();
        for (Charset charset : ENCODINGS) {
            String text = TextDecoding.lenient(bytes, charset);
            int before = tokens.size();
            collectKorean(text, tokens);
            collectKeywords(text, tokens);
            collectEnglish(text, tokens);
            collectNumbers(text, tokens);
            log.debug("{} yielded {} new token(s)", charset.name(), tokens.size() - before);
        }
        tokens.addAll(filenameTokens(filename));
        List<String> result = new ArrayList<>(tokens);
        return result.size() > MAX_TOKENS ? new ArrayList<>(result.subList(0, MAX_TOKENS)) : result;
    }

    /**
     * Fixed four-column report: token, type, length, description.
     */
    public Table toTable(List<String> tokens) {
        List<List<CellValue>> rows = new ArrayList<>(tokens.size() + 1);
        List<CellValue> header = new ArrayList<>();
        for (String name : HEADER) {
            header.add(CellValue.string(name));
        }
        rows.add(header);
        for (String token : tokens) {
            TokenClassifier.Classification classification = classifier.classify(token);
            String cleaned = normalizer.cleanHeader(token);
            rows.add(List.of(
                    CellValue.string(cleaned.isEmpty() ? token : cleaned),
                    CellValue.string(classification.getType()),
                    CellValue.number(token.length()),
                    CellValue.string(classification.getDescription())));
        }
        return Table.of(rows);
    }

    // ─── Collectors ─────────────────────────────────────────────────────────

    private static void collectKorean(String text, Set<String> tokens) {
        Matcher m = KOREAN_RUN.matcher(text);
        int found = 0;
        while (m.find() && found < MAX_WORDS_PER_ENCODING) {
            String run = m.group();
            if (run.length() <= MAX_KOREAN_RUN && !isSingleSyllableRepeat(run)) {
                tokens.add(run);
                found++;
            }
        }
    }

    /** Runs like 가가 or 나나나 come from byte noise, not text. */
    static boolean isSingleSyllableRepeat(String run) {
        return run.chars().distinct().count() == 1;
    }

    private static void collectKeywords(String text, Set<String> tokens) {
        for (String keyword : BUSINESS_KEYWORDS) {
            if (text.contains(keyword)) {
                tokens.add(keyword);
            }
        }
    }

    private static void collectEnglish(String text, Set<String> tokens) {
        Matcher m = ENGLISH_WORD.matcher(text);
        int found = 0;
        while (m.find() && found < MAX_WORDS_PER_ENCODING) {
            String word = m.group();
            if (!ENGLISH_STOPLIST.contains(word.toLowerCase(Locale.ROOT))) {
                tokens.add(word);
                found++;
            }
        }
    }

    private static void collectNumbers(String text, Set<String> tokens) {
        for (Pattern shape : NUMBER_SHAPES) {
            Matcher m = shape.matcher(text);
            int found = 0;
            while (m.find() && found < MAX_NUMBERS_PER_SHAPE) {
                tokens.add(m.group());
                found++;
            }
        }
    }

    static List<String> filenameTokens(String filename) {
        List<String> tokens = new ArrayList<>();
        if (filename == null || filename.isBlank()) {
            return tokens;
        }
        String base = FileNames.baseName(FileNames.sanitize(filename));
        for (String part : FILENAME_SEPARATORS.split(base)) {
            if (FILENAME_KOREAN.matcher(part).find()
                    || FILENAME_ENGLISH.matcher(part).find()
                    || FILENAME_NUMBER.matcher(part).find()) {
                tokens.add(part);
            }
        }
        return tokens;
    }
}
