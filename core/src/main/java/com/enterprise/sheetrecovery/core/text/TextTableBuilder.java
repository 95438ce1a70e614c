package com.enterprise.sheetrecovery.core.text;

import com.enterprise.sheetrecovery.core.EmptyResultException;
import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Builds a rectangular table from delimited text. The first non-blank line is the header.
 */
public class TextTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(TextTableBuilder.class);

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private final LineTokenizer tokenizer;
    private final CellNormalizer normalizer;

    public TextTableBuilder(LineTokenizer tokenizer, CellNormalizer normalizer) {
        this.tokenizer = tokenizer;
        this.normalizer = normalizer;
    }

    public Table build(String text, char delimiter) {
        List<List<CellValue>> rows = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Lines.split(text)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            boolean header = rows.isEmpty();
            List<String> fields = tokenize(line, delimiter, lineNumber);
            List<CellValue> cells = header ? headerCells(fields) : dataCells(fields);
            if (header || cells.stream().anyMatch(c -> !c.isEmpty())) {
                rows.add(cells);
            }
        }
        if (rows.isEmpty()) {
            throw new EmptyResultException("No non-blank lines to build a table from");
        }
        Table table = Table.of(rows);
        log.debug("Built {}x{} table from {} lines", table.height(), table.getWidth(), lineNumber);
        return table;
    }

    private List<String> tokenize(String line, char delimiter, int lineNumber) {
        try {
            return tokenizer.tokenize(line, delimiter);
        } catch (RuntimeException e) {
            log.warn("Line {} could not be tokenized ({}), falling back to plain splitting", lineNumber, e.getMessage());
        }
        for (Function<String, List<String>> splitter : fallbackSplitters(delimiter)) {
            try {
                return splitter.apply(line);
            } catch (RuntimeException e) {
                log.debug("Fallback split failed on line {}: {}", lineNumber, e.getMessage());
            }
        }
        return List.of(line.trim());
    }

    private static List<Function<String, List<String>>> fallbackSplitters(char delimiter) {
        return List.of(
                line -> naiveSplit(line, delimiter),
                line -> naiveSplit(line, ','),
                line -> naiveSplit(line, '\t'),
                line -> List.of(WHITESPACE_RUN.split(line.trim())));
    }

    private static List<String> naiveSplit(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        for (String field : line.split(Pattern.quote(String.valueOf(delimiter)), -1)) {
            fields.add(field.trim());
        }
        return fields;
    }

    private List<CellValue> headerCells(List<String> fields) {
        List<CellValue> cells = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            cells.add(CellValue.string(normalizer.header(fields.get(i), i)));
        }
        return cells;
    }

    private List<CellValue> dataCells(List<String> fields) {
        List<CellValue> cells = new ArrayList<>(fields.size());
        for (String field : fields) {
            cells.add(normalizer.data(field));
        }
        return cells;
    }
}
