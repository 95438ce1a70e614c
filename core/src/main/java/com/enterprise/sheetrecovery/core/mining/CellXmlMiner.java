package com.enterprise.sheetrecovery.core.mining;

import com.enterprise.sheetrecovery.core.model.CellValue;
import com.enterprise.sheetrecovery.core.model.Table;
import com.enterprise.sheetrecovery.core.text.CellNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers cell values from worksheet markup. Cell coordinates are not trusted; values are
 * reshaped into a roughly square grid.
 */
public class CellXmlMiner {

    static final int MIN_COLUMNS = 3;
    static final int MAX_COLUMNS = 15;

    private static final Pattern CELL = Pattern.compile("<c\\b([^>]*?)(?:/>|>(.*?)</c>)", Pattern.DOTALL);
    private static final Pattern TYPE_ATTRIBUTE = Pattern.compile("\\bt\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern VALUE = Pattern.compile("<v(?:\\s[^>]*)?>([^<]*)</v>");

    private final CellNormalizer normalizer;

    public CellXmlMiner(CellNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Shared-string items for resolving {@code t="s"} cells; empty when the part is unavailable.
     */
    public List<String> sharedStrings(String sharedStringsMarkup) {
        return XmlText.sharedItems(sharedStringsMarkup);
    }

    public List<String> cellValues(String worksheetMarkup, List<String> sharedStrings) {
        List<String> values = new ArrayList<>();
        Matcher m = CELL.matcher(worksheetMarkup);
        while (m.find()) {
            String body = m.group(2);
            if (body == null) {
                continue;
            }
            Matcher type = TYPE_ATTRIBUTE.matcher(m.group(1));
            String value = value(type.find() ? type.group(1) : "n", body, sharedStrings);
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    /**
     * Grid of the worksheet's values, {@code clamp(floor(sqrt(n)), 3, 15)} columns wide; empty
     * when the markup holds no values.
     */
    public Optional<Table> mine(String worksheetMarkup, List<String> sharedStrings) {
        List<String> values = cellValues(worksheetMarkup, sharedStrings);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        int columns = columnsFor(values.size());
        List<List<CellValue>> rows = new ArrayList<>();
        for (int start = 0; start < values.size(); start += columns) {
            List<String> chunk = values.subList(start, Math.min(start + columns, values.size()));
            List<CellValue> row = new ArrayList<>(columns);
            for (int i = 0; i < chunk.size(); i++) {
                row.add(start == 0
                        ? CellValue.string(normalizer.header(chunk.get(i), i))
                        : normalizer.data(chunk.get(i)));
            }
            rows.add(row);
        }
        return Optional.of(Table.of(rows));
    }

    static int columnsFor(int valueCount) {
        int root = (int) Math.floor(Math.sqrt(valueCount));
        return Math.max(MIN_COLUMNS, Math.min(MAX_COLUMNS, root));
    }

    private static String value(String type, String body, List<String> sharedStrings) {
        if ("inlineStr".equals(type)) {
            return String.join("", XmlText.textElements(body));
        }
        Matcher v = VALUE.matcher(body);
        if (!v.find()) {
            return null;
        }
        String raw = XmlText.unescape(v.group(1));
        switch (type) {
            case "s":
                try {
                    int index = Integer.parseInt(raw.trim());
                    return index >= 0 && index < sharedStrings.size() ? sharedStrings.get(index) : raw;
                } catch (NumberFormatException e) {
                    return raw;
                }
            case "b":
                return "1".equals(raw.trim()) ? "true" : "0".equals(raw.trim()) ? "false" : raw;
            default:
                return raw;
        }
    }
}
