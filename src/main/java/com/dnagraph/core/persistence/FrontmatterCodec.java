package com.dnagraph.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes decision documents: a YAML frontmatter block between {@code ---}
 * lines followed by a markdown body.
 * <p>
 * The body is everything after the newline that ends the closing delimiter, kept
 * byte for byte, so {@code parse(serialize(fields, body)).body()} equals {@code body}.
 * <p>
 * Hand-written frontmatter is not always strict YAML (an unquoted title containing
 * {@code ": "} is the usual case). A block the YAML parser rejects is read again line by
 * line as flat {@code key: value} pairs and {@code - item} lists. YAML 1.1 words such as
 * {@code No} or {@code on} stay strings either way.
 */
@Component
public class FrontmatterCodec {

    private static final Logger log = LoggerFactory.getLogger(FrontmatterCodec.class);

    static final String DELIMITER = "---";

    /** Frontmatter keys in the order they are written. Unknown keys follow in their original order. */
    public static final List<String> FIELD_ORDER =
            List.of("id", "title", "date", "level", "state", "stakes", "depends_on");

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {};

    private static final Pattern KEY_LINE = Pattern.compile("^(\\w+)\\s*:\\s*(.*)$");

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");

    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final YAMLMapper yamlMapper;

    public FrontmatterCodec() {
        this.yamlMapper = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.INDENT_ARRAYS_WITH_INDICATOR)
                .enable(YAMLParser.Feature.PARSE_BOOLEAN_LIKE_WORDS_AS_STRINGS)
                .build();
    }

    /**
     * A parsed document. {@code fields} is null when the text has no frontmatter block;
     * the body is then the whole text.
     */
    public record ParsedDocument(Map<String, Object> fields, String body) {

        public boolean hasFrontmatter() {
            return fields != null;
        }
    }

    public ParsedDocument parse(String text) {
        if (text == null || !text.startsWith(DELIMITER)) {
            return new ParsedDocument(null, text == null ? "" : text);
        }
        int end = text.indexOf("\n" + DELIMITER, DELIMITER.length());
        if (end == -1) {
            return new ParsedDocument(null, text);
        }

        int yamlStart = text.indexOf('\n') + 1;
        String yaml = yamlStart > end ? "" : text.substring(yamlStart, end);
        String body = text.substring(end + 1 + DELIMITER.length());
        if (body.startsWith("\r\n")) {
            body = body.substring(2);
        } else if (body.startsWith("\n")) {
            body = body.substring(1);
        }

        if (yaml.isBlank()) {
            return new ParsedDocument(new LinkedHashMap<>(), body);
        }
        try {
            Map<String, Object> fields = yamlMapper.readValue(yaml, FIELDS_TYPE);
            return new ParsedDocument(fields == null ? new LinkedHashMap<>() : fields, body);
        } catch (JsonProcessingException e) {
            log.debug("Frontmatter is not strict YAML ({}), reading it line by line", e.getOriginalMessage());
            return new ParsedDocument(parseLines(yaml), body);
        }
    }

    /**
     * Flat {@code key: value} reading of a frontmatter block. Lines that are neither a
     * key nor a list item under a key are ignored.
     */
    static Map<String, Object> parseLines(String yaml) {
        var fields = new LinkedHashMap<String, Object>();
        String[] lines = yaml.split("\\r?\\n");
        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            Matcher m = KEY_LINE.matcher(line);
            if (line.isBlank() || line.strip().startsWith("#") || !m.matches()) {
                i++;
                continue;
            }
            String key = m.group(1);
            String value = m.group(2).strip();
            i++;
            if (value.isEmpty() && i < lines.length && lines[i].strip().startsWith("-")) {
                var items = new ArrayList<Object>();
                while (i < lines.length && lines[i].strip().startsWith("-")) {
                    items.add(scalar(lines[i].strip().substring(1).strip()));
                    i++;
                }
                fields.put(key, items);
            } else if (value.startsWith("[") && value.endsWith("]")) {
                String inner = value.substring(1, value.length() - 1).strip();
                fields.put(key, inner.isEmpty() ? new ArrayList<>() : new ArrayList<>(
                        Arrays.stream(inner.split(",")).map(item -> scalar(item.strip())).toList()));
            } else {
                fields.put(key, scalar(value));
            }
        }
        return fields;
    }

    private static Object scalar(String value) {
        if (value.isEmpty() || value.equals("~") || value.equalsIgnoreCase("null")) {
            return null;
        }
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        if (value.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (value.equalsIgnoreCase("false")) return Boolean.FALSE;
        if (INTEGER.matcher(value).matches()) {
            try {
                return Integer.valueOf(value);
            } catch (NumberFormatException e) {
                return value;
            }
        }
        if (DECIMAL.matcher(value).matches()) {
            return Double.valueOf(value);
        }
        return value;
    }

    /**
     * Renders fields and body as a document. Null values and a missing {@code stakes} are
     * omitted; {@code depends_on} is always written, as {@code []} when empty.
     */
    public String serialize(Map<String, Object> fields, String body) {
        var ordered = new LinkedHashMap<String, Object>();
        for (String key : FIELD_ORDER) {
            Object value = fields.get(key);
            if ("depends_on".equals(key)) {
                ordered.put(key, value == null ? List.of() : value);
            } else if (value != null) {
                ordered.put(key, value);
            }
        }
        fields.forEach((key, value) -> {
            if (!ordered.containsKey(key) && value != null) {
                ordered.put(key, value);
            }
        });

        String yaml;
        try {
            yaml = yamlMapper.writeValueAsString(ordered);
        } catch (JsonProcessingException e) {
            throw new DecisionStoreException("Cannot serialise frontmatter for " + fields.get("id"), e);
        }
        if (!yaml.endsWith("\n")) {
            yaml = yaml + "\n";
        }
        return DELIMITER + "\n" + yaml + DELIMITER + "\n" + (body == null ? "" : body);
    }
}
