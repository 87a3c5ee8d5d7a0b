package org.learningjava.vaultsearch.domain.service.chunking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Leading YAML block of a note, delimited by {@code ---} lines. Keys are kept as a loose map; only
 * {@code title}, {@code date} and {@code tags} get structured accessors.
 */
public record Frontmatter(Map<String, Object> fields, int bodyStartLine) {

    public static final Frontmatter NONE = new Frontmatter(Map.of(), 0);

    private static final String DELIMITER = "---";
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public Frontmatter {
        // YAML allows null values, so Map.copyOf is not an option
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Reads the frontmatter from already split note lines. Without a closing delimiter the whole note is body.
     *
     * @throws NoteParseException when the block exists but is not a YAML mapping
     */
    public static Frontmatter parse(String[] lines) {
        if (lines.length == 0 || !DELIMITER.equals(lines[0].trim())) return NONE;

        int closing = -1;
        for (int i = 1; i < lines.length; i++) {
            if (DELIMITER.equals(lines[i].trim())) {
                closing = i;
                break;
            }
        }
        if (closing < 0) return NONE;

        String yaml = String.join("\n", List.of(lines).subList(1, closing));
        if (yaml.isBlank()) return new Frontmatter(Map.of(), closing + 1);

        try {
            Map<String, Object> map = YAML.readValue(yaml, MAP_TYPE);
            return new Frontmatter(map == null ? Map.of() : map, closing + 1);
        } catch (JsonProcessingException e) {
            throw new NoteParseException("Malformed frontmatter: " + e.getOriginalMessage(), e);
        }
    }

    public static Frontmatter parse(String text) {
        return parse(NoteChunker.splitLines(text));
    }

    public Optional<String> title() {
        Object v = fields.get("title");
        if (v == null) return Optional.empty();
        String s = v.toString().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    /** First {@code YYYY-MM-DD} found in the {@code date} field. */
    public Optional<String> date() {
        Object v = fields.get("date");
        if (v == null) return Optional.empty();
        Matcher m = ISO_DATE.matcher(v.toString());
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    /** Tags as a comma separated list, whether written as a YAML list or a plain string. */
    public Optional<String> tags() {
        Object v = fields.get("tags");
        if (v == null) return Optional.empty();
        String joined;
        if (v instanceof Collection<?> c) {
            joined = c.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .collect(Collectors.joining(", "));
        } else {
            joined = v.toString().trim();
            if (joined.startsWith("[")) joined = joined.substring(1);
            if (joined.endsWith("]")) joined = joined.substring(0, joined.length() - 1);
            joined = joined.trim();
        }
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }
}
