package org.learningjava.vaultsearch.domain.service.chunking;

import org.learningjava.vaultsearch.domain.model.NoteChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits one markdown note into size-bounded chunks that follow its header structure.
 * <p>
 * The frontmatter block is never part of a chunk body. Instead a short note prefix (path, title, date, tags)
 * is prepended to every chunk so each embedded span carries its provenance. Sections are packed greedily up
 * to the target size; a section too large on its own is split line by line, and every new chunk is seeded
 * with a tail of the previous chunk.
 */
public class NoteChunker {

    private static final Logger log = LoggerFactory.getLogger(NoteChunker.class);

    private static final Pattern HEADER = Pattern.compile("^(#{1,6})\\s+(.+)$");
    private static final String CONTINUED = " (continued)";

    private final ChunkingOptions options;

    public NoteChunker(ChunkingOptions options) {
        this.options = options;
    }

    public NoteChunker() {
        this(ChunkingOptions.DEFAULTS);
    }

    public ChunkingOptions options() {
        return options;
    }

    /**
     * @param text     raw note content
     * @param filePath vault-relative path, used in the note prefix
     * @param title    resolved title, may be null
     * @return chunks in order with contiguous zero-based indices; empty for blank input
     * @throws NoteParseException when the frontmatter is malformed
     */
    public List<NoteChunk> chunk(String text, String filePath, String title) {
        if (text == null || text.isBlank()) return List.of();

        String[] lines = splitLines(text);
        Frontmatter fm = Frontmatter.parse(lines);
        String prefix = notePrefix(filePath, title, fm);

        List<Section> sections = parseSections(lines, fm.bodyStartLine());
        int budget = Math.max(options.targetChars() - prefix.length(), options.targetChars() / 4);

        Packer packer = new Packer(prefix, budget);
        for (Section s : sections) packer.add(s);
        packer.emit();

        log.debug("Chunked {} into {} chunks ({} sections)", filePath, packer.chunks.size(), sections.size());
        return packer.chunks;
    }

    static String[] splitLines(String text) {
        return text.replace("\r\n", "\n").split("\n", -1);
    }

    static String notePrefix(String filePath, String title, Frontmatter fm) {
        StringBuilder sb = new StringBuilder();
        String fileName = NoteTitles.baseName(filePath);
        if (title != null && !title.isBlank() && !title.equalsIgnoreCase(fileName)) {
            sb.append("[Note: ").append(title).append(" (").append(filePath).append(")]");
        } else {
            sb.append("[Note: ").append(filePath).append("]");
        }
        fm.date().ifPresent(d -> sb.append("\nDate: ").append(d));
        fm.tags().ifPresent(t -> sb.append("\nTags: ").append(t));
        sb.append("\n\n");
        return sb.toString();
    }

    static List<Section> parseSections(String[] lines, int bodyStart) {
        List<Section> out = new ArrayList<>();
        Section current = null;
        for (int i = bodyStart; i < lines.length; i++) {
            String line = lines[i];
            if (HEADER.matcher(line).matches()) {
                if (current != null) out.add(current);
                current = new Section(line.trim(), i);
            } else if (current == null) {
                current = new Section(null, i);
            }
            current.add(line, i);
        }
        if (current != null) out.add(current);
        return out;
    }

    /** Tail of {@code content}, snapped to a paragraph, then a sentence, then a raw character boundary. */
    String overlapTail(String content) {
        int overlap = options.overlapChars();
        if (overlap == 0 || content == null || content.isBlank()) return "";
        int len = content.length();
        if (len <= overlap) return content.trim();

        String window = content.substring(Math.max(0, len - (overlap + 100)));
        int para = window.lastIndexOf("\n\n");
        if (para >= 0) {
            String tail = window.substring(para + 2).trim();
            if (!tail.isEmpty()) return tail;
        }

        window = content.substring(Math.max(0, len - (overlap + 50)));
        int sentence = window.lastIndexOf(". ");
        if (sentence >= 0) {
            String tail = window.substring(sentence + 2).trim();
            if (!tail.isEmpty()) return tail;
        }

        return content.substring(len - overlap).trim();
    }

    static final class Section {
        final String header;
        final int startLine;
        int endLine;
        final List<String> lines = new ArrayList<>();

        Section(String header, int startLine) {
            this.header = header;
            this.startLine = startLine;
            this.endLine = startLine;
        }

        void add(String line, int lineNo) {
            lines.add(line);
            endLine = lineNo;
        }

        String text() {
            return String.join("\n", lines);
        }
    }

    private final class Packer {
        private final String prefix;
        private final int budget;
        private final List<NoteChunk> chunks = new ArrayList<>();

        private final StringBuilder current = new StringBuilder();
        private int start = -1;
        private int end = -1;
        private String lastEmitted = "";

        Packer(String prefix, int budget) {
            this.prefix = prefix;
            this.budget = budget;
        }

        void add(Section s) {
            String text = s.text();
            if (text.isBlank()) {
                cover(s.startLine, s.endLine);
                return;
            }

            int sep = current.length() == 0 ? 0 : 1;
            if (current.length() + sep + text.length() <= budget) {
                append(text);
                cover(s.startLine, s.endLine);
                return;
            }

            if (text.length() > budget) {
                emit();
                splitOversized(s);
                return;
            }

            emit();
            String tail = overlapTail(lastEmitted);
            if (!tail.isEmpty() && tail.length() + 1 + text.length() <= budget) {
                append(tail);
            }
            append(text);
            cover(s.startLine, s.endLine);
        }

        private void splitOversized(Section s) {
            boolean hasContent = false;
            for (int i = 0; i < s.lines.size(); i++) {
                String line = s.lines.get(i);
                int lineNo = s.startLine + i;
                int sep = current.length() == 0 ? 0 : 1;

                if (hasContent && current.length() + sep + line.length() > budget) {
                    emit();
                    seedContinuation(s.header, line);
                    hasContent = false;
                }
                append(line);
                cover(lineNo, lineNo);
                hasContent = true;
            }
            // the last piece stays open so following sections can pack onto it
        }

        private void seedContinuation(String header, String nextLine) {
            String marker = header == null ? null : header + CONTINUED;
            String tail = overlapTail(lastEmitted);

            String seed;
            if (marker != null && !tail.isEmpty()) seed = marker + "\n" + tail;
            else if (marker != null) seed = marker;
            else seed = tail;

            if (!seed.isEmpty() && seed.length() + 1 + nextLine.length() > budget && marker != null) {
                seed = marker;
            }
            if (!seed.isEmpty() && seed.length() + 1 + nextLine.length() > budget) {
                seed = "";
            }
            if (!seed.isEmpty()) append(seed);
        }

        private void append(String text) {
            if (current.length() > 0) current.append('\n');
            current.append(text);
        }

        private void cover(int from, int to) {
            if (start < 0) start = from;
            end = Math.max(end, to);
        }

        void emit() {
            String content = current.toString().trim();
            if (!content.isEmpty()) {
                chunks.add(new NoteChunk(chunks.size(), prefix + content, start, end));
                lastEmitted = content;
            }
            current.setLength(0);
            start = -1;
            end = -1;
        }
    }
}
