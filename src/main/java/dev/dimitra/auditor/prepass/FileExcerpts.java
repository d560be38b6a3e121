package dev.dimitra.auditor.prepass;

import dev.dimitra.auditor.model.FileContent;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reduced views of a file for the snippet and map tiers.
 */
public final class FileExcerpts {

    public static final int SNIPPET_MAX_LINES = 50;
    public static final int MAP_FALLBACK_LINES = 20;
    public static final String MAP_HEADER = "[file map - definitions only]";

    // matched against the trimmed line
    private static final Pattern DEFINITION = Pattern.compile(
            "^(class |def |async def |function |export\\s+(default\\s+)?(class|function|const|let|var)\\s"
                    + "|((public|protected|private|internal|abstract|final|static|sealed|open|data)\\s+)*"
                    + "(class|interface|enum|record|object|fun)\\s"
                    + "|(public|protected|private)\\s+[\\w<>\\[\\],.? ]+\\s+\\w+\\s*\\("
                    + "|func\\s"
                    + "|(pub(\\([\\w:]+\\))?\\s+)?(async\\s+)?(fn|struct|enum|trait|impl)[\\s<])");

    private static final Pattern COMMENT = Pattern.compile("^\\s*(#|//|/\\*|\\*|\"\"\"|''')");

    private FileExcerpts() {}

    /**
     * First and last {@code SNIPPET_MAX_LINES / 2} lines with an omission marker between.
     * Files within the limit are returned unchanged.
     */
    public static FileContent snippet(FileContent file) {
        List<String> lines = lines(file.content());
        if (lines.size() <= SNIPPET_MAX_LINES) return file;

        int half = SNIPPET_MAX_LINES / 2;
        int omitted = lines.size() - SNIPPET_MAX_LINES;
        List<String> out = new ArrayList<>(lines.subList(0, half));
        out.add("... [" + omitted + " lines omitted] ...");
        out.addAll(lines.subList(lines.size() - half, lines.size()));
        return file.withContent(String.join("\n", out));
    }

    /** Definition and comment lines only; the first 20 lines when nothing matches. */
    public static FileContent structuralMap(FileContent file) {
        List<String> lines = lines(file.content());
        List<String> kept = new ArrayList<>();
        for (String line : lines) {
            if (DEFINITION.matcher(line.strip()).find() || COMMENT.matcher(line).find()) {
                kept.add(line);
            }
        }
        if (kept.isEmpty()) {
            kept = lines.subList(0, Math.min(MAP_FALLBACK_LINES, lines.size()));
        }
        return file.withContent(MAP_HEADER + "\n" + String.join("\n", kept));
    }

    private static List<String> lines(String content) {
        if (content == null || content.isEmpty()) return List.of();
        List<String> lines = Arrays.asList(content.split("\\R", -1));
        // a final newline does not start another line
        return lines.get(lines.size() - 1).isEmpty() ? lines.subList(0, lines.size() - 1) : lines;
    }
}
