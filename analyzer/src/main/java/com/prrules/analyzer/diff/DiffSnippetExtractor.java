package com.prrules.analyzer.diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives code snippets from the unified-diff hunk attached to a review comment.
 *
 * <p>Only added lines are kept. Each {@code @@ -a,b +c,d @@} header resets the
 * target line counter to {@code c}; every added line takes the current counter
 * value and advances it. Context and removed lines leave the counter alone.
 * Added lines with consecutive target numbers form one snippet. A group whose
 * lines are all blank is dropped.</p>
 */
public class DiffSnippetExtractor {

    private static final Logger logger = LoggerFactory.getLogger(DiffSnippetExtractor.class);

    static final Pattern HUNK_HEADER = Pattern.compile("^@@ -\\d+(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@");

    /**
     * @param diffHunk the {@code diff_hunk} of a review comment, may be {@code null}
     * @param filePath the commented file, used for the snippet path and language
     * @return snippets in diff order, empty when the hunk adds nothing
     */
    public List<SnippetCandidate> extract(String diffHunk, String filePath) {
        if (diffHunk == null || diffHunk.isBlank()) {
            return List.of();
        }

        List<AddedLine> added = collectAddedLines(diffHunk);
        if (added.isEmpty()) {
            return List.of();
        }

        String language = LanguageDetector.detect(filePath);
        List<SnippetCandidate> snippets = new ArrayList<>();

        List<AddedLine> group = new ArrayList<>();
        for (AddedLine line : added) {
            if (!group.isEmpty() && line.number() != group.get(group.size() - 1).number() + 1) {
                addSnippet(snippets, group, filePath, language);
                group = new ArrayList<>();
            }
            group.add(line);
        }
        addSnippet(snippets, group, filePath, language);

        logger.debug("Extracted {} snippets from {} added lines in {}", snippets.size(), added.size(), filePath);
        return snippets;
    }

    private static List<AddedLine> collectAddedLines(String diffHunk) {
        List<AddedLine> added = new ArrayList<>();
        Integer current = null;

        for (String line : diffHunk.split("\\r?\\n")) {
            Matcher header = HUNK_HEADER.matcher(line);
            if (header.find()) {
                current = Integer.parseInt(header.group(1));
                continue;
            }
            if (current == null) {
                continue;
            }
            if (line.startsWith("+") && !line.startsWith("++")) {
                added.add(new AddedLine(current, line.substring(1)));
                current++;
            }
        }
        return added;
    }

    private static void addSnippet(List<SnippetCandidate> snippets, List<AddedLine> group,
                                   String filePath, String language) {
        SnippetCandidate snippet = toSnippet(group, filePath, language);
        if (snippet.content().isBlank()) {
            logger.debug("Skipping blank added lines {}-{} in {}", snippet.lineStart(), snippet.lineEnd(), filePath);
            return;
        }
        snippets.add(snippet);
    }

    private static SnippetCandidate toSnippet(List<AddedLine> group, String filePath, String language) {
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < group.size(); i++) {
            if (i > 0) {
                content.append('\n');
            }
            content.append(group.get(i).text());
        }
        return new SnippetCandidate(filePath,
                group.get(0).number(),
                group.get(group.size() - 1).number(),
                content.toString(),
                language);
    }

    private record AddedLine(int number, String text) {}
}
