package com.prrules.analyzer.diff;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a file path to a language name by its extension.
 */
public final class LanguageDetector {

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("java", "java"),
            Map.entry("cpp", "cpp"),
            Map.entry("c", "c"),
            Map.entry("cs", "c#"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("php", "php"),
            Map.entry("rb", "ruby"),
            Map.entry("swift", "swift"),
            Map.entry("kt", "kotlin"),
            Map.entry("scala", "scala"),
            Map.entry("html", "html"),
            Map.entry("css", "css"),
            Map.entry("scss", "scss"),
            Map.entry("sass", "sass"),
            Map.entry("less", "less"),
            Map.entry("sql", "sql"),
            Map.entry("sh", "shell"),
            Map.entry("bash", "bash"),
            Map.entry("zsh", "zsh"),
            Map.entry("ps1", "powershell"),
            Map.entry("lua", "lua"),
            Map.entry("r", "r"),
            Map.entry("m", "matlab"),
            Map.entry("jl", "julia"),
            Map.entry("dockerfile", "dockerfile"),
            Map.entry("yaml", "yaml"),
            Map.entry("yml", "yaml"),
            Map.entry("json", "json"),
            Map.entry("xml", "xml"),
            Map.entry("md", "markdown"),
            Map.entry("txt", "plaintext")
    );

    private LanguageDetector() {
    }

    /**
     * @return the language for the path's extension, or {@code null} when unknown
     */
    public static String detect(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return null;
        }
        String fileName = filePath.substring(filePath.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        if (fileName.equals("dockerfile")) {
            return "dockerfile";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return null;
        }
        return BY_EXTENSION.get(fileName.substring(dot + 1));
    }
}
