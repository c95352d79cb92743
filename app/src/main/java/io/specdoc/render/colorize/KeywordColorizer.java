package io.specdoc.render.colorize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lightweight lexical colorizer: keywords, string and character literals, and comments.
 */
public class KeywordColorizer implements Colorizer {

    static final int KEYWORD_COLOR = 0x0000FF;
    static final int STRING_COLOR = 0xA31515;
    static final int COMMENT_COLOR = 0x008000;

    private static final Set<String> CSHARP_KEYWORDS = Set.of(
            "abstract", "as", "base", "bool", "break", "byte", "case", "catch", "char", "checked", "class", "const",
            "continue", "decimal", "default", "delegate", "do", "double", "else", "enum", "event", "explicit",
            "extern", "false", "finally", "fixed", "float", "for", "foreach", "goto", "if", "implicit", "in", "int",
            "interface", "internal", "is", "lock", "long", "namespace", "new", "null", "object", "operator", "out",
            "override", "params", "private", "protected", "public", "readonly", "ref", "return", "sbyte", "sealed",
            "short", "sizeof", "stackalloc", "static", "string", "struct", "switch", "this", "throw", "true", "try",
            "typeof", "uint", "ulong", "unchecked", "unsafe", "ushort", "using", "virtual", "void", "volatile",
            "while", "async", "await", "var", "dynamic", "get", "set", "init", "record", "yield", "where", "nameof");

    private static final Set<String> VB_KEYWORDS = Set.of(
            "addhandler", "and", "andalso", "as", "boolean", "byref", "byte", "byval", "call", "case", "catch",
            "class", "const", "dim", "do", "double", "each", "else", "elseif", "end", "enum", "exit", "false",
            "finally", "for", "friend", "function", "get", "handles", "if", "implements", "imports", "in",
            "inherits", "integer", "interface", "is", "let", "loop", "me", "module", "mustinherit", "mybase",
            "namespace", "new", "next", "not", "nothing", "of", "or", "orelse", "overridable", "overrides",
            "private", "property", "protected", "public", "readonly", "return", "select", "set", "shared",
            "single", "static", "string", "structure", "sub", "then", "throw", "to", "true", "try", "while",
            "with");

    private final Set<String> keywords;
    private final boolean caseInsensitive;
    private final String lineComment;
    private final boolean blockComments;

    KeywordColorizer(Set<String> keywords, boolean caseInsensitive, String lineComment, boolean blockComments) {
        this.keywords = keywords;
        this.caseInsensitive = caseInsensitive;
        this.lineComment = lineComment;
        this.blockComments = blockComments;
    }

    public static KeywordColorizer csharp() {
        return new KeywordColorizer(CSHARP_KEYWORDS, false, "//", true);
    }

    public static KeywordColorizer visualBasic() {
        return new KeywordColorizer(VB_KEYWORDS, true, "'", false);
    }

    @Override
    public List<ColorizedLine> colorize(String code) {
        List<ColorizedLine> lines = new ArrayList<>();
        boolean inBlockComment = false;
        for (String line : PlainTextColorizer.splitLines(code)) {
            List<ColorizedWord> words = new ArrayList<>();
            int index = 0;
            while (index < line.length()) {
                if (inBlockComment) {
                    int end = line.indexOf("*/", index);
                    int stop = end < 0 ? line.length() : end + 2;
                    words.add(new ColorizedWord(line.substring(index, stop), COMMENT_COLOR, false));
                    inBlockComment = end < 0;
                    index = stop;
                    continue;
                }
                char ch = line.charAt(index);
                if (line.startsWith(lineComment, index)) {
                    words.add(new ColorizedWord(line.substring(index), COMMENT_COLOR, false));
                    index = line.length();
                } else if (blockComments && line.startsWith("/*", index)) {
                    int end = line.indexOf("*/", index + 2);
                    int stop = end < 0 ? line.length() : end + 2;
                    words.add(new ColorizedWord(line.substring(index, stop), COMMENT_COLOR, false));
                    inBlockComment = end < 0;
                    index = stop;
                } else if (ch == '"' || (ch == '\'' && !"'".equals(lineComment))) {
                    int end = endOfQuoted(line, index, ch);
                    words.add(new ColorizedWord(line.substring(index, end), STRING_COLOR, false));
                    index = end;
                } else if (Character.isJavaIdentifierStart(ch)) {
                    int end = index + 1;
                    while (end < line.length() && Character.isJavaIdentifierPart(line.charAt(end))) {
                        end++;
                    }
                    String word = line.substring(index, end);
                    words.add(isKeyword(word) ? new ColorizedWord(word, KEYWORD_COLOR, false) : ColorizedWord.plain(word));
                    index = end;
                } else {
                    int end = index + 1;
                    while (end < line.length() && isPunctuationOrSpace(line, end)) {
                        end++;
                    }
                    words.add(ColorizedWord.plain(line.substring(index, end)));
                    index = end;
                }
            }
            lines.add(new ColorizedLine(words));
        }
        return lines;
    }

    private boolean isPunctuationOrSpace(String line, int index) {
        char ch = line.charAt(index);
        return !Character.isJavaIdentifierStart(ch)
                && ch != '"'
                && ch != '\''
                && !line.startsWith(lineComment, index)
                && !(blockComments && line.startsWith("/*", index));
    }

    private boolean isKeyword(String word) {
        return keywords.contains(caseInsensitive ? word.toLowerCase(Locale.ROOT) : word);
    }

    private static int endOfQuoted(String line, int start, char quote) {
        int index = start + 1;
        while (index < line.length()) {
            char ch = line.charAt(index);
            if (ch == '\\' && index + 1 < line.length()) {
                index += 2;
                continue;
            }
            index++;
            if (ch == quote) {
                return index;
            }
        }
        return line.length();
    }
}
