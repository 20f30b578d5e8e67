package im.arun.pdf2md.layout;

import im.arun.pdf2md.config.ConverterConfig;
import im.arun.pdf2md.model.ClassifiedText;
import im.arun.pdf2md.model.TextSpan;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides whether a text span is a level-1 heading, a level-2 heading or a paragraph.
 * <p>
 * PDFs carry no semantic heading tags, so this is a casing heuristic and will misjudge unusual
 * typography. Rules are tried in order and the first match wins:
 * <ol>
 *   <li>short (at most {@code shortTextThreshold} characters) and all uppercase: level 1</li>
 *   <li>at most {@code mediumTextThreshold} characters and most words capitalized: level 2</li>
 *   <li>anything else: paragraph</li>
 * </ol>
 * Casing is read from the first line only; lengths count the whole span.
 */
public class LayoutClassifier {

    public static final int PARAGRAPH = 0;

    private final List<Rule> rules;

    public LayoutClassifier(int shortTextThreshold, int mediumTextThreshold) {
        this.rules = List.of(
                new Rule(1, text -> text.length() <= shortTextThreshold && isUppercase(firstLine(text))),
                new Rule(2, text -> text.length() <= mediumTextThreshold && isTitleCase(firstLine(text))));
    }

    public LayoutClassifier(ConverterConfig config) {
        this(config.getShortTextThreshold(), config.getMediumTextThreshold());
    }

    /**
     * Classify a span, dropping it when it holds no visible text.
     */
    public Optional<ClassifiedText> classify(TextSpan span) {
        String content = span.getContent() == null ? "" : span.getContent().strip();
        if (content.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ClassifiedText(span, headingLevel(content)));
    }

    /**
     * @param content non-blank text
     * @return 1 or 2 for headings, {@link #PARAGRAPH} otherwise
     */
    public int headingLevel(String content) {
        String text = content.strip();
        for (Rule rule : rules) {
            if (rule.matches.test(text)) {
                return rule.level;
            }
        }
        return PARAGRAPH;
    }

    static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline).strip();
    }

    /**
     * True when the text has at least one uppercase letter and no lowercase ones.
     * Digits and punctuation are ignored.
     */
    static boolean isUppercase(String text) {
        boolean sawUpper = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLowerCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                sawUpper = true;
            }
        }
        return sawUpper;
    }

    /**
     * True when more than half of the words containing a letter start that letter in uppercase.
     */
    static boolean isTitleCase(String text) {
        int words = 0;
        int capitalized = 0;
        for (String word : text.split("\\s+")) {
            for (int i = 0; i < word.length(); i++) {
                char c = word.charAt(i);
                if (Character.isLetter(c)) {
                    words++;
                    if (Character.isUpperCase(c)) {
                        capitalized++;
                    }
                    break;
                }
            }
        }
        return words > 0 && capitalized * 2 > words;
    }

    private static final class Rule {
        final int level;
        final Predicate<String> matches;

        Rule(int level, Predicate<String> matches) {
            this.level = level;
            this.matches = matches;
        }
    }
}
