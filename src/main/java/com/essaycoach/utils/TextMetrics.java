package com.essaycoach.utils;

import com.essaycoach.models.GrammarIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic text analysis for essays. Every method is a pure function of its input.
 */
public final class TextMetrics {
    private static final Logger logger = LoggerFactory.getLogger(TextMetrics.class);

    /** Upper bound on findings returned by {@link #detectPatternIssues(String)}. */
    public static final int MAX_FINDINGS = 10;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['’-][\\p{L}\\p{N}]+)*");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");

    private static final Pattern REPEATED_WORD = Pattern.compile(
        "\\b([\\p{L}']+)\\s+\\1\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern THIRD_PERSON_MISMATCH = Pattern.compile(
        "\\b(he|she|it)\\s+(don't|have|are|were|am|go|do)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRST_PERSON_MISMATCH = Pattern.compile(
        "\\b(I)\\s+(is|are|has|goes|does|doesn't)\\b");
    private static final Pattern PLURAL_MISMATCH = Pattern.compile(
        "\\b(you|we|they)\\s+(is|was|am|has|goes|does|doesn't|wasn't)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern A_BEFORE_VOWEL = Pattern.compile(
        "\\b(a)\\s+([aeiou][\\p{L}]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern AN_BEFORE_CONSONANT = Pattern.compile(
        "\\b(an)\\s+([bcdfgjklmnpqrstvwxyz][\\p{L}]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LOWERCASE_AFTER_STOP = Pattern.compile("[.!?]\\s+([a-z][\\p{L}]*)");
    private static final Pattern LOWERCASE_PRONOUN = Pattern.compile("\\bi\\b(?!\\.)");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("[ \\t]+[,.!?;:]");
    private static final Pattern SUBORDINATE_OPENING = Pattern.compile(
        "^(because|although|though|since|unless|whereas)\\b", Pattern.CASE_INSENSITIVE);

    // words after which a bare or plural verb form is grammatical ("did he go", "if it were")
    private static final Set<String> BARE_VERB_CONTEXT = Set.of(
        "did", "does", "do", "will", "would", "can", "could", "should", "must", "may", "might",
        "to", "shall", "let", "make", "made", "not", "didn't", "doesn't", "won't", "can't",
        "if", "wish", "as", "though");

    // "a university", "a one-off", "an hour" style exceptions
    private static final List<String> VOWEL_LETTER_CONSONANT_SOUND = List.of("uni", "use", "usu", "one", "once", "eu", "ur");

    private static final Set<String> ABBREVIATIONS = Set.of("e.g", "i.e", "etc", "mr", "mrs", "ms", "dr");

    private static final Set<String> BASIC_WORDS = Set.of(
        "i", "you", "he", "she", "it", "we", "they", "me", "him", "her", "us", "them", "my", "your",
        "his", "its", "our", "their", "is", "am", "are", "was", "were", "be", "been", "have", "has",
        "had", "do", "does", "did", "a", "an", "the", "and", "but", "or", "in", "on", "at", "to",
        "for", "of", "with", "by", "this", "that", "very", "like", "so", "not", "go", "get", "good");

    private TextMetrics() {
    }

    /**
     * Words in the text, in order. A word is a run of letters or digits, optionally joined by
     * an apostrophe or hyphen ("don't", "well-known").
     */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    public static int wordCount(String text) {
        return words(text).size();
    }

    /**
     * Sentences are the stretches between terminal punctuation that contain at least one word.
     * A trailing sentence without a full stop still counts.
     */
    public static int sentenceCount(String text) {
        return sentences(text).size();
    }

    /**
     * Unique word forms (case-insensitive) over total words; 0 for text without words.
     */
    public static double lexicalDiversity(String text) {
        List<String> words = words(text);
        if (words.isEmpty()) {
            return 0.0;
        }
        Set<String> unique = new HashSet<>();
        for (String word : words) {
            unique.add(word.toLowerCase(Locale.ROOT));
        }
        return (double) unique.size() / words.size();
    }

    /**
     * Share of unique word forms that are not on the basic-word list; 0 for empty text.
     */
    public static double advancedWordRatio(String text) {
        Set<String> unique = new HashSet<>();
        for (String word : words(text)) {
            unique.add(word.toLowerCase(Locale.ROOT));
        }
        if (unique.isEmpty()) {
            return 0.0;
        }
        long advanced = unique.stream().filter(word -> !BASIC_WORDS.contains(word)).count();
        return (double) advanced / unique.size();
    }

    /**
     * Rule-based scan for common learner errors. Best effort: it never throws, and at most
     * {@link #MAX_FINDINGS} findings are returned, ordered by offset.
     */
    public static List<GrammarIssue> detectPatternIssues(String text) {
        return scanPatterns(text).findings();
    }

    /**
     * Number of pattern findings in the text before the list is capped.
     */
    public static int countPatternIssues(String text) {
        return scanPatterns(text).total();
    }

    /**
     * Runs the pattern scan once, returning the capped findings together with the uncapped total.
     */
    public static PatternScan scanPatterns(String text) {
        if (text == null || text.isBlank()) {
            return new PatternScan(List.of(), 0);
        }
        List<GrammarIssue> findings = new ArrayList<>();
        try {
            findRepeatedWords(text, findings);
            findAgreement(text, THIRD_PERSON_MISMATCH, "third-person singular subject", findings);
            findAgreement(text, FIRST_PERSON_MISMATCH, "subject 'I'", findings);
            findAgreement(text, PLURAL_MISMATCH, "plural subject", findings);
            findArticles(text, findings);
            findLowercaseSentenceStarts(text, findings);
            findLowercasePronoun(text, findings);
            findSpaceBeforePunctuation(text, findings);
            findFragments(text, findings);
        } catch (RuntimeException e) {
            logger.warn("Pattern scan stopped early after {} findings: {}", findings.size(), e.getMessage());
        }
        findings.sort(Comparator.comparingInt(GrammarIssue::offset));
        int total = findings.size();
        if (total > MAX_FINDINGS) {
            logger.debug("Listing {} of {} pattern findings", MAX_FINDINGS, total);
            return new PatternScan(List.copyOf(findings.subList(0, MAX_FINDINGS)), total);
        }
        return new PatternScan(List.copyOf(findings), total);
    }

    /**
     * Listed findings (capped) and the total number found.
     */
    public record PatternScan(List<GrammarIssue> findings, int total) {
    }

    private static void findRepeatedWords(String text, List<GrammarIssue> findings) {
        Matcher matcher = REPEATED_WORD.matcher(text);
        while (matcher.find()) {
            String word = matcher.group(1);
            if (word.equalsIgnoreCase("had") || word.equalsIgnoreCase("that")) {
                continue;
            }
            findings.add(issue(matcher, "Repeated word '" + word + "'"));
        }
    }

    private static void findAgreement(String text, Pattern pattern, String subjectKind, List<GrammarIssue> findings) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String previous = previousWord(text, matcher.start());
            if (previous != null && BARE_VERB_CONTEXT.contains(previous.toLowerCase(Locale.ROOT))) {
                continue;
            }
            findings.add(issue(matcher, String.format(
                "Subject-verb agreement: '%s' does not agree with the %s", matcher.group(2), subjectKind)));
        }
    }

    private static void findArticles(String text, List<GrammarIssue> findings) {
        Matcher vowel = A_BEFORE_VOWEL.matcher(text);
        while (vowel.find()) {
            String next = vowel.group(2).toLowerCase(Locale.ROOT);
            if (VOWEL_LETTER_CONSONANT_SOUND.stream().anyMatch(next::startsWith)) {
                continue;
            }
            findings.add(issue(vowel, "Use 'an' before a vowel sound: '" + vowel.group(2) + "'"));
        }
        Matcher consonant = AN_BEFORE_CONSONANT.matcher(text);
        while (consonant.find()) {
            findings.add(issue(consonant, "Use 'a' before a consonant sound: '" + consonant.group(2) + "'"));
        }
    }

    private static void findLowercaseSentenceStarts(String text, List<GrammarIssue> findings) {
        int first = firstLetterIndex(text);
        if (first >= 0 && Character.isLowerCase(text.charAt(first)) && !startsWithPronounI(text, first)) {
            int end = first;
            while (end < text.length() && Character.isLetter(text.charAt(end))) end++;
            findings.add(new GrammarIssue(first, end - first,
                "Sentence should start with a capital letter", text.substring(first, end)));
        }
        Matcher matcher = LOWERCASE_AFTER_STOP.matcher(text);
        while (matcher.find()) {
            String before = previousWord(text, matcher.start() + 1);
            if (before != null && ABBREVIATIONS.contains(before.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (matcher.group(1).equals("i")) {
                // reported by the pronoun rule
                continue;
            }
            findings.add(new GrammarIssue(matcher.start(1), matcher.group(1).length(),
                "Sentence should start with a capital letter", matcher.group(1)));
        }
    }

    private static void findLowercasePronoun(String text, List<GrammarIssue> findings) {
        Matcher matcher = LOWERCASE_PRONOUN.matcher(text);
        while (matcher.find()) {
            findings.add(issue(matcher, "Capitalize the pronoun 'I'"));
        }
    }

    private static void findSpaceBeforePunctuation(String text, List<GrammarIssue> findings) {
        Matcher matcher = SPACE_BEFORE_PUNCTUATION.matcher(text);
        while (matcher.find()) {
            findings.add(issue(matcher, "Remove the space before punctuation"));
        }
    }

    private static void findFragments(String text, List<GrammarIssue> findings) {
        for (int[] span : sentenceSpans(text)) {
            String sentence = text.substring(span[0], span[1]);
            if (SUBORDINATE_OPENING.matcher(sentence).find() && !sentence.contains(",")) {
                findings.add(new GrammarIssue(span[0], span[1] - span[0],
                    "Possible sentence fragment: subordinate clause without a main clause",
                    abbreviate(sentence)));
            }
        }
    }

    private static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> sentences = new ArrayList<>();
        for (int[] span : sentenceSpans(text)) {
            sentences.add(text.substring(span[0], span[1]));
        }
        return sentences;
    }

    /**
     * Trimmed [start, end) spans of the sentences that contain a word.
     */
    private static List<int[]> sentenceSpans(String text) {
        List<int[]> spans = new ArrayList<>();
        Matcher ends = SENTENCE_END.matcher(text);
        int start = 0;
        while (ends.find()) {
            addSpan(text, start, ends.start(), spans);
            start = ends.end();
        }
        addSpan(text, start, text.length(), spans);
        return spans;
    }

    private static void addSpan(String text, int start, int end, List<int[]> spans) {
        while (start < end && Character.isWhitespace(text.charAt(start))) start++;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
        if (start < end && WORD.matcher(text.substring(start, end)).find()) {
            spans.add(new int[]{start, end});
        }
    }

    private static String previousWord(String text, int index) {
        int end = index;
        while (end > 0 && !Character.isLetterOrDigit(text.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && (Character.isLetterOrDigit(text.charAt(start - 1))
                || text.charAt(start - 1) == '\'' || text.charAt(start - 1) == '.')) {
            start--;
        }
        return start == end ? null : text.substring(start, end);
    }

    private static int firstLetterIndex(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isLetter(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean startsWithPronounI(String text, int index) {
        return text.charAt(index) == 'i'
                && (index + 1 == text.length() || !Character.isLetter(text.charAt(index + 1)));
    }

    private static GrammarIssue issue(Matcher matcher, String description) {
        return new GrammarIssue(matcher.start(), matcher.end() - matcher.start(), description, matcher.group());
    }

    private static String abbreviate(String sentence) {
        return sentence.length() <= 60 ? sentence : sentence.substring(0, 57) + "...";
    }
}
