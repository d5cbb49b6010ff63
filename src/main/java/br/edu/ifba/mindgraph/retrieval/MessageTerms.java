package br.edu.ifba.mindgraph.retrieval;

import br.edu.ifba.mindgraph.resolve.NameCanonicalizer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokens of a message and the canonical names its 1 to 3 word n-grams map to.
 *
 * @param tokens lower-case word tokens in message order
 * @param mentionedNames canonical names (aliases applied) of every n-gram
 */
public record MessageTerms(@NotNull List<String> tokens, @NotNull Set<String> mentionedNames) {

    static final int MAX_NGRAM = 3;

    private static final Pattern POSSESSIVE = Pattern.compile("['’]s\\b");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern JOINED_WORD = Pattern.compile("[\\p{L}\\p{N}]+(?:['’‐-][\\p{L}\\p{N}]+)*");

    public MessageTerms {
        tokens = List.copyOf(tokens);
        mentionedNames = Set.copyOf(mentionedNames);
    }

    /**
     * N-grams are taken over both the split tokens and the words with inner
     * apostrophes and hyphens kept, so "O'Brien" and "mother-in-law" match the
     * canonical names the resolver stores for them.
     */
    @NotNull
    public static MessageTerms of(@Nullable String message, @NotNull NameCanonicalizer canonicalizer) {
        List<String> tokens = tokenize(message);
        Set<String> names = new LinkedHashSet<>();
        addNgrams(tokens, canonicalizer, names);
        List<String> words = joinedWords(message);
        if (!words.equals(tokens)) {
            addNgrams(words, canonicalizer, names);
        }
        return new MessageTerms(tokens, names);
    }

    private static void addNgrams(List<String> words, NameCanonicalizer canonicalizer, Set<String> names) {
        for (int n = 1; n <= MAX_NGRAM; n++) {
            for (int i = 0; i + n <= words.size(); i++) {
                String canonical = canonicalizer.canonicalize(String.join(" ", words.subList(i, i + n)));
                if (!canonical.isEmpty()) {
                    names.add(canonical);
                }
            }
        }
    }

    static List<String> joinedWords(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        normalized = POSSESSIVE.matcher(normalized).replaceAll("");
        List<String> words = new ArrayList<>();
        Matcher matcher = JOINED_WORD.matcher(normalized);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    @NotNull
    public static List<String> tokenize(@Nullable String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        normalized = POSSESSIVE.matcher(normalized).replaceAll("");
        List<String> tokens = new ArrayList<>();
        for (String token : NON_WORD.split(normalized)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }
}
