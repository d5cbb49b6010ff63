package br.edu.ifba.mindgraph.resolve;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.text.Normalizer;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Produces the comparison key for entity names.
 *
 * <p>Steps, in order: NFKC normalization, lower-casing (ROOT locale), trimming of
 * surrounding punctuation and quotes, whitespace collapsing, removal of one leading
 * article or possessive determiner, removal of a trailing possessive {@code 's},
 * and finally alias lookup.</p>
 *
 * <pre>
 * "  Sarah "       -> "sarah"
 * "my Mom"         -> "mother"   (with alias mom=mother)
 * "the gym's"      -> "gym"
 * </pre>
 */
@ApplicationScoped
public class NameCanonicalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}\\p{Pi}\\p{Pf}\\s]+|[\\p{Punct}\\p{Pi}\\p{Pf}\\s]+$");
    private static final Pattern TRAILING_POSSESSIVE = Pattern.compile("['’]s$");
    private static final Set<String> LEADING_DETERMINERS = Set.of(
        "the", "a", "an", "my", "our", "his", "her", "their", "your"
    );

    private final Map<String, String> aliases;

    /**
     * Default constructor for CDI proxy.
     */
    public NameCanonicalizer() {
        this.aliases = Map.of();
    }

    @Inject
    public NameCanonicalizer(ResolutionConfig config) {
        this(config.aliases());
    }

    public NameCanonicalizer(@NotNull Map<String, String> aliases) {
        Map<String, String> normalized = new HashMap<>();
        aliases.forEach((alias, canonical) -> {
            String from = normalize(alias);
            String to = normalize(canonical);
            if (!from.isEmpty() && !to.isEmpty()) {
                normalized.put(from, to);
            }
        });
        this.aliases = Map.copyOf(normalized);
    }

    /**
     * Canonicalizes a raw surface form.
     *
     * @param raw the mention as written, may be null
     * @return the canonical key; empty when nothing meaningful remains
     */
    @NotNull
    public String canonicalize(@Nullable String raw) {
        String normalized = normalize(raw);
        return aliases.getOrDefault(normalized, normalized);
    }

    /**
     * Canonicalization without alias resolution. Used for alias keys themselves
     * and for matching message n-grams.
     */
    @NotNull
    public static String normalize(@Nullable String raw) {
        if (raw == null) {
            return "";
        }
        String value = Normalizer.normalize(raw, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        value = stripEdges(WHITESPACE.matcher(value).replaceAll(" "));
        if (value.isEmpty()) {
            return value;
        }

        int space = value.indexOf(' ');
        if (space > 0 && LEADING_DETERMINERS.contains(value.substring(0, space))) {
            value = value.substring(space + 1);
        }
        value = stripEdges(TRAILING_POSSESSIVE.matcher(value).replaceFirst(""));
        return value;
    }

    private static String stripEdges(String value) {
        return EDGE_PUNCTUATION.matcher(value).replaceAll("");
    }

    /**
     * Normalized alias to canonical name.
     */
    @NotNull
    public Map<String, String> aliases() {
        return aliases;
    }
}
