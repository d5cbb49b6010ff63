package br.edu.ifba.mindgraph.resolve;

import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.utils.Futures;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.Normalizer;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.regex.Pattern;

/**
 * Open, append-only vocabulary of relationship types.
 *
 * <p>Terms are lower snake_case. Raw types from text understanding are normalized
 * and then matched against the terms, falling back to the synonym table. Terms can
 * be appended at runtime and are never removed; appended terms are stored in the
 * graph store so they survive a restart.</p>
 */
@ApplicationScoped
public class RelationshipVocabulary {

    private static final Logger logger = LoggerFactory.getLogger(RelationshipVocabulary.class);

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");
    private static final Pattern VALID_TERM = Pattern.compile("[a-z][a-z0-9_]{0,63}");

    private final Set<String> terms = new ConcurrentSkipListSet<>();
    private final Map<String, String> synonyms;
    private final boolean extensible;
    @Nullable
    private final GraphStore store;

    /**
     * Default constructor for CDI proxy.
     */
    public RelationshipVocabulary() {
        this.synonyms = Map.of();
        this.extensible = false;
        this.store = null;
    }

    @Inject
    public RelationshipVocabulary(VocabularyConfig config, GraphStore store) {
        this(config.seed(), config.synonyms(), config.extensible(), store);
    }

    /**
     * Vocabulary that keeps runtime additions in memory only.
     */
    public RelationshipVocabulary(@NotNull Collection<String> seed, @NotNull Map<String, String> synonyms,
                                  boolean extensible) {
        this(seed, synonyms, extensible, null);
    }

    /**
     * Vocabulary whose runtime additions are stored in {@code store} and reloaded
     * from it on construction.
     */
    public RelationshipVocabulary(@NotNull Collection<String> seed, @NotNull Map<String, String> synonyms,
                                  boolean extensible, @Nullable GraphStore store) {
        this.store = store;
        for (String term : seed) {
            String normalized = normalizeTerm(term);
            if (VALID_TERM.matcher(normalized).matches()) {
                terms.add(normalized);
            } else {
                logger.warn("Ignoring invalid seed relationship type '{}'", term);
            }
        }
        Map<String, String> normalizedSynonyms = new HashMap<>();
        synonyms.forEach((synonym, term) -> {
            String target = normalizeTerm(term);
            if (terms.contains(target)) {
                normalizedSynonyms.put(normalizeTerm(synonym), target);
            } else {
                logger.warn("Synonym '{}' points at unknown relationship type '{}'", synonym, term);
            }
        });
        this.synonyms = Map.copyOf(normalizedSynonyms);
        this.extensible = extensible;
        if (store != null) {
            loadStoredTerms(store);
        }
        logger.info("Relationship vocabulary seeded with {} terms and {} synonyms", terms.size(), this.synonyms.size());
    }

    /**
     * Lower snake_case form of a raw type: "Lives In" and "lives-in" both become "lives_in".
     */
    @NotNull
    public static String normalizeTerm(@Nullable String raw) {
        if (raw == null) {
            return "";
        }
        String value = Normalizer.normalize(raw, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT).trim();
        value = NON_WORD.matcher(value).replaceAll("_");
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * Maps a raw type onto a vocabulary term.
     *
     * @return the term, or empty when the type is outside the vocabulary
     */
    @NotNull
    public Optional<String> resolve(@Nullable String rawType) {
        String normalized = normalizeTerm(rawType);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        if (terms.contains(normalized)) {
            return Optional.of(normalized);
        }
        return Optional.ofNullable(synonyms.get(normalized));
    }

    public boolean contains(@Nullable String term) {
        return term != null && terms.contains(term);
    }

    /**
     * Appends a term.
     *
     * @return true when the term is new, false when it already existed
     * @throws IllegalArgumentException when the term is not a valid snake_case identifier
     * @throws IllegalStateException when runtime extension is disabled
     */
    public boolean add(@NotNull String rawTerm) {
        String term = normalizeTerm(rawTerm);
        if (!VALID_TERM.matcher(term).matches()) {
            throw new IllegalArgumentException("Invalid relationship type: '" + rawTerm + "'");
        }
        if (terms.contains(term)) {
            return false;
        }
        if (!extensible) {
            throw new IllegalStateException("Relationship vocabulary is not extensible");
        }
        if (store != null) {
            Futures.await(store.addRelationshipType(term));
        }
        boolean added = terms.add(term);
        if (added) {
            logger.info("Added relationship type '{}'", term);
        }
        return added;
    }

    private void loadStoredTerms(GraphStore source) {
        int loaded = 0;
        for (String term : Futures.await(source.listRelationshipTypes())) {
            if (!VALID_TERM.matcher(term).matches()) {
                logger.warn("Ignoring invalid stored relationship type '{}'", term);
            } else if (terms.add(term)) {
                loaded++;
            }
        }
        logger.debug("Loaded {} stored relationship types", loaded);
    }

    /**
     * Current terms in alphabetical order.
     */
    @NotNull
    public List<String> terms() {
        return List.copyOf(terms);
    }

    @NotNull
    public Map<String, String> synonyms() {
        return synonyms;
    }

    public boolean isExtensible() {
        return extensible;
    }
}
