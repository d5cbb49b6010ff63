package br.edu.ifba.mindgraph.resolve;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;
import java.util.Map;

/**
 * Relationship vocabulary seed, read from {@code mindgraph.vocabulary.*}.
 */
@ConfigMapping(prefix = "mindgraph.vocabulary")
public interface VocabularyConfig {

    /**
     * Initial relationship types.
     */
    @WithDefault("experienced,feels,causes,triggers,helps,worsens,enjoys,dislikes,does,visits,"
        + "lives_in,works_at,related_to,knows,family_of,friend_of,partner_of,interested_in,associated_with")
    List<String> seed();

    /**
     * Synonym to vocabulary term. Example: {@code mindgraph.vocabulary.synonyms.likes=enjoys}
     */
    Map<String, String> synonyms();

    /**
     * Whether {@code POST /api/v1/vocabulary} may append terms at runtime.
     */
    @WithDefault("true")
    boolean extensible();
}
