package br.edu.ifba.mindgraph.retrieval;

import br.edu.ifba.mindgraph.core.KnowledgeNode;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Weighted relevance of a node to the current message.
 *
 * <pre>
 * score    = wL * lexical + wR * recency + wS * salience
 * lexical  = 1.0 when the node is named in the message,
 *            else 0.6 * fraction of the name's tokens found in the message
 * recency  = exp(-ln2 * ageHours / halfLifeHours)
 * salience = 0.5 * confidence + 0.5 * min(1, ln(1 + mentions) / ln(11))
 * </pre>
 *
 * Named nodes are ordered in a tier above every other node.
 */
public class RelevanceScorer {

    static final double PARTIAL_MATCH_WEIGHT = 0.6;
    static final int SATURATING_MENTIONS = 10;
    private static final int MIN_PREFIX = 4;

    /**
     * Explicit mentions first, then score, then most recently mentioned.
     */
    public static final Comparator<ScoredNode> RANKING = Comparator
        .comparing(ScoredNode::explicitMention).reversed()
        .thenComparing(Comparator.comparingDouble(ScoredNode::score).reversed())
        .thenComparing(scored -> scored.node().getLastMentioned(), Comparator.reverseOrder())
        .thenComparing(scored -> scored.node().getId());

    private final double lexicalWeight;
    private final double recencyWeight;
    private final double salienceWeight;
    private final double halfLifeHours;

    public RelevanceScorer(double lexicalWeight, double recencyWeight, double salienceWeight, Duration halfLife) {
        if (halfLife.isZero() || halfLife.isNegative()) {
            throw new IllegalArgumentException("recency half-life must be positive");
        }
        this.lexicalWeight = lexicalWeight;
        this.recencyWeight = recencyWeight;
        this.salienceWeight = salienceWeight;
        this.halfLifeHours = halfLife.toMillis() / 3_600_000.0;
    }

    @NotNull
    public ScoredNode score(@NotNull KnowledgeNode node, @NotNull MessageTerms terms, @NotNull Instant now) {
        boolean explicit = terms.mentionedNames().contains(node.getCanonicalName());
        double lexical = explicit ? 1.0 : PARTIAL_MATCH_WEIGHT * tokenCoverage(node.getCanonicalName(), terms.tokens());
        double recency = recency(node.getLastMentioned(), now);
        double salience = salience(node);
        double score = lexicalWeight * lexical + recencyWeight * recency + salienceWeight * salience;
        return new ScoredNode(node, score, lexical, recency, salience, explicit);
    }

    double recency(Instant lastMentioned, Instant now) {
        double ageHours = Math.max(0L, Duration.between(lastMentioned, now).toMillis()) / 3_600_000.0;
        return Math.exp(-Math.log(2) * ageHours / halfLifeHours);
    }

    static double salience(KnowledgeNode node) {
        double mentions = Math.min(1.0, Math.log1p(node.getMentionCount()) / Math.log1p(SATURATING_MENTIONS));
        return 0.5 * node.getConfidence() + 0.5 * mentions;
    }

    static double tokenCoverage(String canonicalName, List<String> messageTokens) {
        List<String> nameTokens = MessageTerms.tokenize(canonicalName);
        if (nameTokens.isEmpty() || messageTokens.isEmpty()) {
            return 0.0;
        }
        long matched = nameTokens.stream()
            .filter(nameToken -> messageTokens.stream().anyMatch(token -> tokensMatch(nameToken, token)))
            .count();
        return (double) matched / nameTokens.size();
    }

    static boolean tokensMatch(String a, String b) {
        if (a.equals(b) || stem(a).equals(stem(b))) {
            return true;
        }
        return Math.min(a.length(), b.length()) >= MIN_PREFIX && (a.startsWith(b) || b.startsWith(a));
    }

    private static String stem(String token) {
        if (token.length() > 4 && token.endsWith("es")) {
            return token.substring(0, token.length() - 2);
        }
        if (token.length() > 3 && token.endsWith("s")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }
}
