package br.edu.ifba.mindgraph.extraction;

/**
 * Kind of conversation a turn belongs to.
 */
public enum ConversationType {
    CHAT,
    JOURNAL
}
