package br.edu.ifba.mindgraph.export;

import br.edu.ifba.mindgraph.core.KnowledgeNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

final class ExportSupport {

    private ExportSupport() {
    }

    static Map<String, String> namesById(List<KnowledgeNode> nodes) {
        Map<String, String> names = new HashMap<>();
        for (KnowledgeNode node : nodes) {
            names.put(node.getId(), node.getEntityName());
        }
        return names;
    }
}
