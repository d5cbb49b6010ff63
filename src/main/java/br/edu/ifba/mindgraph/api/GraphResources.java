package br.edu.ifba.mindgraph.api;

import br.edu.ifba.mindgraph.core.EntityType;
import br.edu.ifba.mindgraph.core.KnowledgeEdge;
import br.edu.ifba.mindgraph.core.KnowledgeNode;
import br.edu.ifba.mindgraph.exception.ResourceNotFoundException;
import br.edu.ifba.mindgraph.export.ExportFormat;
import br.edu.ifba.mindgraph.export.GraphExporter;
import br.edu.ifba.mindgraph.export.GraphExporterFactory;
import br.edu.ifba.mindgraph.resolve.RelationshipVocabulary;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.storage.EdgeFilter;
import br.edu.ifba.mindgraph.storage.GraphStats;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.storage.NodeFilter;
import br.edu.ifba.mindgraph.storage.NodeOrder;
import br.edu.ifba.mindgraph.utils.Futures;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.StreamingOutput;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Locale;

/**
 * Read and maintenance endpoints over a profile's graph.
 */
@Path("/api/v1/profiles/{profileId}/graph")
public class GraphResources {

    private static final Logger LOG = Logger.getLogger(GraphResources.class);

    @Inject
    GraphStore graphStore;

    @Inject
    GraphExporterFactory exporterFactory;

    @Inject
    RelationshipVocabulary vocabulary;

    @GET
    @Path("/nodes")
    @Produces(MediaType.APPLICATION_JSON)
    public List<KnowledgeNode> listNodes(@PathParam("profileId") final String profileId,
                                         @QueryParam("type") final String type,
                                         @QueryParam("order") @DefaultValue("recency") final String order,
                                         @QueryParam("limit") @DefaultValue("100") @Min(1) @Max(500) final int limit) {
        ProfileIds.requireValid(profileId);
        NodeFilter filter = NodeFilter.all().withOrder(parseOrder(order)).withLimit(limit);
        if (type != null && !type.isBlank()) {
            filter = filter.withTypes(List.of(parseType(type)));
        }
        return Futures.await(graphStore.listNodes(profileId, filter));
    }

    @GET
    @Path("/nodes/{nodeId}")
    @Produces(MediaType.APPLICATION_JSON)
    public KnowledgeNode getNode(@PathParam("profileId") final String profileId,
                                 @PathParam("nodeId") final String nodeId) {
        ProfileIds.requireValid(profileId);
        return Futures.await(graphStore.getNode(profileId, nodeId))
            .orElseThrow(() -> new ResourceNotFoundException("Node not found: " + nodeId));
    }

    @GET
    @Path("/edges")
    @Produces(MediaType.APPLICATION_JSON)
    public List<KnowledgeEdge> listEdges(@PathParam("profileId") final String profileId,
                                         @QueryParam("type") final String type,
                                         @QueryParam("limit") @DefaultValue("200") @Min(1) @Max(1000) final int limit) {
        ProfileIds.requireValid(profileId);
        EdgeFilter filter = EdgeFilter.all().withLimit(limit);
        if (type != null && !type.isBlank()) {
            String term = vocabulary.resolve(type)
                .orElseThrow(() -> new IllegalArgumentException("Unknown relationship type: '" + type + "'"));
            filter = filter.withRelationshipTypes(List.of(term));
        }
        return Futures.await(graphStore.listEdges(profileId, filter));
    }

    @GET
    @Path("/stats")
    @Produces(MediaType.APPLICATION_JSON)
    public GraphStats stats(@PathParam("profileId") final String profileId) {
        ProfileIds.requireValid(profileId);
        return Futures.await(graphStore.getStats(profileId));
    }

    /**
     * Exports the whole graph as json (default), csv or markdown.
     */
    @GET
    @Path("/export")
    @Produces({MediaType.APPLICATION_JSON, "text/csv", "text/markdown"})
    public Response export(@PathParam("profileId") final String profileId,
                           @QueryParam("format") @DefaultValue("json") final String format) {
        ProfileIds.requireValid(profileId);
        final GraphExporter exporter = exporterFactory.getExporter(ExportFormat.fromString(format));

        final List<KnowledgeNode> nodes = Futures.await(graphStore.listNodes(profileId,
            NodeFilter.all().withLimit(Integer.MAX_VALUE)));
        final List<KnowledgeEdge> edges = Futures.await(graphStore.listEdges(profileId,
            EdgeFilter.all().withLimit(Integer.MAX_VALUE)));
        LOG.infof("Exporting graph of profile %s as %s: %d nodes, %d edges",
            profileId, exporter.getFormat(), Integer.valueOf(nodes.size()), Integer.valueOf(edges.size()));

        final StreamingOutput body = outputStream -> exporter.export(profileId, nodes, edges, outputStream);
        return Response.ok(body)
            .type(exporter.getMimeType())
            .header("Content-Disposition",
                "attachment; filename=\"mindgraph-" + profileId + "." + exporter.getFileExtension() + "\"")
            .build();
    }

    /**
     * Clears every node, edge and extraction log of the profile.
     */
    @DELETE
    public Response clear(@PathParam("profileId") final String profileId) {
        ProfileIds.requireValid(profileId);
        Futures.await(graphStore.deleteProfileGraph(profileId));
        LOG.infof("Cleared graph of profile %s", profileId);
        return Response.noContent().build();
    }

    @DELETE
    @Path("/nodes/{nodeId}")
    public Response deleteNode(@PathParam("profileId") final String profileId,
                               @PathParam("nodeId") final String nodeId) {
        ProfileIds.requireValid(profileId);
        if (!Futures.await(graphStore.deleteNode(profileId, nodeId))) {
            throw new ResourceNotFoundException("Node not found: " + nodeId);
        }
        LOG.debugf("Deleted node %s of profile %s", nodeId, profileId);
        return Response.noContent().build();
    }

    private static EntityType parseType(final String type) {
        return EntityType.fromLabel(type)
            .orElseThrow(() -> new IllegalArgumentException("Unknown entity type: '" + type + "'"));
    }

    private static NodeOrder parseOrder(final String order) {
        try {
            return NodeOrder.valueOf(order.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid order: '" + order + "'. Valid values: recency, salience, name");
        }
    }
}
