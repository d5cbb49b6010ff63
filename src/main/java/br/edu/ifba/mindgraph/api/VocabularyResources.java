package br.edu.ifba.mindgraph.api;

import br.edu.ifba.mindgraph.resolve.RelationshipVocabulary;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

/**
 * Relationship vocabulary. Terms can be appended, never removed.
 */
@Path("/api/v1/vocabulary")
public class VocabularyResources {

    private static final Logger LOG = Logger.getLogger(VocabularyResources.class);

    @Inject
    RelationshipVocabulary vocabulary;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public VocabularyResponse get() {
        return snapshot();
    }

    /**
     * Appends a term. 201 when the term is new, 200 when it already existed.
     */
    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response add(@Valid @NotNull final VocabularyRequest request) {
        final boolean added = vocabulary.add(request.term());
        if (added) {
            LOG.infof("Relationship type '%s' added through the API", RelationshipVocabulary.normalizeTerm(request.term()));
        }
        return Response.status(added ? Response.Status.CREATED : Response.Status.OK)
            .entity(snapshot())
            .build();
    }

    private VocabularyResponse snapshot() {
        return new VocabularyResponse(vocabulary.terms(), vocabulary.synonyms(), vocabulary.isExtensible());
    }
}
