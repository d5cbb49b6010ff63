package br.edu.ifba.mindgraph.api;

import br.edu.ifba.mindgraph.core.ExtractionStatus;
import br.edu.ifba.mindgraph.exception.ErrorResponse;
import br.edu.ifba.mindgraph.extraction.ConversationTurn;
import br.edu.ifba.mindgraph.extraction.ExtractionResult;
import br.edu.ifba.mindgraph.extraction.ExtractionScheduler;
import br.edu.ifba.mindgraph.retrieval.ContextRetriever;
import br.edu.ifba.mindgraph.retrieval.ContextWindow;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Entry points for the conversational agent: record a turn, fetch context for a reply.
 */
@Path("/api/v1/profiles/{profileId}")
public class ConversationResources {

    private static final Logger LOG = Logger.getLogger(ConversationResources.class);

    @Inject
    ExtractionScheduler scheduler;

    @Inject
    ContextRetriever retriever;

    /**
     * Records a turn and schedules its extraction. Responds 202 when queued and
     * 503 when the extraction queue is full.
     */
    @POST
    @Path("/turns")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response recordTurn(@PathParam("profileId") final String profileId,
                               @Valid @NotNull final TurnRequest request) {
        ProfileIds.requireValid(profileId);
        final ConversationTurn turn = new ConversationTurn(request.turnId(), profileId, request.text(),
            request.conversationType(), request.recentTurns(), Instant.now());

        final CompletableFuture<ExtractionResult> scheduled = scheduler.submit(turn);
        final ExtractionResult immediate = scheduled.getNow(null);
        if (immediate != null && immediate.status() == ExtractionStatus.REJECTED) {
            LOG.warnf("Turn %s for profile %s rejected: extraction queue full", turn.turnId(), profileId);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(new ErrorResponse("about:blank", "Service Unavailable",
                    Response.Status.SERVICE_UNAVAILABLE.getStatusCode(),
                    immediate.error() != null ? immediate.error().message() : "Extraction queue is full",
                    "/api/v1/profiles/" + profileId + "/turns"))
                .type("application/problem+json")
                .header("Retry-After", "5")
                .build();
        }

        LOG.debugf("Turn %s for profile %s queued for extraction", turn.turnId(), profileId);
        return Response.accepted(new TurnAcceptedResponse(turn.turnId(), "QUEUED")).build();
    }

    @POST
    @Path("/context")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public ContextResponse retrieveContext(@PathParam("profileId") final String profileId,
                                           @Valid @NotNull final ContextRequest request) {
        final ContextWindow window = request.maxNodes() != null
            ? retriever.retrieveContext(profileId, request.message(), request.maxNodes())
            : retriever.retrieveContext(profileId, request.message());
        return ContextResponse.from(window);
    }
}
