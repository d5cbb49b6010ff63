package br.edu.ifba.mindgraph.api;

import br.edu.ifba.mindgraph.core.ExtractionLogEntry;
import br.edu.ifba.mindgraph.extraction.ExtractionQueueStats;
import br.edu.ifba.mindgraph.extraction.ExtractionScheduler;
import br.edu.ifba.mindgraph.shared.ProfileIds;
import br.edu.ifba.mindgraph.storage.GraphStore;
import br.edu.ifba.mindgraph.utils.Futures;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

@Path("/api/v1")
public class ExtractionResources {

    @Inject
    GraphStore graphStore;

    @Inject
    ExtractionScheduler scheduler;

    /**
     * Extraction runs of a profile, newest first.
     */
    @GET
    @Path("/profiles/{profileId}/extraction-logs")
    @Produces(MediaType.APPLICATION_JSON)
    public List<ExtractionLogEntry> listLogs(@PathParam("profileId") final String profileId,
                                             @QueryParam("limit") @DefaultValue("50") @Min(1) @Max(500) final int limit) {
        ProfileIds.requireValid(profileId);
        return Futures.await(graphStore.listExtractionLogs(profileId, limit));
    }

    @GET
    @Path("/extraction/queue")
    @Produces(MediaType.APPLICATION_JSON)
    public ExtractionQueueStats queue() {
        return scheduler.stats();
    }
}
