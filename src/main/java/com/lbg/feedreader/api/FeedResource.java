package com.lbg.feedreader.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lbg.feedreader.catalog.FeedListStore;
import com.lbg.feedreader.domain.Feed;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * REST endpoints over the feed catalog.
 */
@Path("/api/feeds")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class FeedResource {

    private static final Logger LOG = Logger.getLogger(FeedResource.class);

    @Inject
    FeedListStore store;

    @GET
    public List<Feed> list() {
        return store.listAll();
    }

    @GET
    @Path("/{id}")
    public Feed get(@PathParam("id") String id) {
        return store.getById(id);
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public FeedCreated add(Feed candidate) {
        if (candidate == null || candidate.url().isBlank()) {
            throw new BadRequestException("Feed URL is required");
        }
        // Any client-supplied ID is discarded by the store
        String id = store.add(candidate);
        LOG.debugf("Registered %s as %s", candidate.url(), id);
        return new FeedCreated(id);
    }

    public record FeedCreated(@JsonProperty("ID") String id) {
    }
}
