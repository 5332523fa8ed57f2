package com.lbg.feedreader.api;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * Answers every unmatched path under {@code /api} with a JSON 404.
 */
@Path("/api")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class ApiFallbackResource {

    private static final String NOT_FOUND = "Endpoint not found";

    @GET
    @Path("/{path: .*}")
    public void get() {
        throw new NotFoundException(NOT_FOUND);
    }

    @POST
    @Path("/{path: .*}")
    public void post() {
        throw new NotFoundException(NOT_FOUND);
    }

    @PUT
    @Path("/{path: .*}")
    public void put() {
        throw new NotFoundException(NOT_FOUND);
    }

    @DELETE
    @Path("/{path: .*}")
    public void delete() {
        throw new NotFoundException(NOT_FOUND);
    }
}
