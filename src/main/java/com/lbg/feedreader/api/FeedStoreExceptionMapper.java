package com.lbg.feedreader.api;

import com.lbg.feedreader.catalog.FeedNotFoundException;
import com.lbg.feedreader.catalog.FeedStoreException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Lookup misses become 404; every other store failure is a 500.
 */
@Provider
public class FeedStoreExceptionMapper implements ExceptionMapper<FeedStoreException> {

    private static final Logger LOG = Logger.getLogger(FeedStoreExceptionMapper.class);

    @Override
    public Response toResponse(FeedStoreException exception) {
        Response.Status status = exception instanceof FeedNotFoundException
                ? Response.Status.NOT_FOUND
                : Response.Status.INTERNAL_SERVER_ERROR;

        if (status == Response.Status.INTERNAL_SERVER_ERROR) {
            LOG.errorf(exception, "Feed store failure: %s", exception.getMessage());
        }

        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.of(exception))
                .build();
    }
}
