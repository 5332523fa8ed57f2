package com.lbg.feedreader.api;

import com.lbg.feedreader.store.BackingStoreException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Storage engine failures surface as a 500 with the JSON error body.
 */
@Provider
public class BackingStoreExceptionMapper implements ExceptionMapper<BackingStoreException> {

    private static final Logger LOG = Logger.getLogger(BackingStoreExceptionMapper.class);

    @Override
    public Response toResponse(BackingStoreException exception) {
        LOG.errorf(exception, "Backing store failure");
        return Response.serverError()
                .type(MediaType.APPLICATION_JSON)
                .entity(ErrorResponse.of(exception))
                .build();
    }
}
