package com.lbg.feedreader.api;

import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Set;

/**
 * Rejects API requests carrying a body that is not JSON, before any resource is matched.
 */
@Provider
@PreMatching
public class JsonContentTypeFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(JsonContentTypeFilter.class);

    private static final Set<String> BODY_METHODS = Set.of(HttpMethod.POST, HttpMethod.PUT);

    @Override
    public void filter(ContainerRequestContext request) {
        String path = request.getUriInfo().getPath();
        if (!isApiPath(path) || !BODY_METHODS.contains(request.getMethod())) {
            return;
        }

        String contentType = request.getHeaderString(HttpHeaders.CONTENT_TYPE);
        if (contentType == null || contentType.isBlank()) {
            reject(request, "Media type () not supported");
            return;
        }

        for (String candidate : contentType.split(",")) {
            MediaType mediaType;
            try {
                mediaType = MediaType.valueOf(candidate.trim());
            } catch (IllegalArgumentException e) {
                reject(request, "Media type (" + candidate.trim() + ") not parseable");
                return;
            }
            if ("application".equalsIgnoreCase(mediaType.getType())
                    && "json".equalsIgnoreCase(mediaType.getSubtype())) {
                return;
            }
        }
        reject(request, "Media type (" + contentType + ") not supported");
    }

    private static boolean isApiPath(String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return relative.equals("api") || relative.startsWith("api/");
    }

    private static void reject(ContainerRequestContext request, String message) {
        LOG.debugf("Rejecting %s %s: %s", request.getMethod(), request.getUriInfo().getPath(), message);
        request.abortWith(Response.status(Response.Status.UNSUPPORTED_MEDIA_TYPE)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(message))
                .build());
    }
}
