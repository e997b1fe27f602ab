package com.entity.reconciliation.rest;

import com.entity.reconciliation.api.EntityNotFoundException;
import com.entity.reconciliation.api.ReconciliationOptions;
import com.entity.reconciliation.api.ReconciliationService;
import com.entity.reconciliation.health.HealthStatus;
import com.entity.reconciliation.rest.dto.ErrorResponse;
import com.entity.reconciliation.store.InputSanitizer;
import com.entity.reconciliation.store.MalformedQueryException;
import com.entity.reconciliation.store.StoreUnavailableException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * REST resource of the reconciliation service.
 *
 * <p>Every response carries {@code Access-Control-Allow-Origin: *} and is rendered as JSONP
 * when a {@code callback} parameter is present.</p>
 */
@Path(ReconciliationOptions.SERVICE_PATH)
@ApplicationScoped
@Tag(name = "Reconciliation", description = "Reconcile names against the loaded entities")
public class ReconciliationResource {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationResource.class);

    static final String JSONP_TYPE = "application/javascript";

    private final ReconciliationService service;
    private final RequestParser parser;

    @Inject
    public ReconciliationResource(ReconciliationService service) {
        this(service, new RequestParser());
    }

    ReconciliationResource(ReconciliationService service, RequestParser parser) {
        this.service = service;
        this.parser = parser;
    }

    /**
     * GET /reconcile?queries=...|extend=...
     */
    @GET
    @Operation(summary = "Reconcile, extend or read the manifest",
            description = "Runs the 'queries' batch or the 'extend' request; without either returns the manifest.")
    @APIResponse(responseCode = "200", description = "Query results, extension rows or manifest")
    @APIResponse(responseCode = "400", description = "Malformed queries, extend request or callback")
    @APIResponse(responseCode = "404", description = "An extended entity does not exist")
    public Response reconcileGet(@QueryParam("queries") String queries,
                                 @QueryParam("extend") String extend,
                                 @QueryParam("callback") String callback) {
        return dispatch(queries, extend, callback);
    }

    /**
     * POST /reconcile with form parameters.
     */
    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Operation(summary = "Reconcile or extend (form post)")
    public Response reconcilePost(@FormParam("queries") String queries,
                                  @FormParam("extend") String extend,
                                  @FormParam("callback") String formCallback,
                                  @QueryParam("callback") String queryCallback) {
        return dispatch(queries, extend, RequestParser.isJsonp(formCallback) ? formCallback : queryCallback);
    }

    @GET
    @Path("/auto/entities")
    @Operation(summary = "Suggest entities", description = "Entities whose name or id starts with the prefix.")
    public Response suggestEntities(@QueryParam("prefix") @DefaultValue("") String prefix,
                                    @QueryParam("callback") String callback) {
        return respond("/auto/entities", callback, () -> {
            InputSanitizer.checkRequestLength(prefix);
            return service.suggestEntities(prefix);
        });
    }

    @GET
    @Path("/auto/types")
    @Operation(summary = "Suggest types")
    public Response suggestTypes(@QueryParam("prefix") @DefaultValue("") String prefix,
                                 @QueryParam("callback") String callback) {
        return respond("/auto/types", callback, () -> {
            InputSanitizer.checkRequestLength(prefix);
            return service.suggestTypes(prefix);
        });
    }

    @GET
    @Path("/auto/properties")
    @Operation(summary = "Suggest properties")
    public Response suggestProperties(@QueryParam("prefix") @DefaultValue("") String prefix,
                                      @QueryParam("callback") String callback) {
        return respond("/auto/properties", callback, () -> {
            InputSanitizer.checkRequestLength(prefix);
            return service.suggestProperties(prefix);
        });
    }

    @GET
    @Path("/properties")
    @Operation(summary = "Propose properties", description = "Lists the properties of a type.")
    public Response proposeProperties(
            @Parameter(description = "Type id") @QueryParam("type") @DefaultValue("") String type,
            @Parameter(description = "Maximum number of properties, 0 for all")
            @QueryParam("limit") @DefaultValue("0") int limit,
            @QueryParam("callback") String callback) {
        return respond("/properties", callback, () -> service.proposeProperties(type, limit));
    }

    @GET
    @Path("/health")
    @Operation(summary = "Service health")
    @APIResponse(responseCode = "200", description = "UP or DEGRADED")
    @APIResponse(responseCode = "503", description = "DOWN")
    public Response health() {
        HealthStatus status = service.health();
        Response.Status code = status.isDown() ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK;
        return Response.status(code)
                .entity(parser.render(status, null))
                .type(MediaType.APPLICATION_JSON)
                .build();
    }

    private Response dispatch(String queries, String extend, String callback) {
        if (queries != null && !queries.isEmpty()) {
            return respond("", callback, () -> service.reconcile(parser.parseQueries(queries)));
        }
        if (extend != null && !extend.isEmpty()) {
            return respond("", callback, () -> service.extend(parser.parseExtend(extend)));
        }
        return respond("", callback, service::manifest);
    }

    private Response respond(String path, String callback, Supplier<Object> action) {
        String fullPath = ReconciliationOptions.SERVICE_PATH + path;
        try {
            String body = parser.render(action.get(), callback);
            String type = RequestParser.isJsonp(callback) ? JSONP_TYPE : MediaType.APPLICATION_JSON;
            return withCors(Response.ok(body, type));
        } catch (EntityNotFoundException e) {
            return error(Response.Status.NOT_FOUND, ErrorResponse.notFound(e.getMessage(), fullPath));
        } catch (IllegalArgumentException | MalformedQueryException e) {
            return error(Response.Status.BAD_REQUEST, ErrorResponse.badRequest(e.getMessage(), fullPath));
        } catch (StoreUnavailableException e) {
            log.error("request.failed path={} error={}", fullPath, e.getMessage(), e);
            return error(Response.Status.SERVICE_UNAVAILABLE,
                    ErrorResponse.unavailable("The entity store is unavailable.", fullPath));
        } catch (RuntimeException e) {
            log.error("request.failed path={} error={}", fullPath, e.getMessage(), e);
            return error(Response.Status.INTERNAL_SERVER_ERROR,
                    ErrorResponse.internalError("An internal error occurred. Check server logs for details.", fullPath));
        }
    }

    private Response error(Response.Status status, ErrorResponse body) {
        return withCors(Response.status(status).entity(parser.render(body, null)).type(MediaType.APPLICATION_JSON));
    }

    private static Response withCors(Response.ResponseBuilder builder) {
        return builder.header("Access-Control-Allow-Origin", "*").build();
    }
}
