package com.splitttr.flowcollab.client;

import com.splitttr.flowcollab.model.Operation;
import com.splitttr.flowcollab.store.SessionDocument;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

@RegisterRestClient(configKey = "workflow-service")
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface WorkflowServiceClient {

    @GET
    @Path("/workflows/{id}/graph")
    WorkflowGraphResponse getGraph(@PathParam("id") String workflowId);

    @POST
    @Path("/workflows/{id}/operations")
    void appendOperation(@PathParam("id") String workflowId, Operation operation);

    @PUT
    @Path("/collaboration-sessions/{sessionId}")
    void saveSession(@PathParam("sessionId") String sessionId, SessionDocument session);
}
