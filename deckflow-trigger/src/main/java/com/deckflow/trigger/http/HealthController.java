package com.deckflow.trigger.http;

import com.deckflow.api.dto.HealthDTO;
import com.deckflow.api.response.Response;
import com.deckflow.domain.collaborator.adapter.gateway.ICollaboratorGateway;
import com.deckflow.trigger.application.query.SessionQueryService;
import com.deckflow.trigger.connection.ConnectionManager;
import com.deckflow.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 健康检查 API，无需鉴权。
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final ConnectionManager connectionManager;
    private final SessionQueryService sessionQueryService;
    private final ICollaboratorGateway collaboratorGateway;

    public HealthController(ConnectionManager connectionManager,
                            SessionQueryService sessionQueryService,
                            ICollaboratorGateway collaboratorGateway) {
        this.connectionManager = connectionManager;
        this.sessionQueryService = sessionQueryService;
        this.collaboratorGateway = collaboratorGateway;
    }

    @GetMapping
    public Response<HealthDTO> health() {
        HealthDTO data = new HealthDTO();
        data.setStatus("UP");
        data.setCollaboratorMode(collaboratorGateway.mode());
        data.setActiveConnections(connectionManager.activeConnections());
        data.setLiveSessions(sessionQueryService.liveSessions());
        return Response.<HealthDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
