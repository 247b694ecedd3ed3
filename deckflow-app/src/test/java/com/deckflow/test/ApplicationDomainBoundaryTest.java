package com.deckflow.test;

import com.deckflow.domain.collaborator.adapter.gateway.ICollaboratorGateway;
import com.deckflow.domain.session.adapter.repository.IWorkflowSessionRepository;
import com.deckflow.domain.session.service.ClarificationDomainService;
import com.deckflow.domain.session.service.InputGuardDomainService;
import com.deckflow.domain.workflow.service.FailureRecoveryDomainService;
import com.deckflow.domain.workflow.service.WorkflowTransitionDomainService;
import com.deckflow.infrastructure.collaborator.LlmCollaboratorGateway;
import com.deckflow.infrastructure.collaborator.MockCollaboratorGateway;
import com.deckflow.trigger.application.command.WorkflowOrchestratorService;
import com.deckflow.trigger.job.SessionIdleReaperJob;
import com.deckflow.trigger.router.MessageRouter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.util.Arrays;

public class ApplicationDomainBoundaryTest {

    @Test
    public void orchestratorShouldDependOnDomainServices() {
        Assertions.assertTrue(hasFieldType(WorkflowOrchestratorService.class, WorkflowTransitionDomainService.class));
        Assertions.assertTrue(hasFieldType(WorkflowOrchestratorService.class, FailureRecoveryDomainService.class));
        Assertions.assertTrue(hasFieldType(WorkflowOrchestratorService.class, ClarificationDomainService.class));
        Assertions.assertTrue(hasFieldType(WorkflowOrchestratorService.class, InputGuardDomainService.class));
        Assertions.assertTrue(hasFieldType(SessionIdleReaperJob.class, WorkflowOrchestratorService.class));
    }

    @Test
    public void triggerShouldOnlySeeDomainPorts() {
        Assertions.assertTrue(hasFieldType(WorkflowOrchestratorService.class, ICollaboratorGateway.class));
        Assertions.assertTrue(hasFieldType(WorkflowOrchestratorService.class, IWorkflowSessionRepository.class));
        Assertions.assertFalse(hasFieldType(WorkflowOrchestratorService.class, MockCollaboratorGateway.class));
        Assertions.assertFalse(hasFieldType(WorkflowOrchestratorService.class, LlmCollaboratorGateway.class));
        Assertions.assertTrue(hasFieldType(MessageRouter.class, IWorkflowSessionRepository.class));
    }

    private boolean hasFieldType(Class<?> owner, Class<?> fieldType) {
        Field[] fields = owner.getDeclaredFields();
        return Arrays.stream(fields).anyMatch(field -> field.getType().equals(fieldType));
    }
}
