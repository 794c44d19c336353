package com.guardrails.api.rest;

import com.guardrails.engine.approval.ApprovalGateway;
import com.guardrails.engine.approval.ApprovalResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Callback target of the approve/reject links sent with approval requests.
 * GET is accepted because chat clients open links with a plain GET.
 */
@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalController {

    private final ApprovalGateway gateway;

    public ApprovalController(ApprovalGateway gateway) {
        this.gateway = gateway;
    }

    @RequestMapping(path = "/{executionId}", method = {RequestMethod.GET, RequestMethod.POST})
    public ResponseEntity<ApprovalResult> resolve(
            @PathVariable UUID executionId,
            @RequestParam String token,
            @RequestParam String decision,
            @RequestParam(required = false) String user) {

        ApprovalResult result = gateway.resolve(executionId, token, decision, user);
        HttpStatus status = switch (result.outcome()) {
            case EXECUTED, REJECTED -> HttpStatus.OK;
            case ALREADY_RESOLVED -> HttpStatus.CONFLICT;
            case DENIED -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FAILED -> HttpStatus.BAD_GATEWAY;
        };
        return ResponseEntity.status(status).body(result);
    }
}
