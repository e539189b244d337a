package com.purchasingpower.tutor.api;

import com.purchasingpower.tutor.exception.ValidationException;
import com.purchasingpower.tutor.model.dto.AgentSummary;
import com.purchasingpower.tutor.model.dto.ApiResponse;
import com.purchasingpower.tutor.model.dto.CallerIdentity;
import com.purchasingpower.tutor.model.dto.ClientContext;
import com.purchasingpower.tutor.model.dto.ConversationDetail;
import com.purchasingpower.tutor.model.dto.ConversationSummary;
import com.purchasingpower.tutor.model.dto.SendMessageRequest;
import com.purchasingpower.tutor.model.dto.SessionOverview;
import com.purchasingpower.tutor.model.dto.SetActiveAgentRequest;
import com.purchasingpower.tutor.model.dto.TutorMessageResponse;
import com.purchasingpower.tutor.model.dto.UpdateModeRequest;
import com.purchasingpower.tutor.model.session.TutorSession;
import com.purchasingpower.tutor.service.AgentCatalogService;
import com.purchasingpower.tutor.service.ClientContextResolver;
import com.purchasingpower.tutor.service.TutorConversationService;
import com.purchasingpower.tutor.service.TutorMessagingService;
import com.purchasingpower.tutor.service.TutorSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API of the tutoring core.
 *
 * Endpoints:
 * - GET    /api/tutors/session                           - session, conversations and agents
 * - PUT    /api/tutors/session/mode                      - switch manual / router
 * - PUT    /api/tutors/session/active-agent              - set the manual-mode agent
 * - GET    /api/tutors/conversations                     - conversation previews
 * - GET    /api/tutors/conversations/{agentId}           - full history, created on first access
 * - DELETE /api/tutors/conversations/{agentId}           - clear history
 * - POST   /api/tutors/conversations/{agentId}/message   - send a message
 * - GET    /api/tutors/agents                            - available agents
 */
@Slf4j
@RestController
@RequestMapping("/api/tutors")
@RequiredArgsConstructor
public class TutorController {

    public static final String DEVICE_TYPE_HEADER = "X-Device-Type";

    private final TutorSessionService sessionService;
    private final TutorConversationService conversationService;
    private final TutorMessagingService messagingService;
    private final AgentCatalogService agentCatalog;
    private final ClientContextResolver clientContextResolver;

    @GetMapping("/session")
    public ResponseEntity<ApiResponse<SessionOverview>> getSession(
            CallerIdentity caller,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            @RequestHeader(value = DEVICE_TYPE_HEADER, required = false) String deviceHint) {

        ClientContext client = clientContextResolver.resolve(userAgent, deviceHint);
        return ResponseEntity.ok(ApiResponse.ok(sessionService.getOverview(caller.userId(), client)));
    }

    @PutMapping("/session/mode")
    public ResponseEntity<ApiResponse<TutorSession>> updateMode(
            CallerIdentity caller,
            @RequestBody UpdateModeRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            @RequestHeader(value = DEVICE_TYPE_HEADER, required = false) String deviceHint) {

        ClientContext client = clientContextResolver.resolve(userAgent, deviceHint);
        return ResponseEntity.ok(ApiResponse.ok(sessionService.updateMode(caller.userId(), request.getMode(), client)));
    }

    @PutMapping("/session/active-agent")
    public ResponseEntity<ApiResponse<TutorSession>> setActiveAgent(
            CallerIdentity caller,
            @RequestBody SetActiveAgentRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            @RequestHeader(value = DEVICE_TYPE_HEADER, required = false) String deviceHint) {

        ClientContext client = clientContextResolver.resolve(userAgent, deviceHint);
        TutorSession session = sessionService.setActiveAgent(caller.userId(), request.getAgentId(), client);
        return ResponseEntity.ok(ApiResponse.ok(session));
    }

    @GetMapping("/conversations")
    public ResponseEntity<ApiResponse<List<ConversationSummary>>> listConversations(CallerIdentity caller) {
        return ResponseEntity.ok(ApiResponse.ok(conversationService.listConversations(caller.userId())));
    }

    @GetMapping("/conversations/{agentId}")
    public ResponseEntity<ApiResponse<ConversationDetail>> getConversation(
            CallerIdentity caller,
            @PathVariable String agentId) {

        Long id = parseAgentId(agentId);
        return ResponseEntity.ok(ApiResponse.ok(conversationService.getOrCreateConversation(caller.userId(), id)));
    }

    @DeleteMapping("/conversations/{agentId}")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> clearConversation(
            CallerIdentity caller,
            @PathVariable String agentId,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            @RequestHeader(value = DEVICE_TYPE_HEADER, required = false) String deviceHint) {

        Long id = parseAgentId(agentId);
        ClientContext client = clientContextResolver.resolve(userAgent, deviceHint);
        int deleted = conversationService.clearConversation(caller.userId(), id, client);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("deleted", deleted)));
    }

    @PostMapping("/conversations/{agentId}/message")
    public ResponseEntity<ApiResponse<TutorMessageResponse>> sendMessage(
            CallerIdentity caller,
            @PathVariable String agentId,
            @RequestBody SendMessageRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            @RequestHeader(value = DEVICE_TYPE_HEADER, required = false) String deviceHint) {

        Long id = parseAgentId(agentId);
        ClientContext client = clientContextResolver.resolve(userAgent, deviceHint);

        log.info("Message from user {} to agent {} ({}, {})", caller.userId(), id,
                client.getDeviceType().getValue(), client.getBrowserName());

        TutorMessageResponse response = messagingService.sendMessage(caller.userId(), id, request, client);
        return ResponseEntity.ok(ApiResponse.ok(response));
    }

    @GetMapping("/agents")
    public ResponseEntity<ApiResponse<List<AgentSummary>>> listAgents(CallerIdentity caller) {
        return ResponseEntity.ok(ApiResponse.ok(agentCatalog.listSummaries()));
    }

    private static Long parseAgentId(String agentId) {
        try {
            return Long.parseLong(agentId.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid agent identifier");
        }
    }
}
