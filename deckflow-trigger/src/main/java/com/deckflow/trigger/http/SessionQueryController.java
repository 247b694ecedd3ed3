package com.deckflow.trigger.http;

import com.deckflow.api.dto.SessionDetailDTO;
import com.deckflow.api.response.Response;
import com.deckflow.trigger.application.query.SessionQueryService;
import com.deckflow.types.common.Constants;
import com.deckflow.types.enums.ResponseCode;
import com.deckflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 会话查询 API
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionQueryController {

    private final SessionQueryService sessionQueryService;

    public SessionQueryController(SessionQueryService sessionQueryService) {
        this.sessionQueryService = sessionQueryService;
    }

    @GetMapping("/{sessionId}")
    public Response<SessionDetailDTO> getSession(@PathVariable("sessionId") String sessionId,
                                                 @RequestAttribute(name = Constants.AUTH_USER_ID_ATTRIBUTE, required = false) String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.UNAUTHORIZED.getCode(), ResponseCode.UNAUTHORIZED.getInfo());
        }
        SessionDetailDTO data = sessionQueryService.getSessionDetail(sessionId, userId);
        return Response.<SessionDetailDTO>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
