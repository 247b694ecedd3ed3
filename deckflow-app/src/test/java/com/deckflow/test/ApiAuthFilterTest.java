package com.deckflow.test;

import com.deckflow.api.response.Response;
import com.deckflow.config.ApiAuthFilter;
import com.deckflow.infrastructure.identity.ConfiguredTokenIdentityGateway;
import com.deckflow.types.common.Constants;
import com.deckflow.types.enums.ResponseCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ApiAuthFilterTest {

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        ApiAuthFilter apiAuthFilter = new ApiAuthFilter(new ObjectMapper(),
                new ConfiguredTokenIdentityGateway(Map.of("dev-token-alice", "alice")));
        this.mockMvc = MockMvcBuilders
                .standaloneSetup(new ProtectedApiController())
                .addFilters(apiAuthFilter)
                .build();
    }

    @Test
    public void shouldRejectProtectedApiWhenTokenMissing() throws Exception {
        mockMvc.perform(get("/api/protected/whoami"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value(ResponseCode.UNAUTHORIZED.getCode()));
    }

    @Test
    public void shouldRejectUnknownToken() throws Exception {
        mockMvc.perform(get("/api/protected/whoami")
                        .header("Authorization", "Bearer dev-token-mallory"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void shouldExposeUserIdWithBearerToken() throws Exception {
        mockMvc.perform(get("/api/protected/whoami")
                        .header("Authorization", "Bearer dev-token-alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data").value("alice"));
    }

    @Test
    public void shouldAcceptAccessTokenQuery() throws Exception {
        mockMvc.perform(get("/api/protected/whoami")
                        .param("accessToken", "dev-token-alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("alice"));
    }

    @Test
    public void shouldBypassWhitelistAndNonApiPaths() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value("UP"));

        mockMvc.perform(get("/static/ping"))
                .andExpect(status().isOk());

        mockMvc.perform(options("/api/protected/whoami"))
                .andExpect(status().isOk());
    }

    @RestController
    private static class ProtectedApiController {

        @GetMapping("/api/protected/whoami")
        public Response<String> whoami(@RequestAttribute(Constants.AUTH_USER_ID_ATTRIBUTE) String userId) {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data(userId)
                    .build();
        }

        @GetMapping("/api/health")
        public Response<String> health() {
            return Response.<String>builder()
                    .code("0000")
                    .info("成功")
                    .data("UP")
                    .build();
        }

        @GetMapping("/static/ping")
        public String ping() {
            return "pong";
        }
    }
}
