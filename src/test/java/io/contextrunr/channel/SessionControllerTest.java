package io.contextrunr.channel;

import io.contextrunr.core.ContextEngine;
import io.contextrunr.session.Message;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SessionController.class)
@AutoConfigureMockMvc(addFilters = false)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContextEngine contextEngine;

    @Test
    void shouldCreateSession() throws Exception {
        when(contextEngine.createSession("user-1", "You are helpful.")).thenReturn("session_abc");

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"userId": "user-1", "initialContext": "You are helpful."}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("session_abc"));
    }

    @Test
    void shouldRejectSessionWithoutUser() throws Exception {
        when(contextEngine.createSession(any(), any())).thenThrow(new IllegalArgumentException("User id is required"));

        mockMvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("User id is required"));
    }

    @Test
    void shouldAcceptMessage() throws Exception {
        when(contextEngine.append("session_abc", "user-1", "user", "Hello")).thenReturn(true);

        mockMvc.perform(post("/api/sessions/session_abc/messages")
                        .header(SessionController.USER_HEADER, "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role": "user", "content": "Hello"}
                                """))
                .andExpect(status().isAccepted());
    }

    @Test
    void shouldAnswerNotFoundForForeignSession() throws Exception {
        when(contextEngine.append(anyString(), anyString(), anyString(), anyString())).thenReturn(false);

        mockMvc.perform(post("/api/sessions/session_abc/messages")
                        .header(SessionController.USER_HEADER, "intruder")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role": "user", "content": "Hello"}
                                """))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectBlankContent() throws Exception {
        mockMvc.perform(post("/api/sessions/session_abc/messages")
                        .header(SessionController.USER_HEADER, "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role": "user", "content": "   "}
                                """))
                .andExpect(status().isBadRequest());

        verify(contextEngine, never()).append(any(), any(), any(), any());
    }

    @Test
    void shouldRejectUnknownRole() throws Exception {
        when(contextEngine.append(any(), any(), eq("narrator"), any()))
                .thenThrow(new IllegalArgumentException("Unknown message role: narrator"));

        mockMvc.perform(post("/api/sessions/session_abc/messages")
                        .header(SessionController.USER_HEADER, "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role": "narrator", "content": "Once upon a time"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnHistory() throws Exception {
        Instant at = Instant.parse("2026-03-01T10:15:30.250Z");
        when(contextEngine.isAccessible("session_abc", "user-1")).thenReturn(true);
        when(contextEngine.history("session_abc", "user-1", 2)).thenReturn(List.of(
                Message.user("Hi", at),
                Message.assistant("Hello!", at)
        ));

        mockMvc.perform(get("/api/sessions/session_abc/messages")
                        .header(SessionController.USER_HEADER, "user-1")
                        .param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].role").value("user"))
                .andExpect(jsonPath("$[1].content").value("Hello!"))
                .andExpect(jsonPath("$[1].timestamp").value("2026-03-01T10:15:30.250Z"));
    }

    @Test
    void shouldHideHistoryOfInaccessibleSession() throws Exception {
        when(contextEngine.isAccessible("session_abc", "intruder")).thenReturn(false);

        mockMvc.perform(get("/api/sessions/session_abc/messages")
                        .header(SessionController.USER_HEADER, "intruder"))
                .andExpect(status().isNotFound());

        verify(contextEngine, never()).history(any(), any(), any());
    }

    @Test
    void shouldEndSession() throws Exception {
        when(contextEngine.end("session_abc", "user-1")).thenReturn(true);

        mockMvc.perform(delete("/api/sessions/session_abc")
                        .header(SessionController.USER_HEADER, "user-1"))
                .andExpect(status().isNoContent());
    }

    @Test
    void shouldAnswerNotFoundWhenEndingUnknownSession() throws Exception {
        when(contextEngine.end("missing", "user-1")).thenReturn(false);

        mockMvc.perform(delete("/api/sessions/missing")
                        .header(SessionController.USER_HEADER, "user-1"))
                .andExpect(status().isNotFound());
    }
}
