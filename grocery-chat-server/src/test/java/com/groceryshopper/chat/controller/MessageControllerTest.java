package com.groceryshopper.chat.controller;

import com.groceryshopper.chat.domain.ChatMessage;
import com.groceryshopper.chat.domain.PipelineRequest;
import com.groceryshopper.chat.service.ChatAccessException;
import com.groceryshopper.chat.service.RoomMessageService;
import com.groceryshopper.chat.service.SecurityValidator;
import com.groceryshopper.chat.service.agent.AgentPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class MessageControllerTest {

    @Mock
    private RoomMessageService roomMessageService;

    @Mock
    private AgentPipeline agentPipeline;

    @Mock
    private SecurityValidator securityValidator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new MessageController(roomMessageService, agentPipeline, securityValidator))
                .build();
    }

    @Test
    @DisplayName("Should store the message, dispatch the pipeline and return its id")
    void postsMessage() throws Exception {
        // Given
        when(securityValidator.authenticate("Bearer t")).thenReturn("ana");
        when(roomMessageService.postUserMessage(3L, "ana", "@gro menu"))
                .thenReturn(ChatMessage.builder().id(77L).roomId(3L).userId(5L).content("@gro menu").build());

        // When / Then
        mockMvc.perform(post("/api/rooms/3/messages")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer t")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"@gro menu\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.id").value(77));

        ArgumentCaptor<PipelineRequest> dispatched = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(agentPipeline).dispatch(dispatched.capture());
        assertThat(dispatched.getValue().getUserId()).isEqualTo(5L);
        assertThat(dispatched.getValue().getContent()).isEqualTo("@gro menu");
    }

    @Test
    @DisplayName("Should map access failures to their status and not dispatch")
    void forbidden() throws Exception {
        when(securityValidator.authenticate("Bearer t")).thenReturn("ana");
        when(roomMessageService.postUserMessage(3L, "ana", "hi"))
                .thenThrow(new ChatAccessException(HttpStatus.FORBIDDEN, "Not a member of this room"));

        mockMvc.perform(post("/api/rooms/3/messages")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer t")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"hi\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value("Not a member of this room"));

        verify(agentPipeline, never()).dispatch(any());
    }

    @Test
    @DisplayName("Should reject a blank message body")
    void blankContent() throws Exception {
        when(securityValidator.authenticate("Bearer t")).thenReturn("ana");

        mockMvc.perform(post("/api/rooms/3/messages")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer t")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\":\"  \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(roomMessageService, agentPipeline);
    }
}
