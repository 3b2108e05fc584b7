package tw.gc.struggle.engine.controllers;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.enums.InterventionStatus;
import tw.gc.struggle.engine.enums.UserResponse;
import tw.gc.struggle.engine.exceptions.IllegalTransitionException;
import tw.gc.struggle.engine.exceptions.NotFoundException;
import tw.gc.struggle.engine.services.intervention.InterventionResponseService;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InterventionController.class)
class InterventionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InterventionResponseService responseService;

    @Test
    void delivered_shouldReturnRecord() throws Exception {
        when(responseService.markDelivered("iv-1")).thenReturn(InterventionRecord.builder()
                .id("iv-1").status(InterventionStatus.DELIVERED).build());

        mockMvc.perform(post("/api/interventions/iv-1/delivered"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.interventionId").value("iv-1"))
                .andExpect(jsonPath("$.status").value("delivered"));
    }

    @Test
    void delivered_whenUnknown_shouldReturn404() throws Exception {
        when(responseService.markDelivered("missing")).thenThrow(new NotFoundException("Intervention not found"));

        mockMvc.perform(post("/api/interventions/missing/delivered"))
                .andExpect(status().isNotFound());
    }

    @Test
    void response_shouldRecordOutcome() throws Exception {
        when(responseService.recordResponse("iv-1", UserResponse.ACCEPTED)).thenReturn(InterventionRecord.builder()
                .id("iv-1").status(InterventionStatus.RESPONDED).userResponse(UserResponse.ACCEPTED).build());

        mockMvc.perform(post("/api/interventions/iv-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"accepted\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.userResponse").value("accepted"));
    }

    @Test
    void response_withUnknownValue_shouldReturn400() throws Exception {
        mockMvc.perform(post("/api/interventions/iv-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"maybe\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(responseService);
    }

    @Test
    void response_whenAlreadyAnswered_shouldReturn409() throws Exception {
        when(responseService.recordResponse("iv-1", UserResponse.DISMISSED))
                .thenThrow(new IllegalTransitionException("already answered"));

        mockMvc.perform(post("/api/interventions/iv-1/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"dismissed\"}"))
                .andExpect(status().isConflict());
    }
}
