package com.complaintportal.web;

import com.complaintportal.exception.BusinessException;
import com.complaintportal.exception.ErrorMessage;
import com.complaintportal.model.ComplaintStatus;
import com.complaintportal.service.ComplaintService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ErrorHandlingWebTests {

    @Autowired MockMvc mvc;

    @MockBean ComplaintService complaintService;

    @Test
    void unexpectedException_isGeneric500() throws Exception {
        when(complaintService.listNewestFirst()).thenThrow(new IllegalStateException("disk on fire"));

        mvc.perform(get("/api/complaints"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"))
                .andExpect(content().string(not(containsString("disk on fire"))));
    }

    @Test
    void unexpectedExceptionOnCreate_isGeneric500() throws Exception {
        when(complaintService.create(any())).thenThrow(new RuntimeException("boom"));

        mvc.perform(post("/api/complaints")
                        .with(request -> {
                            request.setRemoteAddr("10.50.0.1");
                            return request;
                        })
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"issueType":"Garbage","title":"Overflowing bin",
                                 "description":"Bin has not been emptied for a week","location":"Park Rd"}
                                """))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }

    @Test
    void invalidPayload_neverReachesTheService() throws Exception {
        mvc.perform(post("/api/complaints")
                        .with(request -> {
                            request.setRemoteAddr("10.50.0.2");
                            return request;
                        })
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"issueType\":\"Road\"}"))
                .andExpect(status().isBadRequest());

        verify(complaintService, never()).create(any());
    }

    @Test
    void unknownRoute_isNotFound() throws Exception {
        mvc.perform(get("/api/nothing-here"))
                .andExpect(status().isNotFound());
    }

    @Test
    void adminPrincipal_reachesServiceAndGetsNotFound() throws Exception {
        when(complaintService.updateStatus(eq("c_gone"), eq(ComplaintStatus.RESOLVED)))
                .thenThrow(new BusinessException(ErrorMessage.COMPLAINT_NOT_FOUND));

        mvc.perform(patch("/api/complaints/{id}/status", "c_gone")
                        .with(user("admin").roles("ADMIN"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Resolved\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Complaint not found"));
    }

    @Test
    void nonAdminPrincipal_isForbidden() throws Exception {
        mvc.perform(patch("/api/complaints/{id}/status", "c_any")
                        .with(user("someone").roles("USER"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"Resolved\"}"))
                .andExpect(status().isForbidden());

        verify(complaintService, never()).updateStatus(any(), any());
    }
}
