package com.complaintportal.service;

import com.complaintportal.dto.CreateComplaintRequest;
import com.complaintportal.exception.BusinessException;
import com.complaintportal.exception.ErrorMessage;
import com.complaintportal.model.Complaint;
import com.complaintportal.model.ComplaintStatus;
import com.complaintportal.model.IssueType;
import com.complaintportal.repository.JsonFileComplaintRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ComplaintServiceTest {

    @TempDir Path tempDir;

    private Clock clock;
    private ComplaintService service;

    private final Instant t0 = Instant.parse("2025-06-01T08:00:00.123456Z");

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        when(clock.instant()).thenReturn(t0);

        ObjectMapper om = Jackson2ObjectMapperBuilder.json().build();
        var repo = new JsonFileComplaintRepository(om, tempDir.resolve("data.json").toString());
        service = new ComplaintService(repo, clock);
    }

    private static CreateComplaintRequest pothole() {
        CreateComplaintRequest r = new CreateComplaintRequest();
        r.setIssueType("Road");
        r.setTitle("Pothole on Main St");
        r.setDescription("Large pothole causing traffic issues");
        r.setLocation("Main St & 5th");
        return r;
    }

    @Test
    void create_setsDefaults() {
        Complaint c = service.create(pothole());

        assertThat(c.getId()).isNotBlank();
        assertThat(c.getName()).isEmpty();
        assertThat(c.getIssueType()).isEqualTo(IssueType.ROAD);
        assertThat(c.getStatus()).isEqualTo(ComplaintStatus.PENDING);
        assertThat(c.getUpvotes()).isZero();
        assertThat(c.getUpvoters()).isEmpty();
        assertThat(c.getPhotoData()).isNull();
        // truncated to millis
        assertThat(c.getCreatedAt()).isEqualTo(Instant.parse("2025-06-01T08:00:00.123Z"));
        assertThat(c.getUpdatedAt()).isEqualTo(c.getCreatedAt());
    }

    @Test
    void create_keepsNameAndPhoto() {
        CreateComplaintRequest r = pothole();
        r.setName("Asha");
        r.setPhotoData("data:image/png;base64,iVBORw0KGgo=");

        Complaint c = service.create(r);

        assertThat(c.getName()).isEqualTo("Asha");
        assertThat(c.getPhotoData()).isEqualTo("data:image/png;base64,iVBORw0KGgo=");
    }

    @Test
    void create_emptyPhoto_isStoredAsNull() {
        CreateComplaintRequest r = pothole();
        r.setPhotoData("");

        assertThat(service.create(r).getPhotoData()).isNull();
    }

    @Test
    void upvote_sameAddressCountsOnce() {
        Complaint c = service.create(pothole());

        when(clock.instant()).thenReturn(t0.plusSeconds(10));
        assertThat(service.upvote(c.getId(), "10.0.0.1").getUpvotes()).isEqualTo(1);

        when(clock.instant()).thenReturn(t0.plusSeconds(20));
        Complaint again = service.upvote(c.getId(), "10.0.0.1");

        assertThat(again.getUpvotes()).isEqualTo(1);
        // a repeated upvote is not a mutation
        assertThat(again.getUpdatedAt()).isEqualTo(Instant.parse("2025-06-01T08:00:10.123Z"));
    }

    @Test
    void upvote_distinctAddressesEachCount() {
        Complaint c = service.create(pothole());

        for (int i = 1; i <= 5; i++) {
            service.upvote(c.getId(), "10.0.0." + i);
        }

        Complaint after = service.listNewestFirst().get(0);
        assertThat(after.getUpvotes()).isEqualTo(5);
        assertThat(after.getUpvoters()).hasSize(5);
    }

    @Test
    void upvote_unknownId_notFound() {
        assertThatThrownBy(() -> service.upvote("c_missing", "10.0.0.1"))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorMessage())
                .isEqualTo(ErrorMessage.COMPLAINT_NOT_FOUND);
    }

    @Test
    void updateStatus_anyTransitionAllowed() {
        Complaint c = service.create(pothole());

        when(clock.instant()).thenReturn(t0.plusSeconds(60));
        assertThat(service.updateStatus(c.getId(), ComplaintStatus.RESOLVED).getStatus())
                .isEqualTo(ComplaintStatus.RESOLVED);

        Complaint back = service.updateStatus(c.getId(), ComplaintStatus.PENDING);
        assertThat(back.getStatus()).isEqualTo(ComplaintStatus.PENDING);
        assertThat(back.getUpdatedAt()).isAfter(back.getCreatedAt());
    }

    @Test
    void updatedAt_neverBeforeCreatedAt() {
        Complaint c = service.create(pothole());

        // clock stepped backwards
        when(clock.instant()).thenReturn(t0.minusSeconds(3600));
        Complaint updated = service.updateStatus(c.getId(), ComplaintStatus.IN_PROGRESS);

        assertThat(updated.getUpdatedAt()).isEqualTo(updated.getCreatedAt());
    }

    @Test
    void updateStatus_unknownId_notFound() {
        assertThatThrownBy(() -> service.updateStatus("c_missing", ComplaintStatus.RESOLVED))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Complaint not found");
    }
}
