package com.complaintportal.service;

import com.complaintportal.dto.CreateComplaintRequest;
import com.complaintportal.exception.BusinessException;
import com.complaintportal.exception.ErrorMessage;
import com.complaintportal.model.Complaint;
import com.complaintportal.model.ComplaintStatus;
import com.complaintportal.model.IssueType;
import com.complaintportal.repository.ComplaintRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ComplaintService {

    private final ComplaintRepository complaintRepository;
    private final Clock clock;

    public List<Complaint> listNewestFirst() {
        return complaintRepository.findAllNewestFirst();
    }

    /** Expects a request that already passed bean validation. */
    public Complaint create(CreateComplaintRequest request) {
        Instant now = now();

        Complaint c = new Complaint();
        c.setName(request.getName() != null ? request.getName() : "");
        c.setIssueType(IssueType.fromLabel(request.getIssueType()));
        c.setTitle(request.getTitle());
        c.setDescription(request.getDescription());
        c.setLocation(request.getLocation());
        c.setStatus(ComplaintStatus.PENDING);
        c.setPhotoData(StringUtils.hasLength(request.getPhotoData()) ? request.getPhotoData() : null);
        c.setCreatedAt(now);
        c.setUpdatedAt(now);

        Complaint saved = complaintRepository.append(c);
        log.info("Complaint {} created ({})", saved.getId(), saved.getIssueType().getLabel());
        return saved;
    }

    /** Adds the address to the upvoters once; repeated upvotes from the same address change nothing. */
    public Complaint upvote(String id, String clientAddress) {
        return complaintRepository.update(id, c -> {
            if (!c.addUpvoter(clientAddress)) {
                return false;
            }
            c.touch(now());
            log.debug("Complaint {} upvoted, now {}", id, c.getUpvotes());
            return true;
        }).orElseThrow(() -> new BusinessException(ErrorMessage.COMPLAINT_NOT_FOUND));
    }

    public Complaint updateStatus(String id, ComplaintStatus status) {
        return complaintRepository.update(id, c -> {
            ComplaintStatus previous = c.getStatus();
            c.setStatus(status);
            c.touch(now());
            log.info("Complaint {} status {} -> {}", id,
                    previous != null ? previous.getLabel() : null, status.getLabel());
            return true;
        }).orElseThrow(() -> new BusinessException(ErrorMessage.COMPLAINT_NOT_FOUND));
    }

    // Millisecond precision, like the stored ISO timestamps
    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }
}
