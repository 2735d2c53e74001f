package com.complaintportal.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A citizen-submitted issue report.
 * <p>
 * The upvote count is derived from the upvoter set, so a stored {@code upvotes} value is
 * ignored on read and recomputed on write.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(value = "upvotes", allowGetters = true)
@JsonPropertyOrder({"id", "name", "issueType", "title", "description", "location",
        "status", "upvotes", "photoData", "upvoters", "createdAt", "updatedAt"})
public class Complaint {

    // Older data files used "_id"
    @JsonAlias("_id")
    private String id;

    private String name = "";
    private IssueType issueType;
    private String title;
    private String description;
    private String location;

    private ComplaintStatus status = ComplaintStatus.PENDING;

    // Client addresses, in the order they upvoted
    private Set<String> upvoters = new LinkedHashSet<>();

    // Inline encoded image, stored verbatim (null when absent)
    private String photoData;

    private Instant createdAt;
    private Instant updatedAt;

    public int getUpvotes() {
        return upvoters.size();
    }

    public void setUpvoters(Collection<String> upvoters) {
        this.upvoters = (upvoters == null) ? new LinkedHashSet<>() : new LinkedHashSet<>(upvoters);
    }

    /** @return true if the address had not upvoted before */
    public boolean addUpvoter(String address) {
        return upvoters.add(address);
    }

    /** Moves updatedAt forward, never before createdAt. */
    public void touch(Instant now) {
        this.updatedAt = (createdAt != null && now.isBefore(createdAt)) ? createdAt : now;
    }

    public Complaint copy() {
        Complaint c = new Complaint();
        c.id = id;
        c.name = name;
        c.issueType = issueType;
        c.title = title;
        c.description = description;
        c.location = location;
        c.status = status;
        c.upvoters = new LinkedHashSet<>(upvoters);
        c.photoData = photoData;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        return c;
    }
}
