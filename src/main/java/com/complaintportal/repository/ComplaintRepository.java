package com.complaintportal.repository;

import com.complaintportal.model.Complaint;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Authoritative holder of all complaints. Every method returns copies; callers never hold a
 * reference into the store.
 */
public interface ComplaintRepository {

    /** All complaints, newest {@code createdAt} first; ties keep insertion order. */
    List<Complaint> findAllNewestFirst();

    Optional<Complaint> findById(String id);

    /** Stores a new complaint under a freshly generated unique id and returns the stored copy. */
    Complaint append(Complaint complaint);

    /**
     * Applies {@code mutation} to the stored complaint. The mutation returns true when it changed
     * something, in which case the store is persisted.
     *
     * @return the complaint after the mutation, or empty if the id is unknown
     */
    Optional<Complaint> update(String id, Predicate<Complaint> mutation);
}
