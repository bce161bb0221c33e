package com.example.dyncms.service;

import com.example.dyncms.models.EntryState;
import org.springframework.stereotype.Component;

/**
 * Publishing state machine. A publish request from a non-privileged author is downgraded to
 * {@link EntryState#PENDING_APPROVAL} while content approval is switched on; it never fails.
 */
@Component
public class ContentWorkflow {

    public EntryState parseState(String requested) {
        if (requested == null || requested.isBlank()) {
            throw CmsException.validationFailed("State is required");
        }
        try {
            return EntryState.fromString(requested.trim());
        } catch (IllegalArgumentException ex) {
            throw CmsException.validationFailed("Unknown state '" + requested + "'");
        }
    }

    /**
     * Works out the state an entry ends up in.
     *
     * @param current the entry's present state
     * @param requested the state asked for
     * @param privileged whether the caller is an administrator
     * @param approvalRequired whether publishing by standard authors needs approval
     * @return the effective state, possibly equal to {@code current}
     */
    public EntryState resolve(EntryState current,
                              EntryState requested,
                              boolean privileged,
                              boolean approvalRequired) {
        if (requested == EntryState.DRAFT || requested == current) {
            return requested;
        }
        if (requested == EntryState.PUBLISHED) {
            return privileged || !approvalRequired ? EntryState.PUBLISHED : EntryState.PENDING_APPROVAL;
        }
        // requested is PENDING_APPROVAL here
        if (current == EntryState.DRAFT) {
            return EntryState.PENDING_APPROVAL;
        }
        throw CmsException.validationFailed("Cannot move entry from '" + current.wireName()
                + "' to '" + requested.wireName() + "'");
    }
}
