package de.upb.sse.opweave.rewrite;

import de.upb.sse.opweave.model.Edit;

import java.util.Optional;

public final class RejectedEdit {
    public final Edit edit;
    public final ProposalResult result;
    /** Accepted edit the rejected one collided with, {@code null} for out-of-bounds rejections. */
    public final Edit conflictingEdit;

    public RejectedEdit(Edit edit, ProposalResult result, Edit conflictingEdit) {
        this.edit = edit;
        this.result = result;
        this.conflictingEdit = conflictingEdit;
    }

    public Optional<Edit> getConflictingEdit() {
        return Optional.ofNullable(conflictingEdit);
    }

    @Override
    public String toString() {
        return result + ": " + edit + (conflictingEdit != null ? " (collides with #" + conflictingEdit.candidateId + ")" : "");
    }
}
