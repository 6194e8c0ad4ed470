package com.example.cliporganizer.domain.model;

/**
 * Outcome of creating a catalog entry: either the new id, or a conflict with an existing location.
 */
public final class CreateEntryResult {

    private final Long id;
    private final Long conflictingId;

    private CreateEntryResult(Long id, Long conflictingId) {
        this.id = id;
        this.conflictingId = conflictingId;
    }

    public static CreateEntryResult created(Long id) {
        return new CreateEntryResult(id, null);
    }

    /**
     * @param conflictingId id of the clip that already owns the location, or null when it is not known
     */
    public static CreateEntryResult duplicate(Long conflictingId) {
        return new CreateEntryResult(null, conflictingId);
    }

    public boolean isCreated() {
        return id != null;
    }

    public boolean isDuplicate() {
        return id == null;
    }

    public Long getId() {
        return id;
    }

    public Long getConflictingId() {
        return conflictingId;
    }
}
