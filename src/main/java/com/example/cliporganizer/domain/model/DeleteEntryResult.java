package com.example.cliporganizer.domain.model;

public final class DeleteEntryResult {

    private static final DeleteEntryResult NOT_FOUND = new DeleteEntryResult(null);

    private final CatalogEntry deleted;

    private DeleteEntryResult(CatalogEntry deleted) {
        this.deleted = deleted;
    }

    public static DeleteEntryResult deleted(CatalogEntry entry) {
        return new DeleteEntryResult(entry);
    }

    public static DeleteEntryResult notFound() {
        return NOT_FOUND;
    }

    public boolean isDeleted() {
        return deleted != null;
    }

    /**
     * The entry as it was just before deletion, or null when nothing was deleted.
     */
    public CatalogEntry getDeleted() {
        return deleted;
    }
}
