package io.ticketring.model;

public enum Slot {
    OLDEST("first", "oldest"),
    CURRENT("second", "current"),
    NEWEST("third", "newest");

    private final String documentName;
    private final String role;

    Slot(String documentName, String role) {
        this.documentName = documentName;
        this.role = role;
    }

    /** Field name used for this slot in the region cache document. */
    public String documentName() {
        return documentName;
    }

    public String role() {
        return role;
    }
}
