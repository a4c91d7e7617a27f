package org.doc2pdf.model;

/**
 * Kinds of type members, in the order their tables appear in a rendered section.
 */
public enum MemberKind {
    CONSTRUCTOR("Constructors"),
    PROPERTY("Properties"),
    METHOD("Methods"),
    EVENT("Events"),
    FIELD("Fields");

    private final String sectionTitle;

    MemberKind(String sectionTitle) {
        this.sectionTitle = sectionTitle;
    }

    public String getSectionTitle() {
        return sectionTitle;
    }

    /**
     * Maps a member kind tag (as written in model files) to a member kind.
     * Enum constants are listed with the fields.
     *
     * @param tag The kind tag, e.g. "ctor", "method", "enum-member"
     * @return The matching kind, or null if the tag is unknown
     */
    public static MemberKind fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        switch (tag.trim().toLowerCase()) {
            case "ctor":
            case "constructor":
                return CONSTRUCTOR;
            case "property":
                return PROPERTY;
            case "method":
                return METHOD;
            case "event":
                return EVENT;
            case "field":
            case "enum-member":
                return FIELD;
            default:
                return null;
        }
    }
}
