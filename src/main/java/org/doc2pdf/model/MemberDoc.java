package org.doc2pdf.model;

/**
 * A single documented member of a type (constructor, property, method, event or field).
 */
public class MemberDoc {
    private final MemberKind kind;
    private final String signature;
    private final String modifiers;
    private final String summary;

    public MemberDoc(MemberKind kind, String signature, String modifiers, String summary) {
        this.kind = kind;
        this.signature = signature != null ? signature : "";
        this.modifiers = modifiers != null ? modifiers : "";
        this.summary = summary != null ? summary : "";
    }

    public MemberKind getKind() {
        return kind;
    }

    public String getSignature() {
        return signature;
    }

    public String getModifiers() {
        return modifiers;
    }

    public String getSummary() {
        return summary;
    }

    @Override
    public String toString() {
        return "MemberDoc{" +
                "kind=" + kind +
                ", signature='" + signature + '\'' +
                '}';
    }
}
