package org.doc2pdf.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A documented type (class, struct, interface, record, enum, delegate) with its members
 * and nested types.
 */
public class TypeDoc {
    public static final String GLOBAL_NAMESPACE = "<global>";

    private final String kind;
    private final String name;
    private final String namespace;
    private final String modifiers;
    private final List<String> attributes;
    private final List<String> baseTypes;
    private final String summary;
    private final String filePath;
    private final String parent;

    private final Map<MemberKind, List<MemberDoc>> members = new EnumMap<>(MemberKind.class);
    private final List<TypeDoc> nestedTypes = new ArrayList<>();

    public TypeDoc(String kind, String name, String namespace, String modifiers,
                   List<String> attributes, List<String> baseTypes,
                   String summary, String filePath, String parent) {
        this.kind = kind != null ? kind : "";
        this.name = name != null ? name : "";
        this.namespace = namespace == null || namespace.trim().isEmpty() ? GLOBAL_NAMESPACE : namespace.trim();
        this.modifiers = modifiers != null ? modifiers : "";
        this.attributes = attributes != null ? new ArrayList<>(attributes) : new ArrayList<>();
        this.baseTypes = baseTypes != null ? new ArrayList<>(baseTypes) : new ArrayList<>();
        this.summary = summary != null ? summary : "";
        this.filePath = filePath != null ? filePath : "";
        this.parent = parent == null || parent.trim().isEmpty() ? null : parent.trim();
        for (MemberKind memberKind : MemberKind.values()) {
            members.put(memberKind, new ArrayList<>());
        }
    }

    public String getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getModifiers() {
        return modifiers;
    }

    public List<String> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    public List<String> getBaseTypes() {
        return Collections.unmodifiableList(baseTypes);
    }

    public String getSummary() {
        return summary;
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * @return The enclosing type's name, or null for a top-level type
     */
    public String getParent() {
        return parent;
    }

    /**
     * Display name, qualified with the parent's name for nested types.
     */
    public String getDisplayName() {
        return parent == null ? name : parent + "." + name;
    }

    /**
     * Compact declaration line, e.g. {@code public sealed class Foo : Base, IBar}.
     */
    public String getSignature() {
        StringBuilder sb = new StringBuilder();
        if (!modifiers.isEmpty()) {
            sb.append(modifiers).append(' ');
        }
        if (!kind.isEmpty()) {
            sb.append(kind).append(' ');
        }
        sb.append(name);
        if (!baseTypes.isEmpty()) {
            sb.append(" : ").append(String.join(", ", baseTypes));
        }
        return sb.toString().trim();
    }

    public void addMember(MemberDoc member) {
        members.get(member.getKind()).add(member);
    }

    public List<MemberDoc> getMembers(MemberKind memberKind) {
        return Collections.unmodifiableList(members.get(memberKind));
    }

    public void addNestedType(TypeDoc nested) {
        nestedTypes.add(nested);
    }

    public List<TypeDoc> getNestedTypes() {
        return Collections.unmodifiableList(nestedTypes);
    }

    /**
     * Returns this type followed by all nested types, depth-first in pre-order.
     */
    public List<TypeDoc> flatten() {
        List<TypeDoc> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(TypeDoc type, List<TypeDoc> result) {
        result.add(type);
        for (TypeDoc nested : type.nestedTypes) {
            collect(nested, result);
        }
    }

    @Override
    public String toString() {
        return "TypeDoc{" +
                "kind='" + kind + '\'' +
                ", name='" + getDisplayName() + '\'' +
                ", namespace='" + namespace + '\'' +
                '}';
    }
}
