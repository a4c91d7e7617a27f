package org.doc2pdf.model;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Loads a documentation model from properties files.
 * <p>
 * Each file describes one type ({@code type.*} keys), its members ({@code member.N.*}) and
 * references to nested type files ({@code nested.N}), resolved relative to the file itself.
 * Numbered keys are read from 1 until the first missing index.
 */
public class TypeDocLoader {
    private final Logger logger;

    public TypeDocLoader(Logger logger) {
        this.logger = logger;
    }

    /**
     * Loads the type described by the given file, including all nested types.
     *
     * @param modelFile The root model file
     * @return The loaded type tree
     * @throws IOException If a file cannot be read or nested references form a cycle
     * @throws IllegalArgumentException If a mandatory key is missing
     */
    public TypeDoc load(Path modelFile) throws IOException {
        return load(modelFile, null, new HashSet<>());
    }

    private TypeDoc load(Path modelFile, String parentName, Set<Path> visiting) throws IOException {
        Path normalized = modelFile.toAbsolutePath().normalize();
        if (!visiting.add(normalized)) {
            throw new IOException("Cyclic nested type reference: " + normalized);
        }

        Properties props = loadProperties(normalized);

        String name = props.getProperty("type.name");
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing mandatory property 'type.name' in " + normalized);
        }

        String parent = props.getProperty("type.parent");
        if ((parent == null || parent.trim().isEmpty()) && parentName != null) {
            parent = parentName;
        }

        TypeDoc type = new TypeDoc(
                trimmed(props, "type.kind", "class"),
                name.trim(),
                trimmed(props, "type.namespace", ""),
                trimmed(props, "type.modifiers", ""),
                splitList(props.getProperty("type.attributes")),
                splitList(props.getProperty("type.baseTypes")),
                trimmed(props, "type.summary", ""),
                trimmed(props, "type.file", ""),
                parent);

        int index = 1;
        while (props.getProperty("member." + index + ".signature") != null) {
            String prefix = "member." + index + ".";
            String kindTag = props.getProperty(prefix + "kind");
            MemberKind kind = MemberKind.fromTag(kindTag);
            if (kind == null) {
                logger.warning("Skipping member " + index + " of " + name + ": unknown kind '" + kindTag + "'");
            } else {
                type.addMember(new MemberDoc(kind,
                        trimmed(props, prefix + "signature", ""),
                        trimmed(props, prefix + "modifiers", ""),
                        trimmed(props, prefix + "summary", "")));
            }
            index++;
        }

        index = 1;
        String nestedRef;
        while ((nestedRef = props.getProperty("nested." + index)) != null) {
            if (!nestedRef.trim().isEmpty()) {
                Path nestedFile = normalized.resolveSibling(nestedRef.trim());
                type.addNestedType(load(nestedFile, type.getDisplayName(), visiting));
            }
            index++;
        }

        visiting.remove(normalized);
        logger.fine("Loaded " + type + " from " + normalized);
        return type;
    }

    private static Properties loadProperties(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(new FileInputStream(file.toFile()), StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        return props;
    }

    private static String trimmed(Properties props, String key, String defaultValue) {
        String value = props.getProperty(key);
        return value != null ? value.trim() : defaultValue;
    }

    private static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        for (String part : value.split(",")) {
            if (!part.trim().isEmpty()) {
                result.add(part.trim());
            }
        }
        return result;
    }
}
