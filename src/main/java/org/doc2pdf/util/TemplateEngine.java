package org.doc2pdf.util;

import org.doc2pdf.model.TypeDoc;

import java.util.function.UnaryOperator;

/**
 * Simple template engine for replacing placeholders in strings.
 */
public class TemplateEngine {

    /**
     * Applies a template to a documented type.
     *
     * @param template The template string with ${name}, ${kind}, ${namespace} placeholders
     * @param type The type supplying the values
     * @return The template with placeholders replaced
     */
    public static String applyTypeTemplate(String template, TypeDoc type) {
        return applyTypeTemplate(template, type, UnaryOperator.identity());
    }

    /**
     * Applies a template to a documented type, passing every substituted value through
     * {@code valueFilter} first. Literal template text is left untouched.
     */
    public static String applyTypeTemplate(String template, TypeDoc type, UnaryOperator<String> valueFilter) {
        if (template == null) {
            return "";
        }
        String result = template;
        result = result.replace("${name}", valueFilter.apply(type.getName()));
        result = result.replace("${kind}", valueFilter.apply(type.getKind()));
        result = result.replace("${namespace}", valueFilter.apply(type.getNamespace()));
        return result;
    }
}
