package com.raditha.structdiff.profile;

import java.util.regex.Pattern;

/**
 * Cheap pre-scan for conditional compilation directives.
 */
public final class DirectiveDetector {

    private static final Pattern DIRECTIVE = Pattern.compile(
            "^[ \\t]*#[ \\t]*(?:if|elif|else|endif|define|undef)(?![\\w$])",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE);

    private DirectiveDetector() {
    }

    /**
     * True when at least one line of {@code text} is a conditional compilation directive.
     */
    public static boolean hasConditionalDirectives(String text) {
        return text != null && text.indexOf('#') >= 0 && DIRECTIVE.matcher(text).find();
    }
}
