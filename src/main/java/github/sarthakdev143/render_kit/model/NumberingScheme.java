package github.sarthakdev143.render_kit.model;

import java.util.regex.Pattern;

/**
 * Frame numbering conventions, in detection order. The first scheme whose token occurs in a file name wins.
 */
public enum NumberingScheme {
    PRINTF(Pattern.compile("%(\\d*)d")),
    HOUDINI(Pattern.compile("\\$F(\\d*)")),
    HASH(Pattern.compile("#+")),
    PLAIN_NUMERIC(Pattern.compile("(\\d+)(?!.*\\d)"));

    private final Pattern token;

    NumberingScheme(Pattern token) {
        this.token = token;
    }

    public Pattern token() {
        return token;
    }
}
