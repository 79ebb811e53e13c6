package io.streamshub.tilde.format;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Directives recognized in templates. Codes are matched case-insensitively.
 */
public enum DirectiveType {
    /**
     * Human-readable rendering of the argument (~a)
     */
    ANY("a", 1, "Any", "(display arg) for humans"),

    /**
     * Machine-readable rendering of the argument (~s)
     */
    SLASHIFY("s", 1, "Slashified", "(write arg) for parsers"),

    /**
     * Machine-readable rendering with labels for shared structure (~w)
     */
    WRITE_SHARED("w", 1, "WriteCircular", "like ~s but outputs #n= and #n# labels for shared and cyclic structure"),

    /**
     * Integer in radix 10 (~d)
     */
    DECIMAL("d", 1, "Decimal", "the integer arg output in decimal radix"),

    /**
     * Integer in radix 16 (~x)
     */
    HEXADECIMAL("x", 1, "heXadecimal", "the integer arg output in hexadecimal radix"),

    /**
     * Integer in radix 8 (~o)
     */
    OCTAL("o", 1, "Octal", "the integer arg output in octal radix"),

    /**
     * Integer in radix 2 (~b)
     */
    BINARY("b", 1, "Binary", "the integer arg output in binary radix"),

    /**
     * A single character, verbatim (~c)
     */
    CHARACTER("c", 1, "Character", "the single character arg output verbatim"),

    /**
     * Pretty-printed list (~y)
     */
    PRETTY("y", 1, "Yuppify", "the list arg is pretty-printed"),

    /**
     * Sub-template and its argument list (~? or ~k)
     */
    INDIRECTION("?k", 2, "Indirection", "args are a template and a list of arguments for it"),

    /**
     * Fixed-format number or string (~w,dF)
     */
    FIXED("f", 1, "Fixed", "~w,dF right-justifies a number or string in width w with d fractional digits"),

    /**
     * Literal tilde (~~)
     */
    TILDE("~", 0, "tilde", "output a tilde"),

    /**
     * Tab character (~t)
     */
    TAB("t", 0, "Tab", "output a tab character"),

    /**
     * Newline character (~%)
     */
    NEWLINE("%", 0, "Newline", "output a newline character"),

    /**
     * Newline unless already at the start of a line (~&)
     */
    FRESHLINE("&", 0, "Freshline", "output a newline character if not already at the start of a line"),

    /**
     * Single space (~_)
     */
    SPACE("_", 0, "space", "output a single space character"),

    /**
     * This directive table as text (~h)
     */
    HELP("h", 0, "Help", "output this text");

    private static final Map<Character, DirectiveType> BY_CODE = new HashMap<>();

    static {
        for (DirectiveType type : values()) {
            for (char code : type.codes.toCharArray()) {
                BY_CODE.put(code, type);
            }
        }
    }

    private final String codes;
    private final int arity;
    private final String mnemonic;
    private final String description;

    DirectiveType(String codes, int arity, String mnemonic, String description) {
        this.codes = codes;
        this.arity = arity;
        this.mnemonic = mnemonic;
        this.description = description;
    }

    /**
     * Find the directive for a code character, ignoring case.
     *
     * @return the directive, or {@code null} when the code is unknown
     */
    public static DirectiveType forCode(char code) {
        return BY_CODE.get(Character.toLowerCase(code));
    }

    /**
     * All code characters accepted for this directive, lowercase.
     */
    public String codes() {
        return codes;
    }

    /**
     * Number of arguments the directive consumes.
     */
    public int arity() {
        return arity;
    }

    public boolean consumesArguments() {
        return arity > 0;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public String description() {
        return description;
    }

    /**
     * The canonical spelling, e.g. {@code ~A}.
     */
    public String display() {
        return "~" + codes.substring(0, 1).toUpperCase(Locale.ROOT);
    }

    /**
     * Every spelling including parameters, e.g. {@code ~? ~K} or {@code ~w,dF}.
     */
    public String synopsis() {
        if (this == FIXED) {
            return "~w,dF";
        }
        StringBuilder synopsis = new StringBuilder();
        for (char code : codes.toCharArray()) {
            if (synopsis.length() > 0) {
                synopsis.append(' ');
            }
            synopsis.append('~').append(Character.toUpperCase(code));
        }
        return synopsis.toString();
    }
}
