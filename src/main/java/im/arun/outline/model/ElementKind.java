package im.arun.outline.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of element roles the outline engine knows about.
 * Roles outside this set parse to {@link #OTHER}; the node keeps its raw token for rendering.
 */
public enum ElementKind {
    GENERIC("generic", Tier.LOW),
    LIST("list", Tier.MEDIUM),
    LISTITEM("listitem", Tier.MEDIUM),
    BUTTON("button", Tier.HIGH),
    LINK("link", Tier.HIGH),
    HEADING("heading", Tier.HIGH),
    SEARCHBOX("searchbox", Tier.HIGH),
    NAVIGATION("navigation", Tier.HIGH),
    MAIN("main", Tier.HIGH),
    FORM("form", Tier.HIGH),
    ARTICLE("article", Tier.HIGH),
    SECTION("section", Tier.HIGH),
    TEXTBOX("textbox", Tier.MEDIUM),
    CHECKBOX("checkbox", Tier.MEDIUM),
    RADIO("radio", Tier.MEDIUM),
    COMBOBOX("combobox", Tier.MEDIUM),
    TABLE("table", Tier.MEDIUM),
    ROW("row", Tier.NEUTRAL),
    CELL("cell", Tier.NEUTRAL),
    BANNER("banner", Tier.NEUTRAL),
    CONTENTINFO("contentinfo", Tier.NEUTRAL),
    REGION("region", Tier.NEUTRAL),
    DIALOG("dialog", Tier.NEUTRAL),
    MENU("menu", Tier.NEUTRAL),
    MENUITEM("menuitem", Tier.NEUTRAL),
    TAB("tab", Tier.NEUTRAL),
    TABLIST("tablist", Tier.NEUTRAL),
    OPTION("option", Tier.NEUTRAL),
    PARAGRAPH("paragraph", Tier.NEUTRAL),
    SEPARATOR("separator", Tier.LOW),
    IMG("img", Tier.LOW),
    TEXT("text", Tier.LOW),
    OTHER("", Tier.NEUTRAL);

    /**
     * Coarse importance bucket used by priority scoring.
     */
    public enum Tier {
        HIGH(3),
        MEDIUM(1),
        NEUTRAL(0),
        LOW(-2);

        private final int adjustment;

        Tier(int adjustment) {
            this.adjustment = adjustment;
        }

        public int getAdjustment() {
            return adjustment;
        }
    }

    private static final Map<String, ElementKind> BY_TOKEN = new HashMap<>();

    static {
        for (ElementKind kind : values()) {
            if (kind != OTHER) {
                BY_TOKEN.put(kind.token, kind);
            }
        }
    }

    private final String token;
    private final Tier tier;

    ElementKind(String token, Tier tier) {
        this.token = token;
        this.tier = tier;
    }

    public static ElementKind fromToken(String token) {
        if (token == null) {
            return OTHER;
        }
        return BY_TOKEN.getOrDefault(token.toLowerCase(Locale.ROOT), OTHER);
    }

    public String getToken() {
        return token;
    }

    public Tier getTier() {
        return tier;
    }

    /**
     * Whether the role counts toward the descendant-kind signature of a fingerprint.
     */
    public boolean isSignatureCounted() {
        switch (this) {
            case BUTTON:
            case LINK:
            case TEXT:
            case IMG:
            case HEADING:
            case CHECKBOX:
            case RADIO:
                return true;
            default:
                return false;
        }
    }

    /**
     * Whether an element of this role can be clicked or toggled by the automation layer.
     */
    public boolean isClickable() {
        switch (this) {
            case BUTTON:
            case LINK:
            case CHECKBOX:
            case RADIO:
                return true;
            default:
                return false;
        }
    }
}
