package com.ptcg.engine.deck;

/**
 * Deck construction formats, looked up from a deck's format tag.
 */
public enum DeckFormat {
    STANDARD("Standard", 60, 60),
    EXPANDED("Expanded", 60, 60),
    LIMITED("Limited", 40, Integer.MAX_VALUE),
    /** Any tag that names no known format. Size is not checked. */
    CUSTOM("Custom", 0, Integer.MAX_VALUE);

    /** Copies allowed of any card other than basic Energy. */
    public static final int MAX_COPIES = 4;

    private final String tag;
    private final int minCards;
    private final int maxCards;

    DeckFormat(String tag, int minCards, int maxCards) {
        this.tag = tag;
        this.minCards = minCards;
        this.maxCards = maxCards;
    }

    public String getTag() {
        return tag;
    }

    public int getMinCards() {
        return minCards;
    }

    public int getMaxCards() {
        return maxCards;
    }

    /**
     * Resolve a format tag (case-insensitive). Unknown or missing tags are CUSTOM.
     */
    public static DeckFormat fromTag(String tag) {
        if (tag == null) {
            return CUSTOM;
        }
        for (DeckFormat format : values()) {
            if (format.tag.equalsIgnoreCase(tag.trim())) {
                return format;
            }
        }
        return CUSTOM;
    }
}
