package org.calista.phonology.inventory;

import java.util.List;

/** Word-level result: AND over segments plus per-segment detail in word order. */
public final class WordCheck {
    public final String word;
    public final boolean valid;
    public final List<SegmentCheck> details;

    public WordCheck(String word, boolean valid, List<SegmentCheck> details) {
        this.word = word;
        this.valid = valid;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public static WordCheck of(String word, List<SegmentCheck> details) {
        boolean ok = true;
        for (SegmentCheck c : details) ok &= c.valid;
        return new WordCheck(word, ok, details);
    }

    @Override
    public String toString() {
        return word + (valid ? " ok" : " invalid") + " " + details;
    }
}
