package eu.virtualparadox.laysum.util;

public class LuceneConstants {
    public static final String FIELD_ORDINAL = "ordinal";
    public static final String FIELD_TEXT = "text";

    private LuceneConstants() {
        // prevent instantiation
    }
}
