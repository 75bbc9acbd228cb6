package uk.gegc.docpond.features.document.domain.model;

/**
 * Storage key layout: {@code {collection}/{title}/...}, titles cleaned to filename-safe text.
 */
public final class StorageKeys {

    private static final int MAX_NAME_LENGTH = 100;

    private StorageKeys() {
    }

    /**
     * Keeps letters, digits, space, dash and underscore; spaces become dashes.
     */
    public static String cleanName(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length());
        text.codePoints()
                .filter(c -> Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_')
                .forEach(builder::appendCodePoint);
        String clean = builder.toString().strip().replace(' ', '-');
        return clean.length() > MAX_NAME_LENGTH ? clean.substring(0, MAX_NAME_LENGTH) : clean;
    }

    public static String documentPrefix(Document document) {
        return cleanName(document.getCollectionName()) + "/" + cleanName(document.getTitle());
    }

    public static String sourcePdf(String collectionName, String title) {
        return cleanName(collectionName) + "/" + cleanName(title) + "/" + cleanName(title) + ".pdf";
    }

    public static String thumbnail(Document document) {
        return documentPrefix(document) + "/" + cleanName(document.getTitle()) + "-cover.jpg";
    }

    public static String pagePdf(Document document, int pageNumber) {
        return documentPrefix(document) + "/" + pageNumber + "/page-" + pageNumber + ".pdf";
    }

    public static String pageOverlay(Document document, int pageNumber) {
        return documentPrefix(document) + "/" + pageNumber + "/page-" + pageNumber + "-bbox.png";
    }

    public static String pageImage(Document document, int pageNumber, int regionIndex) {
        return documentPrefix(document) + "/" + pageNumber + "/images/image_" + regionIndex + ".png";
    }
}
