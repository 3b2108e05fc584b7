package tw.gc.struggle.engine.services.scoring;

/**
 * Optional page information available at scoring time.
 *
 * @param pageContentHash  hash of the current page content, if collected
 * @param contentDifficulty 0..1 difficulty estimate from content analysis, or null
 */
public record PageContext(String pageContentHash, Double contentDifficulty) {

    public static final PageContext NONE = new PageContext(null, null);

    public double difficultyOrZero() {
        return contentDifficulty == null ? 0 : contentDifficulty;
    }
}
