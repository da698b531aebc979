package io.entryrender.core.engine;

/**
 * Renderer-wide options.
 *
 * @param assetBasePath   path prefix for relative illustration references; a trailing slash is
 *                        added when missing
 * @param defaultLanguage language forms are filtered by at the root, or {@code null} / {@code "*"}
 *                        for no filtering
 */
public record RenderOptions(String assetBasePath, String defaultLanguage) {

    /** Default path relative illustration references are rewritten under. */
    public static final String DEFAULT_ASSET_BASE_PATH = "/static/images/";

    /** Asset path {@value #DEFAULT_ASSET_BASE_PATH}, no language filter. */
    public static final RenderOptions DEFAULT = new RenderOptions(DEFAULT_ASSET_BASE_PATH, null);

    public RenderOptions {
        if (assetBasePath == null || assetBasePath.isBlank()) {
            assetBasePath = DEFAULT_ASSET_BASE_PATH;
        } else if (!assetBasePath.endsWith("/")) {
            assetBasePath = assetBasePath.trim() + "/";
        } else {
            assetBasePath = assetBasePath.trim();
        }
        defaultLanguage = defaultLanguage != null && !defaultLanguage.isBlank() ? defaultLanguage.trim() : null;
    }
}
