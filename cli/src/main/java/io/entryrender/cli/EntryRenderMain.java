package io.entryrender.cli;

/**
 * Entry point of the command-line renderer. Delegates to {@link RenderCli} and exits with its
 * status.
 */
public final class EntryRenderMain {

    private EntryRenderMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args e.g. {@code --config entry-render.yaml entry.xml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        System.exit(new RenderCli().run(args, System.out, System.err));
    }
}
