package minis;

import minis.utils.Log;

/**
 * Entry point: {@code java -jar minis.jar [--port N] [--dir PATH] [--dbfilename NAME]}.
 * Settings come from {@code minis.yaml} when present; flags override the file.
 */
public class Minis {
    private static final String CONFIG_FILE = "minis.yaml";

    public static void printBanner(Config config) {
        Log.info("\n" +
                " __  __ _       _     \n" +
                "|  \\/  (_)_ __ (_)___ \n" +
                "| |\\/| | | '_ \\| / __|\n" +
                "| |  | | | | | | \\__ \\\n" +
                "|_|  |_|_|_| |_|_|___/\n" +
                "                      \n" +
                " :: Minis ::        (v" + config.version + ") \n" +
                " :: Engine ::       Java \n");
    }

    public static void main(String[] args) throws Exception {
        Config config;
        try {
            config = Config.load(CONFIG_FILE).applyArgs(args);
        } catch (IllegalArgumentException e) {
            Log.error(e.getMessage());
            Log.error("Usage: minis [--port N] [--dir PATH] [--dbfilename NAME]");
            System.exit(2);
            return;
        }

        printBanner(config);
        Log.info("Using directory: " + config.dir);
        Log.info("Using database file: " + config.getDbFilePath());

        MinisServer server = new MinisServer(config);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "minis-shutdown"));
        server.awaitTermination();
    }
}
