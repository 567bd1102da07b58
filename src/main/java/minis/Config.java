package minis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import minis.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;

/**
 * Server settings. {@code dir} and {@code dbfilename} are also readable and
 * writable at runtime through CONFIG; they are stored as given and never interpreted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String PARAM_DIR = "dir";
    public static final String PARAM_DB_FILENAME = "dbfilename";

    public String version = "0.1.0";
    public int port = 6379;
    public volatile String dir = "";
    public volatile String dbfilename = "dump.rdb";

    public Config() {
        // Default constructor for Jackson
    }

    public static Config load(String filename) {
        File f = new File(filename);
        Config config = new Config();

        if (!f.exists()) {
            Log.info("Config file not found: " + filename + ". Using defaults.");
            return config;
        }

        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            Config loaded = mapper.readValue(f, Config.class);
            if (loaded != null) config = loaded;
            Log.info("Loaded config from " + f.getPath());
        } catch (IOException e) {
            Log.warn("Failed to load config as YAML (" + e.getMessage() + "). Attempting legacy parse...");
            config = loadLegacy(f, new Config());
        }

        if (config.dir == null) config.dir = "";
        if (config.dbfilename == null) config.dbfilename = "";
        return config;
    }

    private static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new FileReader(f))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                String key = parts[0].toLowerCase();
                String val = parts.length < 2 ? "" : parts[1];

                switch (key) {
                    case "port":
                        config.port = parsePort(val);
                        break;
                    case PARAM_DIR:
                        config.dir = val;
                        break;
                    case PARAM_DB_FILENAME:
                        config.dbfilename = val;
                        break;
                    default:
                        Log.warn("Ignoring unknown config directive: " + key);
                }
            }
            Log.info("Loaded legacy config.");
        } catch (IOException | IllegalArgumentException e) {
            Log.error("Error loading legacy config: " + e.getMessage());
        }
        return config;
    }

    /**
     * Applies {@code --port}, {@code --dir} and {@code --dbfilename} flags, in either
     * {@code --flag value} or {@code --flag=value} form.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a bad port
     */
    public Config applyArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new IllegalArgumentException("Unexpected argument: " + arg);
            }
            String name = arg.substring(2);
            String value;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            } else {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for --" + name);
                }
                value = args[++i];
            }

            switch (name) {
                case "port":
                    port = parsePort(value);
                    break;
                case PARAM_DIR:
                    dir = value;
                    break;
                case PARAM_DB_FILENAME:
                    dbfilename = value;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: --" + name);
            }
        }
        return this;
    }

    private static int parsePort(String val) {
        try {
            int p = Integer.parseInt(val.trim());
            if (p < 0 || p > 65535) throw new IllegalArgumentException("Port out of range: " + val);
            return p;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + val);
        }
    }

    /**
     * Runtime value of a CONFIG parameter, or {@code null} if the name is not recognised.
     */
    public String getParameter(String name) {
        if (PARAM_DIR.equalsIgnoreCase(name)) return dir;
        if (PARAM_DB_FILENAME.equalsIgnoreCase(name)) return dbfilename;
        return null;
    }

    /**
     * Sets a CONFIG parameter.
     *
     * @return false if the name is not recognised
     */
    public boolean setParameter(String name, String value) {
        if (PARAM_DIR.equalsIgnoreCase(name)) {
            dir = value;
            return true;
        }
        if (PARAM_DB_FILENAME.equalsIgnoreCase(name)) {
            dbfilename = value;
            return true;
        }
        return false;
    }

    // Reported at startup only; nothing reads or writes this file.
    public String getDbFilePath() {
        return dir + "/" + dbfilename;
    }
}
