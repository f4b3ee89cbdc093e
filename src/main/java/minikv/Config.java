package minikv;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import minikv.utils.Log;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_FILE = "minikv.yaml";

    public String host = "127.0.0.1";
    public int port = 6379;
    public int readBufferSize = 512; // bytes per socket read
    public int statsIntervalSeconds = 0; // 0 disables the stats line
    public boolean debug = false;

    public Config() {
        // Default constructor for Jackson
    }

    /**
     * Loads {@code filename} from disk, falling back to a classpath resource of the same
     * name and then to defaults. {@code MINIKV_HOST} and {@code MINIKV_PORT} override the file.
     */
    public static Config load(String filename) {
        Config config = new Config();
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        File f = new File(filename);
        try {
            if (f.exists()) {
                config = mapper.readValue(f, Config.class);
                Log.info("Loaded config from " + f.getPath());
            } else {
                try (InputStream in = Config.class.getClassLoader().getResourceAsStream(filename)) {
                    if (in != null) {
                        config = mapper.readValue(in, Config.class);
                    } else {
                        Log.warn("Config file not found: " + filename + ". Using defaults.");
                    }
                }
            }
        } catch (IOException e) {
            Log.warn("Failed to load config " + filename + " (" + e.getMessage() + "). Using defaults.");
            config = new Config();
        }

        config.applyEnvironment(System.getenv("MINIKV_HOST"), System.getenv("MINIKV_PORT"));
        config.validate();
        return config;
    }

    void applyEnvironment(String envHost, String envPort) {
        if (envHost != null && !envHost.isBlank()) {
            host = envHost.trim();
        }
        if (envPort != null && !envPort.isBlank()) {
            try {
                port = Integer.parseInt(envPort.trim());
            } catch (NumberFormatException e) {
                Log.warn("Ignoring MINIKV_PORT=" + envPort + ": not a number");
            }
        }
    }

    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException("readBufferSize must be positive: " + readBufferSize);
        }
        if (statsIntervalSeconds < 0) {
            throw new IllegalArgumentException("statsIntervalSeconds must not be negative: " + statsIntervalSeconds);
        }
    }
}
