package db.pesa.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings. Sources, later ones win: classpath pesadb.properties, system properties
 * (pesadb.dataDir, pesadb.autoFlush), command-line arguments (--data-dir=PATH, --no-auto-flush).
 */
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "pesadb.properties";
    public static final String DATA_DIR = "pesadb.dataDir";
    public static final String AUTO_FLUSH = "pesadb.autoFlush";

    public final Path dataDir;
    public final boolean autoFlush;

    public EngineConfig(Path dataDir, boolean autoFlush) {
        this.dataDir = dataDir;
        this.autoFlush = autoFlush;
    }

    public static EngineConfig defaultConfig() {
        return new EngineConfig(Paths.get("data"), true);
    }

    public static EngineConfig load() {
        return fromArgs(new String[0]);
    }

    public static EngineConfig fromArgs(String[] args) {
        Properties props = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", RESOURCE, e.getMessage());
        }
        return fromSources(props, System.getProperties(), args);
    }

    static EngineConfig fromSources(Properties file, Properties system, String[] args) {
        EngineConfig defaults = defaultConfig();
        String dataDir = file.getProperty(DATA_DIR, defaults.dataDir.toString());
        boolean autoFlush = Boolean.parseBoolean(file.getProperty(AUTO_FLUSH, String.valueOf(defaults.autoFlush)));

        dataDir = system.getProperty(DATA_DIR, dataDir);
        if (system.getProperty(AUTO_FLUSH) != null) autoFlush = Boolean.parseBoolean(system.getProperty(AUTO_FLUSH));

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--data-dir=")) {
                dataDir = s.substring("--data-dir=".length());
            } else if (s.equals("--no-auto-flush")) {
                autoFlush = false;
            } else if (!s.isEmpty()) {
                log.warn("Ignoring unknown argument '{}'", s);
            }
        }
        return new EngineConfig(Paths.get(dataDir), autoFlush);
    }

    @Override
    public String toString() {
        return "EngineConfig{dataDir=" + dataDir + ", autoFlush=" + autoFlush + "}";
    }
}
