package db.pesa.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import java.util.Properties;

import org.junit.jupiter.api.Test;

public class EngineConfigTest {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        for (int i = 0; i < kv.length; i += 2) p.setProperty(kv[i], kv[i + 1]);
        return p;
    }

    @Test
    void defaultsWhenNothingIsSet() {
        EngineConfig c = EngineConfig.fromSources(props(), props(), new String[0]);
        assertEquals(Paths.get("data"), c.dataDir);
        assertTrue(c.autoFlush);
    }

    @Test
    void laterSourcesWin() {
        Properties file = props(EngineConfig.DATA_DIR, "from-file", EngineConfig.AUTO_FLUSH, "false");
        EngineConfig fileOnly = EngineConfig.fromSources(file, props(), new String[0]);
        assertEquals(Paths.get("from-file"), fileOnly.dataDir);
        assertFalse(fileOnly.autoFlush);

        EngineConfig system = EngineConfig.fromSources(file,
            props(EngineConfig.DATA_DIR, "from-system", EngineConfig.AUTO_FLUSH, "true"), new String[0]);
        assertEquals(Paths.get("from-system"), system.dataDir);
        assertTrue(system.autoFlush);

        EngineConfig args = EngineConfig.fromSources(file, props(EngineConfig.DATA_DIR, "from-system"),
            new String[] {"--data-dir=from-args", "--no-auto-flush"});
        assertEquals(Paths.get("from-args"), args.dataDir);
        assertFalse(args.autoFlush);
    }

    @Test
    void unknownArgumentsAreIgnored() {
        EngineConfig c = EngineConfig.fromSources(props(), props(), new String[] {"--verbose", "", null});
        assertEquals(EngineConfig.defaultConfig().dataDir, c.dataDir);
        assertTrue(c.autoFlush);
    }
}
