package mirror;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Shared logger for the whole mirror run.
public class MirrorLogger {

    public static final Logger LOGGER = LoggerFactory.getLogger("SITE_MIRROR");

    private MirrorLogger() {
    }
}
